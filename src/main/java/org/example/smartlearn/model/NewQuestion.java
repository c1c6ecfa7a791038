package org.example.smartlearn.model;

public record NewQuestion(
        String question,
        String optionA,
        String optionB,
        String optionC,
        String optionD,
        String answer,
        String subject,
        String chapter,
        String topic,
        String difficulty,
        String type
) {
}
