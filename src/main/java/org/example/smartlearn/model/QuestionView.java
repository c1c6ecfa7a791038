package org.example.smartlearn.model;

import java.util.List;

public record QuestionView(
        Long id,
        String question,
        List<String> options,
        String subject,
        String chapter,
        String topic,
        String difficulty
) {
}
