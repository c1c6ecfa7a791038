package org.example.smartlearn.model;

public record QuestionAddResult(
        Long questionId,
        boolean created
) {
}
