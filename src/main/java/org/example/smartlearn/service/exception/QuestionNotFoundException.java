package org.example.smartlearn.service.exception;

public class QuestionNotFoundException extends AssessmentException {

    private final Long questionId;

    public QuestionNotFoundException(Long questionId) {
        super("question_not_found", "No canonical answer for question " + questionId);
        this.questionId = questionId;
    }

    public Long getQuestionId() {
        return questionId;
    }
}
