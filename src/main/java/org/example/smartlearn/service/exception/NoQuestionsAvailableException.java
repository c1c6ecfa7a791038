package org.example.smartlearn.service.exception;

public class NoQuestionsAvailableException extends AssessmentException {

    public NoQuestionsAvailableException(String subject) {
        super("no_questions_available", subject == null
                ? "No questions are available"
                : "No questions are available for subject " + subject);
    }
}
