package org.example.smartlearn.service.exception;

public class NoActiveSessionException extends AssessmentException {

    public NoActiveSessionException(String studentId) {
        super("no_active_session", "No quiz session exists for student " + studentId);
    }
}
