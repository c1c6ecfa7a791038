package org.example.smartlearn.service.exception;

import org.example.smartlearn.model.SessionStatus;

/**
 * The requested operation is not allowed in the learner's current session state. Nothing was changed.
 */
public class InvalidSessionStateException extends AssessmentException {

    private final SessionStatus status;

    public InvalidSessionStateException(SessionStatus status, String message) {
        super("invalid_session_state", message);
        this.status = status;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
