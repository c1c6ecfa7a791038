package org.example.smartlearn.service.exception;

/**
 * Base type for failures raised by the assessment core. Every failure carries a stable code
 * that callers can branch on without parsing the message.
 */
public abstract class AssessmentException extends RuntimeException {

    private final String code;

    protected AssessmentException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected AssessmentException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
