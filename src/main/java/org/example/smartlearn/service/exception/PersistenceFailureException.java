package org.example.smartlearn.service.exception;

/**
 * The attempt batch could not be written. No rows from the batch were kept and the session
 * may be submitted again.
 */
public class PersistenceFailureException extends AssessmentException {

    public PersistenceFailureException(String message, Throwable cause) {
        super("persistence_failure", message, cause);
    }
}
