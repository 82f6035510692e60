package com.verifymyprovider.api.error;

/**
 * Exception thrown when an identity repeats a submission or vote it is only allowed once.
 */
public class DuplicateSubmissionException extends RuntimeException {

    public DuplicateSubmissionException(String message) {
        super(message);
    }

    public DuplicateSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
