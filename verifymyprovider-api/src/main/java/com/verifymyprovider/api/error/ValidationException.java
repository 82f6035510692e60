package com.verifymyprovider.api.error;

/**
 * Exception thrown when a request lacks a required signal or names something invalid.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
