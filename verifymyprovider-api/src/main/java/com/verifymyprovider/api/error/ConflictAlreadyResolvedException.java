package com.verifymyprovider.api.error;

/**
 * Exception thrown when resolving an import conflict that already has an outcome.
 */
public class ConflictAlreadyResolvedException extends RuntimeException {

    public ConflictAlreadyResolvedException(String message) {
        super(message);
    }

    public ConflictAlreadyResolvedException(String message, Throwable cause) {
        super(message, cause);
    }
}
