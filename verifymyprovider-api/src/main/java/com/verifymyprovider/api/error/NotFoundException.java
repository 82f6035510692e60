package com.verifymyprovider.api.error;

/**
 * Exception thrown when a referenced provider, plan, verification or conflict does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
