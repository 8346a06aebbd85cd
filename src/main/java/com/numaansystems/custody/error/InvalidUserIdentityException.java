package com.numaansystems.custody.error;

/**
 * The supplied user identity is empty, too long, or contains control characters.
 */
public class InvalidUserIdentityException extends InvalidRequestException {

    public InvalidUserIdentityException(String message) {
        super(message);
    }
}
