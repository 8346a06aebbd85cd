package com.numaansystems.custody.error;

/**
 * The OAuth state parameter was tampered with, expired, or already used. The user has to restart the consent flow.
 */
public class InvalidStateException extends CustodyException {

    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "invalid_state";
    }
}
