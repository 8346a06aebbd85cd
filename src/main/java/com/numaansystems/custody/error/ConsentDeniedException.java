package com.numaansystems.custody.error;

/**
 * The user declined consent, or Google reported an error on the callback.
 */
public class ConsentDeniedException extends CustodyException {

    public ConsentDeniedException(String message) {
        super(message);
    }

    public ConsentDeniedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "consent_denied";
    }
}
