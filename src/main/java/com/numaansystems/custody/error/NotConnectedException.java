package com.numaansystems.custody.error;

/**
 * No credential is stored for the user; the consent flow has never completed or the user was disconnected.
 */
public class NotConnectedException extends CustodyException {

    public NotConnectedException(String message) {
        super(message);
    }

    public NotConnectedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "not_connected";
    }
}
