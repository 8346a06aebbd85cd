package com.numaansystems.custody.error;

/**
 * The X-API-Key header was missing or did not match the internal secret.
 */
public class UnauthorizedCallerException extends CustodyException {

    public UnauthorizedCallerException() {
        super("access denied");
    }

    @Override
    public String errorCode() {
        return "access_denied";
    }
}
