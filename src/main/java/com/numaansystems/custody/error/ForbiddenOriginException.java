package com.numaansystems.custody.error;

/**
 * The caller's address is not on the internal allow-list, or the allow-list
 * is misconfigured and therefore denies everyone.
 */
public class ForbiddenOriginException extends CustodyException {

    public ForbiddenOriginException() {
        super("access denied");
    }

    @Override
    public String errorCode() {
        return "access_denied";
    }
}
