package com.numaansystems.custody.error;

/**
 * The stored credential can no longer be refreshed. The caller must send the user through the consent flow again.
 */
public class ReauthRequiredException extends CustodyException {

    public ReauthRequiredException(String message) {
        super(message);
    }

    public ReauthRequiredException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "reauth_required";
    }
}
