package com.numaansystems.custody.error;

/**
 * A call to Google did not complete within the configured timeout. Safe to retry.
 */
public class UpstreamTimeoutException extends CustodyException {

    public UpstreamTimeoutException(String message) {
        super(message);
    }

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "upstream_timeout";
    }
}
