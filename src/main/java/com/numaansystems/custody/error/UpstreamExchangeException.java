package com.numaansystems.custody.error;

/**
 * A call to Google failed: non-2xx status, malformed response, or a transport error other than a timeout. Safe to retry; nothing local was changed.
 */
public class UpstreamExchangeException extends CustodyException {

    public UpstreamExchangeException(String message) {
        super(message);
    }

    public UpstreamExchangeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "upstream_exchange_failed";
    }
}
