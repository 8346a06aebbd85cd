package com.numaansystems.custody.error;

/**
 * A request parameter is missing or malformed.
 */
public class InvalidRequestException extends CustodyException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "invalid_request";
    }
}
