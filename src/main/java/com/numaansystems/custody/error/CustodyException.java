package com.numaansystems.custody.error;

/**
 * Base class of every failure the custody service reports to its callers.
 *
 * <p>Each subclass carries a stable, machine-readable error code that ends up
 * in the {@code error} field of the JSON response. Messages must never contain
 * token material.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public abstract class CustodyException extends RuntimeException {

    protected CustodyException(String message) {
        super(message);
    }

    protected CustodyException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the error code reported to callers, e.g. {@code not_connected}
     */
    public abstract String errorCode();
}
