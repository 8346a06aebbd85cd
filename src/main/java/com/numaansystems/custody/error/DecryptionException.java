package com.numaansystems.custody.error;

/**
 * A stored ciphertext could not be opened: corrupted, truncated, or sealed with a key this process does not hold.
 */
public class DecryptionException extends CustodyException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "credential_unusable";
    }
}
