package com.numaansystems.custody.store;

import com.numaansystems.custody.error.InvalidUserIdentityException;

/**
 * Caller-supplied identifier of an end user; the key of all per-user state.
 *
 * <p>Values are untrusted input. They are trimmed, must not be empty, may
 * not exceed the width of the {@code user_id} column, and may not contain
 * control characters.</p>
 *
 * @param value the sanitized identifier
 */
public record UserIdentity(String value) {

    public static final int MAX_LENGTH = 255;

    public UserIdentity {
        if (value == null || value.isEmpty()) {
            throw new InvalidUserIdentityException("user_id is required");
        }
        if (value.length() > MAX_LENGTH) {
            throw new InvalidUserIdentityException("user_id must be at most " + MAX_LENGTH + " characters");
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                throw new InvalidUserIdentityException("user_id must not contain control characters");
            }
        }
    }

    /**
     * Sanitizes raw input into an identity.
     *
     * @param raw the value as received, may be null
     * @return the identity
     * @throws InvalidUserIdentityException if the value is not acceptable
     */
    public static UserIdentity of(String raw) {
        return new UserIdentity(raw == null ? null : raw.trim());
    }

    @Override
    public String toString() {
        return value;
    }
}
