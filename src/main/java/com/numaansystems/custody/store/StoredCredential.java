package com.numaansystems.custody.store;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Decrypted view of a stored credential. Only ever held for the duration of
 * a single request; {@link #toString()} never prints token values.
 */
public record StoredCredential(
        String accessToken,
        String refreshToken,
        Instant expiresAt,
        List<String> scopes,
        Instant createdAt,
        Instant updatedAt) {

    public StoredCredential {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isEmpty();
    }

    /**
     * @param now the current time
     * @param safetyMargin how long before expiry the token stops being handed out
     * @return true if the access token can be returned without refreshing
     */
    public boolean isUsableAt(Instant now, Duration safetyMargin) {
        return expiresAt != null && now.isBefore(expiresAt.minus(safetyMargin));
    }

    @Override
    public String toString() {
        return "StoredCredential[expiresAt=" + expiresAt + ", hasRefreshToken=" + hasRefreshToken()
                + ", scopes=" + scopes + ", updatedAt=" + updatedAt + "]";
    }
}
