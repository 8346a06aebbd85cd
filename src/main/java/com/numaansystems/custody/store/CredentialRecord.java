package com.numaansystems.custody.store;

import java.time.Instant;
import java.util.List;

/**
 * Persisted form of a user's credential. Token fields hold ciphertext
 * produced by the credential cipher, never plaintext.
 *
 * @param userId primary key
 * @param accessTokenCiphertext sealed access token
 * @param refreshTokenCiphertext sealed refresh token, null when Google never issued one
 * @param expiresAt absolute expiry of the access token
 * @param scopes granted scopes in the order Google reported them
 * @param createdAt when the user first connected
 * @param updatedAt last write; later writes win
 */
public record CredentialRecord(
        String userId,
        String accessTokenCiphertext,
        String refreshTokenCiphertext,
        Instant expiresAt,
        List<String> scopes,
        Instant createdAt,
        Instant updatedAt) {

    public CredentialRecord {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    @Override
    public String toString() {
        return "CredentialRecord[userId=" + userId + ", expiresAt=" + expiresAt
                + ", hasRefreshToken=" + (refreshTokenCiphertext != null) + ", updatedAt=" + updatedAt + "]";
    }
}
