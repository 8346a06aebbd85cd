package com.numaansystems.custody.lifecycle;

import java.time.Instant;
import java.util.List;

/**
 * An access token that is valid for at least the safety margin.
 *
 * @param accessToken bearer token for Google APIs
 * @param expiresAt when Google will stop accepting it
 * @param scopes scopes the token was granted
 */
public record ValidAccessToken(String accessToken, Instant expiresAt, List<String> scopes) {

    @Override
    public String toString() {
        return "ValidAccessToken[expiresAt=" + expiresAt + ", scopes=" + scopes + "]";
    }
}
