package com.numaansystems.custody.upstream;

import java.time.Duration;
import java.util.List;

/**
 * Tokens returned by Google's token endpoint.
 *
 * @param accessToken the new access token
 * @param refreshToken a refresh token, null when Google did not issue or rotate one
 * @param expiresIn lifetime of the access token
 * @param scopes granted scopes, null when the response carried none
 * @param tokenType usually {@code Bearer}
 */
public record TokenGrant(
        String accessToken,
        String refreshToken,
        Duration expiresIn,
        List<String> scopes,
        String tokenType) {

    @Override
    public String toString() {
        return "TokenGrant[expiresIn=" + expiresIn + ", hasRefreshToken=" + (refreshToken != null)
                + ", scopes=" + scopes + ", tokenType=" + tokenType + "]";
    }
}
