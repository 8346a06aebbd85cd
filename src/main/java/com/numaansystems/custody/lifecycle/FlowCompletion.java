package com.numaansystems.custody.lifecycle;

import com.numaansystems.custody.store.UserIdentity;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a successful consent callback.
 *
 * @param user the user that is now connected
 * @param scopes scopes granted by the user
 * @param expiresAt expiry of the first access token
 * @param refreshTokenIssued whether Google issued a refresh token on this exchange
 */
public record FlowCompletion(UserIdentity user, List<String> scopes, Instant expiresAt, boolean refreshTokenIssued) {
}
