package com.numaansystems.custody.state;

import java.time.Instant;

/**
 * Contents of a verified OAuth state parameter.
 *
 * @param userIdentity the user the consent flow was started for
 * @param nonce random value unique to this flow instance
 * @param issuedAt when the state was issued
 * @param expiresAt first instant at which the state is no longer accepted
 */
public record FlowState(String userIdentity, String nonce, Instant issuedAt, Instant expiresAt) {
}
