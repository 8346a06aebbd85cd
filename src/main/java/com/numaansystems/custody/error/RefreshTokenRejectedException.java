package com.numaansystems.custody.error;

/**
 * Google explicitly rejected a refresh token ({@code invalid_grant}): it was
 * revoked by the user, expired, or superseded.
 *
 * <p>Unlike its parent this is not retryable. The lifecycle manager purges the
 * stored credential and reports {@link ReauthRequiredException} instead, so
 * this type never reaches an HTTP caller.</p>
 */
public class RefreshTokenRejectedException extends UpstreamExchangeException {

    public RefreshTokenRejectedException(String message) {
        super(message);
    }
}
