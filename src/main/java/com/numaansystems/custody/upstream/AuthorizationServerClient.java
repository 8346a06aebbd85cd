package com.numaansystems.custody.upstream;

import com.numaansystems.custody.error.RefreshTokenRejectedException;
import com.numaansystems.custody.error.UpstreamExchangeException;
import com.numaansystems.custody.error.UpstreamTimeoutException;

/**
 * Calls to the third-party authorization server. Every call is synchronous
 * and bounded by the configured timeouts; none of them retries.
 */
public interface AuthorizationServerClient {

    /**
     * Redeems an authorization code.
     *
     * @param code the single-use code from the callback
     * @param redirectUri the redirect URI used when the flow began
     * @return the granted tokens
     * @throws UpstreamExchangeException on a non-2xx status or malformed response
     * @throws UpstreamTimeoutException if the call timed out
     */
    TokenGrant exchangeCode(String code, String redirectUri);

    /**
     * Obtains a new access token.
     *
     * @param refreshToken the stored refresh token
     * @return the refreshed tokens; the refresh token is only set when rotated
     * @throws RefreshTokenRejectedException if the refresh token itself is no longer valid
     * @throws UpstreamExchangeException on any other failure
     * @throws UpstreamTimeoutException if the call timed out
     */
    TokenGrant refresh(String refreshToken);

    /**
     * Asks the authorization server to invalidate a token. A token that is
     * already invalid counts as revoked.
     *
     * @param token refresh or access token
     * @throws UpstreamExchangeException if the server reported a failure
     * @throws UpstreamTimeoutException if the call timed out
     */
    void revoke(String token);
}
