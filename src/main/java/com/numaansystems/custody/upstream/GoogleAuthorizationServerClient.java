package com.numaansystems.custody.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.custody.config.CustodyProperties;
import com.numaansystems.custody.error.RefreshTokenRejectedException;
import com.numaansystems.custody.error.UpstreamExchangeException;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.core.AuthorizationGrantType;
import org.springframework.security.oauth2.core.endpoint.OAuth2ParameterNames;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * {@link AuthorizationServerClient} for Google's OAuth 2.0 endpoints.
 *
 * <p>Code exchange and refresh are form posts to the token endpoint with the
 * client credentials in the body. Revocation posts the token to the revoke
 * endpoint; Google answers 400 for a token that is already invalid, which is
 * treated as success.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class GoogleAuthorizationServerClient implements AuthorizationServerClient {

    private static final Logger logger = LoggerFactory.getLogger(GoogleAuthorizationServerClient.class);

    private static final String INVALID_GRANT = "invalid_grant";

    private final CustodyProperties.Google google;
    private final UpstreamHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GoogleAuthorizationServerClient(CustodyProperties.Google google,
                                           UpstreamHttpClient httpClient,
                                           ObjectMapper objectMapper) {
        this.google = google;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public TokenGrant exchangeCode(String code, String redirectUri) {
        ensureClientConfigured();
        HttpPost request = formPost(google.tokenUri(), List.of(
                new BasicNameValuePair(OAuth2ParameterNames.CODE, code),
                new BasicNameValuePair(OAuth2ParameterNames.CLIENT_ID, google.clientId()),
                new BasicNameValuePair(OAuth2ParameterNames.CLIENT_SECRET, google.clientSecret()),
                new BasicNameValuePair(OAuth2ParameterNames.REDIRECT_URI, redirectUri),
                new BasicNameValuePair(OAuth2ParameterNames.GRANT_TYPE,
                        AuthorizationGrantType.AUTHORIZATION_CODE.getValue())));

        UpstreamResponse response = httpClient.execute(request, "Token exchange");
        if (!response.isSuccess()) {
            logger.error("Token exchange failed with status {}: {}", response.status(), response.excerpt());
            throw new UpstreamExchangeException(
                    "Token exchange failed: " + response.status() + " " + response.excerpt());
        }
        return parseGrant(response, "Token exchange");
    }

    @Override
    public TokenGrant refresh(String refreshToken) {
        ensureClientConfigured();
        if (refreshToken == null || refreshToken.isEmpty()) {
            throw new IllegalArgumentException("refreshToken is required");
        }
        HttpPost request = formPost(google.tokenUri(), List.of(
                new BasicNameValuePair(OAuth2ParameterNames.CLIENT_ID, google.clientId()),
                new BasicNameValuePair(OAuth2ParameterNames.CLIENT_SECRET, google.clientSecret()),
                new BasicNameValuePair(OAuth2ParameterNames.REFRESH_TOKEN, refreshToken),
                new BasicNameValuePair(OAuth2ParameterNames.GRANT_TYPE,
                        AuthorizationGrantType.REFRESH_TOKEN.getValue())));

        UpstreamResponse response = httpClient.execute(request, "Token refresh");
        if (!response.isSuccess()) {
            if ((response.status() == 400 || response.status() == 401)
                    && INVALID_GRANT.equals(errorCode(response))) {
                logger.warn("Refresh token rejected by authorization server");
                throw new RefreshTokenRejectedException("Refresh token was revoked or expired");
            }
            logger.error("Token refresh failed with status {}: {}", response.status(), response.excerpt());
            throw new UpstreamExchangeException(
                    "Token refresh failed: " + response.status() + " " + response.excerpt());
        }
        return parseGrant(response, "Token refresh");
    }

    @Override
    public void revoke(String token) {
        HttpPost request = formPost(google.revokeUri(), List.of(
                new BasicNameValuePair(OAuth2ParameterNames.TOKEN, token)));

        UpstreamResponse response = httpClient.execute(request, "Token revocation");
        if (response.status() == 200) {
            logger.debug("Token revoked upstream");
            return;
        }
        if (response.status() == 400) {
            logger.debug("Token was already invalid upstream: {}", response.excerpt());
            return;
        }
        throw new UpstreamExchangeException(
                "Token revocation failed: " + response.status() + " " + response.excerpt());
    }

    private void ensureClientConfigured() {
        if (!google.isClientConfigured()) {
            throw new IllegalStateException("custody.google.client-id and client-secret must be configured");
        }
    }

    private static HttpPost formPost(String uri, List<NameValuePair> form) {
        HttpPost request = new HttpPost(uri);
        request.setHeader("Accept", "application/json");
        request.setEntity(new UrlEncodedFormEntity(form, StandardCharsets.UTF_8));
        return request;
    }

    private TokenGrant parseGrant(UpstreamResponse response, String operation) {
        JsonNode json = readJson(response.body());
        if (json == null || !json.isObject()) {
            throw new UpstreamExchangeException(operation + " returned a malformed response");
        }
        String accessToken = json.path(OAuth2ParameterNames.ACCESS_TOKEN).asText("");
        if (accessToken.isEmpty()) {
            throw new UpstreamExchangeException(operation + " response did not include an access token");
        }
        String refreshToken = json.path(OAuth2ParameterNames.REFRESH_TOKEN).asText("");
        long expiresIn = Math.max(0L, json.path(OAuth2ParameterNames.EXPIRES_IN).asLong(0L));
        String scope = json.path(OAuth2ParameterNames.SCOPE).asText("");

        return new TokenGrant(
                accessToken,
                refreshToken.isEmpty() ? null : refreshToken,
                Duration.ofSeconds(expiresIn),
                scope.isBlank() ? null : Arrays.asList(scope.trim().split("\\s+")),
                json.path(OAuth2ParameterNames.TOKEN_TYPE).asText(null));
    }

    private String errorCode(UpstreamResponse response) {
        JsonNode json = readJson(response.body());
        return json == null ? null : json.path(OAuth2ParameterNames.ERROR).asText(null);
    }

    private JsonNode readJson(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            logger.debug("Upstream body is not JSON: {}", e.getMessage());
            return null;
        }
    }
}
