package com.numaansystems.custody.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.custody.error.RefreshTokenRejectedException;
import com.numaansystems.custody.error.UpstreamExchangeException;
import com.numaansystems.custody.error.UpstreamTimeoutException;
import com.numaansystems.custody.store.StoredCredential;
import com.numaansystems.custody.store.TokenStore;
import com.numaansystems.custody.store.UserIdentity;
import com.numaansystems.custody.support.TestKeys;
import com.numaansystems.custody.upstream.AuthorizationServerClient;
import com.numaansystems.custody.upstream.TokenGrant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Tests the consent flow and token endpoints through the full filter chain,
 * with Google replaced by a mock.
 */
@SpringBootTest
@AutoConfigureMockMvc
class OAuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TokenStore tokenStore;

    @MockBean
    private AuthorizationServerClient authorizationServer;

    @Test
    @DisplayName("Should return a Google consent URL")
    void testAuthorizationUrl() throws Exception {
        mockMvc.perform(get("/auth/google/url").param("user_id", "url-user"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.auth_url", startsWith("https://accounts.google.com/o/oauth2/v2/auth?")));
    }

    @Test
    @DisplayName("Should reject a consent URL request without user id")
    void testAuthorizationUrlWithoutUser() throws Exception {
        mockMvc.perform(get("/auth/google/url"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    @DisplayName("Should connect a user, hand out the token, and report not connected after revoke")
    void testConsentFlow() throws Exception {
        String state = stateFor("flow-user");
        when(authorizationServer.exchangeCode(eq("code-1"), anyString())).thenReturn(
                new TokenGrant("ya29.flow", "1//flow", Duration.ofSeconds(3600), List.of("scope-a"), "Bearer"));

        mockMvc.perform(get("/auth/google/callback").param("code", "code-1").param("state", state))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connected").value(true))
                .andExpect(jsonPath("$.user_id").value("flow-user"))
                .andExpect(jsonPath("$.scopes[0]").value("scope-a"))
                .andExpect(jsonPath("$.expires_at").exists());
        verify(authorizationServer).exchangeCode("code-1", "http://localhost:8000/auth/google/callback");

        MvcResult tokenResult = mockMvc.perform(get("/auth/google/token").param("user_id", "flow-user")
                        .header("X-API-Key", TestKeys.INTERNAL_API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.access_token").value("ya29.flow"))
                .andExpect(jsonPath("$.scopes[0]").value("scope-a"))
                .andReturn();
        Instant expiresAt = Instant.parse(objectMapper.readTree(tokenResult.getResponse().getContentAsString())
                .path("expires_at").asText());
        assertTrue(expiresAt.isAfter(Instant.now().plusSeconds(3000)), "Token should expire about an hour from now");
        verify(authorizationServer, never()).refresh(anyString());

        mockMvc.perform(post("/auth/google/revoke").param("user_id", "flow-user")
                        .header("X-API-Key", TestKeys.INTERNAL_API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revoked").value(true));
        verify(authorizationServer).revoke("1//flow");

        mockMvc.perform(get("/auth/google/token").param("user_id", "flow-user")
                        .header("X-API-Key", TestKeys.INTERNAL_API_KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_connected"));
    }

    @Test
    @DisplayName("Should reject a replayed callback")
    void testReplayedCallback() throws Exception {
        String state = stateFor("replay-user");
        when(authorizationServer.exchangeCode(anyString(), anyString())).thenReturn(
                new TokenGrant("ya29.replay", null, Duration.ofSeconds(3600), null, "Bearer"));

        mockMvc.perform(get("/auth/google/callback").param("code", "code-1").param("state", state))
                .andExpect(status().isOk());
        mockMvc.perform(get("/auth/google/callback").param("code", "code-1").param("state", state))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_state"));
    }

    @Test
    @DisplayName("Should report consent denial and invalid states as bad requests")
    void testCallbackErrors() throws Exception {
        mockMvc.perform(get("/auth/google/callback").param("error", "access_denied").param("state", "x"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("consent_denied"));

        mockMvc.perform(get("/auth/google/callback").param("code", "c").param("state", "forged.state.value"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_state"));

        mockMvc.perform(get("/auth/google/callback").param("code", "c"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_state"));
    }

    @Test
    @DisplayName("Should map a failed code exchange to 502")
    void testExchangeFailure() throws Exception {
        String state = stateFor("exchange-fail-user");
        when(authorizationServer.exchangeCode(anyString(), anyString()))
                .thenThrow(new UpstreamExchangeException("Token exchange failed: 400 invalid_grant"));

        mockMvc.perform(get("/auth/google/callback").param("code", "bad").param("state", state))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("upstream_exchange_failed"));
    }

    @Test
    @DisplayName("Should reject internal calls without the API key")
    void testTokenRequiresApiKey() throws Exception {
        mockMvc.perform(get("/auth/google/token").param("user_id", "someone"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("access_denied"))
                .andExpect(jsonPath("$.message").doesNotExist());

        mockMvc.perform(get("/auth/google/token").param("user_id", "someone").header("X-API-Key", "wrong"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Should reject internal calls from addresses outside the allow-list")
    void testTokenFromForeignAddress() throws Exception {
        mockMvc.perform(get("/auth/google/token").param("user_id", "someone")
                        .header("X-API-Key", TestKeys.INTERNAL_API_KEY)
                        .with(request -> {
                            request.setRemoteAddr("192.168.0.5");
                            return request;
                        }))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("access_denied"));
    }

    @Test
    @DisplayName("Should report a user without credential as not connected")
    void testTokenNotConnected() throws Exception {
        mockMvc.perform(get("/auth/google/token").param("user_id", "never-connected")
                        .header("X-API-Key", TestKeys.INTERNAL_API_KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_connected"));
    }

    @Test
    @DisplayName("Should map refresh outcomes to 409 and 504")
    void testRefreshFailures() throws Exception {
        storeExpired("rejected-user", "1//rejected");
        storeExpired("slow-user", "1//slow");
        when(authorizationServer.refresh("1//rejected"))
                .thenThrow(new RefreshTokenRejectedException("Refresh token was revoked or expired"));
        when(authorizationServer.refresh("1//slow")).thenThrow(new UpstreamTimeoutException("Token refresh timed out"));

        mockMvc.perform(get("/auth/google/token").param("user_id", "rejected-user")
                        .header("X-API-Key", TestKeys.INTERNAL_API_KEY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("reauth_required"));

        mockMvc.perform(get("/auth/google/token").param("user_id", "slow-user")
                        .header("X-API-Key", TestKeys.INTERNAL_API_KEY))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error").value("upstream_timeout"));
    }

    @Test
    @DisplayName("Should disconnect a user even when Google fails the revocation")
    void testRevoke() throws Exception {
        storeExpired("revoke-user", "1//revoke");
        doThrow(new UpstreamExchangeException("Token revocation failed: 500"))
                .when(authorizationServer).revoke("1//revoke");

        mockMvc.perform(post("/auth/google/revoke").param("user_id", "revoke-user")
                        .header("X-API-Key", TestKeys.INTERNAL_API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revoked").value(true));

        mockMvc.perform(post("/auth/google/revoke").param("user_id", "revoke-user")
                        .header("X-API-Key", TestKeys.INTERNAL_API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revoked").value(true));

        mockMvc.perform(get("/auth/google/token").param("user_id", "revoke-user")
                        .header("X-API-Key", TestKeys.INTERNAL_API_KEY))
                .andExpect(status().isNotFound());
    }

    private String stateFor(String userId) throws Exception {
        MvcResult result = mockMvc.perform(get("/auth/google/url").param("user_id", userId))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        String state = UriComponentsBuilder.fromUriString(body.path("auth_url").asText())
                .build().getQueryParams().getFirst("state");
        return URLDecoder.decode(state, StandardCharsets.UTF_8);
    }

    private void storeExpired(String userId, String refreshToken) {
        Instant now = Instant.now();
        tokenStore.put(UserIdentity.of(userId), new StoredCredential("ya29.expired", refreshToken,
                now.minusSeconds(10), List.of("scope-a"), now.minusSeconds(3600), now));
    }
}
