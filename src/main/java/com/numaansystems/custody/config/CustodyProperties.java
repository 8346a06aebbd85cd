package com.numaansystems.custody.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Immutable configuration of the custody service, bound from the
 * {@code custody.*} properties in application.yml.
 *
 * <p>Secrets (client secret, internal API key, encryption key, state signing
 * secret) are only ever read from here and handed to constructors; nothing in
 * the service looks them up on its own. Tests build their own instances with
 * throwaway keys.</p>
 *
 * <h2>Example</h2>
 * <pre>
 * custody:
 *   google:
 *     client-id: ${GOOGLE_CLIENT_ID}
 *     client-secret: ${GOOGLE_CLIENT_SECRET}
 *     redirect-base: https://custody.company.com
 *   internal:
 *     api-key: ${API_INTERNAL_KEY}
 *     allowed-origins: 10.0.0.0/8, 127.0.0.1
 *   crypto:
 *     key: ${ENCRYPTION_KEY}
 *   state:
 *     signing-secret: ${STATE_SIGNING_SECRET}
 * </pre>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@ConfigurationProperties(prefix = "custody")
public record CustodyProperties(
        @DefaultValue Google google,
        @DefaultValue Internal internal,
        @DefaultValue Crypto crypto,
        @DefaultValue State state,
        @DefaultValue RateLimit rateLimit,
        @DefaultValue Store store,
        @DefaultValue Cors cors,
        @DefaultValue("60s") Duration safetyMargin,
        @DefaultValue("8") int workerThreads) {

    /**
     * Google OAuth client registration and upstream endpoints.
     */
    public record Google(
            String clientId,
            String clientSecret,
            @DefaultValue("https://accounts.google.com/o/oauth2/v2/auth") String authorizationUri,
            @DefaultValue("https://oauth2.googleapis.com/token") String tokenUri,
            @DefaultValue("https://oauth2.googleapis.com/revoke") String revokeUri,
            @DefaultValue({
                    "https://www.googleapis.com/auth/drive.readonly",
                    "https://www.googleapis.com/auth/documents.readonly",
                    "https://www.googleapis.com/auth/spreadsheets.readonly",
                    "https://www.googleapis.com/auth/presentations.readonly"
            }) List<String> scopes,
            @DefaultValue("http://localhost:8000") String redirectBase,
            @DefaultValue({"localhost", "127.0.0.1"}) List<String> allowedRedirectHosts,
            @DefaultValue("true") boolean promptConsent,
            @DefaultValue("5s") Duration connectTimeout,
            @DefaultValue("15s") Duration responseTimeout,
            Map<String, String> resourceBaseUrls) {

        public Google {
            clientId = clientId == null ? "" : clientId.trim();
            clientSecret = clientSecret == null ? "" : clientSecret.trim();
            scopes = scopes == null ? List.of() : List.copyOf(scopes);
            allowedRedirectHosts = allowedRedirectHosts == null ? List.of() : List.copyOf(allowedRedirectHosts);
            resourceBaseUrls = resourceBaseUrls == null ? Map.of() : Map.copyOf(resourceBaseUrls);
        }

        public boolean isClientConfigured() {
            return !clientId.isEmpty() && !clientSecret.isEmpty();
        }
    }

    /**
     * Access gate for internal-only endpoints.
     *
     * @param apiKey shared secret expected in the X-API-Key header
     * @param allowedOrigins optional addresses or CIDR blocks; empty disables the check
     */
    public record Internal(String apiKey, List<String> allowedOrigins) {

        public Internal {
            apiKey = apiKey == null ? "" : apiKey;
            allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
        }
    }

    /**
     * Encryption of stored tokens.
     *
     * @param key base64 encoded 256-bit key used for sealing
     * @param keyId identifier written in front of every ciphertext
     * @param retiredKeys older keys by id, used for opening only
     */
    public record Crypto(String key, @DefaultValue("k1") String keyId, Map<String, String> retiredKeys) {

        public Crypto {
            retiredKeys = retiredKeys == null ? Map.of() : Map.copyOf(retiredKeys);
        }
    }

    /**
     * OAuth state parameter signing.
     */
    public record State(
            String signingSecret,
            @DefaultValue("300s") Duration ttl,
            @DefaultValue("true") boolean singleUse) {
    }

    public record RateLimit(
            @DefaultValue("60s") Duration window,
            @DefaultValue("120") int maxPerKey,
            @DefaultValue("60") int maxPerUser,
            @DefaultValue("60s") Duration sweepInterval) {
    }

    /**
     * @param type {@code jdbc} or {@code memory}
     */
    public record Store(@DefaultValue("jdbc") String type) {
    }

    public record Cors(List<String> allowedOrigins) {

        public Cors {
            allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
        }
    }
}
