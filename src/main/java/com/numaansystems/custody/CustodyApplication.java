package com.numaansystems.custody;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Token Custody Application
 *
 * <p>This Spring Boot application brokers the Google OAuth2 authorization code
 * flow on behalf of end users and keeps their credentials in custody, so that
 * internal ingestion workers can ask for a currently valid access token
 * without ever handling refresh tokens themselves.</p>
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>A front end asks for a consent URL for a user (/auth/google/url)</li>
 *   <li>The user grants read-only, offline access at Google</li>
 *   <li>Google redirects back to /auth/google/callback with a code and a signed state</li>
 *   <li>The service verifies the state, exchanges the code and stores the tokens encrypted</li>
 *   <li>Internal workers call /auth/google/token with the shared API key</li>
 *   <li>Expired access tokens are refreshed transparently, one refresh per user at a time</li>
 *   <li>/auth/google/revoke disconnects a user locally and at Google</li>
 * </ol>
 *
 * <h2>Security Features</h2>
 * <ul>
 *   <li>HMAC-signed, short-lived, single-use state parameter</li>
 *   <li>AES-256-GCM encryption of all stored tokens</li>
 *   <li>Shared-secret and address allow-list gate on internal endpoints</li>
 *   <li>Fixed-window rate limiting per API key and per user</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class CustodyApplication {

    /**
     * Main entry point for the token custody service.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(CustodyApplication.class, args);
    }
}
