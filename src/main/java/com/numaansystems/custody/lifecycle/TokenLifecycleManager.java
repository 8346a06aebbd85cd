package com.numaansystems.custody.lifecycle;

import com.numaansystems.custody.config.CustodyProperties;
import com.numaansystems.custody.error.CustodyException;
import com.numaansystems.custody.error.DecryptionException;
import com.numaansystems.custody.error.InvalidRequestException;
import com.numaansystems.custody.error.InvalidStateException;
import com.numaansystems.custody.error.NotConnectedException;
import com.numaansystems.custody.error.ReauthRequiredException;
import com.numaansystems.custody.error.RefreshTokenRejectedException;
import com.numaansystems.custody.error.UpstreamTimeoutException;
import com.numaansystems.custody.state.ConsumedNonceLedger;
import com.numaansystems.custody.state.FlowState;
import com.numaansystems.custody.state.SignedStateCodec;
import com.numaansystems.custody.store.StoredCredential;
import com.numaansystems.custody.store.TokenStore;
import com.numaansystems.custody.store.UserIdentity;
import com.numaansystems.custody.upstream.AuthorizationServerClient;
import com.numaansystems.custody.upstream.TokenGrant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Drives a user's Google connection through its lifecycle.
 *
 * <pre>
 * UNCONNECTED --callback--> CONNECTED --time--> EXPIRED --refresh--> CONNECTED
 *                               |                   |
 *                               +------revoke-------+--> UNCONNECTED
 * </pre>
 *
 * <h2>Consent flow</h2>
 * <ol>
 *   <li>{@link #beginFlow(UserIdentity)} builds Google's consent URL with a signed state</li>
 *   <li>Google redirects the browser to {@code /auth/google/callback}</li>
 *   <li>{@link #completeFlow(String, String)} verifies the state, redeems the code and stores the tokens</li>
 * </ol>
 *
 * <h2>Concurrency</h2>
 * <p>A valid cached token is returned straight from the store. Refresh and
 * revoke are single-flight per user: the first caller submits one task to the
 * bounded worker pool and later callers for the same user wait on that task's
 * future without occupying a worker. The task takes the user's
 * {@link ReentrantLock}, re-reads the record under it and only then calls
 * Google. If the request is abandoned the worker still finishes and either
 * commits the new token or purges the record.</p>
 *
 * <p>Locks exist only while a thread holds or waits for them, so the lock
 * table does not grow with the number of users ever seen.</p>
 *
 * <p>Nothing here retries an upstream call. Timeouts surface as
 * {@link UpstreamTimeoutException} and leave the stored record untouched.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class TokenLifecycleManager {

    private static final Logger logger = LoggerFactory.getLogger(TokenLifecycleManager.class);

    public static final String CALLBACK_PATH = "/auth/google/callback";

    private final CustodyProperties.Google google;
    private final Duration stateTtl;
    private final Duration safetyMargin;
    private final SignedStateCodec stateCodec;
    private final ConsumedNonceLedger nonceLedger;
    private final TokenStore tokenStore;
    private final AuthorizationServerClient authorizationServer;
    private final ExecutorService workers;
    private final Clock clock;

    private final ConcurrentHashMap<String, UserLock> userLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<ValidAccessToken>> refreshesInFlight =
            new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Boolean>> revocationsInFlight =
            new ConcurrentHashMap<>();

    public TokenLifecycleManager(CustodyProperties.Google google,
                                 Duration stateTtl,
                                 Duration safetyMargin,
                                 SignedStateCodec stateCodec,
                                 ConsumedNonceLedger nonceLedger,
                                 TokenStore tokenStore,
                                 AuthorizationServerClient authorizationServer,
                                 ExecutorService workers,
                                 Clock clock) {
        this.google = google;
        this.stateTtl = stateTtl;
        this.safetyMargin = safetyMargin;
        this.stateCodec = stateCodec;
        this.nonceLedger = nonceLedger;
        this.tokenStore = tokenStore;
        this.authorizationServer = authorizationServer;
        this.workers = workers;
        this.clock = clock;
    }

    /**
     * Builds the Google consent URL for a user. Nothing is stored.
     *
     * @param user the user to connect
     * @return the URL the browser should be sent to
     * @throws InvalidRequestException if the configured redirect host is not allowed
     */
    public String beginFlow(UserIdentity user) {
        if (!google.isClientConfigured()) {
            throw new IllegalStateException("custody.google.client-id and client-secret must be configured");
        }
        String redirectUri = redirectUri();
        String state = stateCodec.encode(user.value(), stateTtl);

        Map<String, Object> additional = new LinkedHashMap<>();
        additional.put("access_type", "offline");
        additional.put("include_granted_scopes", "true");
        if (google.promptConsent()) {
            additional.put("prompt", "consent");
        }

        String url = OAuth2AuthorizationRequest.authorizationCode()
                .authorizationUri(google.authorizationUri())
                .clientId(google.clientId())
                .redirectUri(redirectUri)
                .scopes(new LinkedHashSet<>(google.scopes()))
                .state(state)
                .additionalParameters(additional)
                .build()
                .getAuthorizationRequestUri();

        logger.info("Consent flow started for user: {}", user);
        return url;
    }

    /**
     * Finishes the consent flow: verifies the state, redeems the code and
     * stores the resulting credential.
     *
     * @param code authorization code from the callback
     * @param state state from the callback
     * @return the connected user with granted scopes and expiry
     * @throws InvalidStateException if the state is invalid, expired or already used
     */
    public FlowCompletion completeFlow(String code, String state) {
        FlowState flowState = stateCodec.decode(state);
        UserIdentity user = UserIdentity.of(flowState.userIdentity());
        if (code == null || code.isBlank()) {
            throw new InvalidRequestException("code is required");
        }
        if (!nonceLedger.consume(flowState)) {
            throw new InvalidStateException("State has already been used");
        }

        TokenGrant grant = authorizationServer.exchangeCode(code, redirectUri());

        return withUserLock(user, () -> {
            Optional<StoredCredential> existing = readForReplacement(user);
            Instant now = clock.instant();
            String refreshToken = grant.refreshToken() != null
                    ? grant.refreshToken()
                    : existing.map(StoredCredential::refreshToken).orElse(null);
            List<String> scopes = grant.scopes() != null ? List.copyOf(grant.scopes()) : google.scopes();

            StoredCredential credential = new StoredCredential(
                    grant.accessToken(),
                    refreshToken,
                    now.plus(grant.expiresIn()),
                    scopes,
                    existing.map(StoredCredential::createdAt).orElse(now),
                    now);
            tokenStore.put(user, credential);

            if (refreshToken == null) {
                logger.warn("User {} connected without a refresh token; reconnect will be needed on expiry", user);
            } else {
                logger.info("User {} connected (refreshTokenIssued={})", user, grant.refreshToken() != null);
            }
            return new FlowCompletion(user, scopes, credential.expiresAt(), grant.refreshToken() != null);
        });
    }

    /**
     * Returns an access token that stays valid for at least the safety
     * margin, refreshing it first when needed.
     *
     * @param user the user
     * @return the token
     * @throws NotConnectedException if the user never connected or revoked
     * @throws ReauthRequiredException if the user must go through consent again
     */
    public ValidAccessToken getValidToken(UserIdentity user) {
        StoredCredential credential = tokenStore.get(user)
                .orElseThrow(() -> new NotConnectedException("User is not connected to Google"));
        if (credential.isUsableAt(clock.instant(), safetyMargin)) {
            return toValidToken(credential);
        }
        return runSingleFlight(refreshesInFlight, user, () -> refreshLocked(user), "Token refresh");
    }

    /**
     * Disconnects a user: revokes the token at Google when possible and
     * always deletes the local record.
     *
     * @param user the user
     * @return true if a credential was held for the user
     */
    public boolean revoke(UserIdentity user) {
        return runSingleFlight(revocationsInFlight, user, () -> revokeLocked(user), "Revocation");
    }

    /**
     * @return the callback URL registered with Google
     * @throws InvalidRequestException if its host is not in the allowed list
     */
    public String redirectUri() {
        String base = google.redirectBase();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String redirectUri = base + CALLBACK_PATH;
        String host = hostOf(redirectUri);
        for (String allowed : google.allowedRedirectHosts()) {
            if (host.equals(allowed.trim().toLowerCase(Locale.ROOT))) {
                return redirectUri;
            }
        }
        logger.error("Redirect host {} is not in custody.google.allowed-redirect-hosts", host);
        throw new InvalidRequestException("redirect_uri host '" + host + "' is not allowed");
    }

    /**
     * @return the number of users whose lock is currently held or awaited
     */
    int lockedUserCount() {
        return userLocks.size();
    }

    private ValidAccessToken refreshLocked(UserIdentity user) {
        return withUserLock(user, () -> {
            StoredCredential current = tokenStore.get(user)
                    .orElseThrow(() -> new NotConnectedException("User is not connected to Google"));
            if (current.isUsableAt(clock.instant(), safetyMargin)) {
                logger.debug("Token for user {} was refreshed by a concurrent request", user);
                return toValidToken(current);
            }
            if (!current.hasRefreshToken()) {
                throw new ReauthRequiredException("Access token expired and no refresh token is held");
            }

            TokenGrant grant;
            try {
                grant = authorizationServer.refresh(current.refreshToken());
            } catch (RefreshTokenRejectedException e) {
                tokenStore.delete(user);
                logger.warn("Refresh token for user {} was rejected; credential removed", user);
                throw new ReauthRequiredException("Refresh token is no longer valid", e);
            }

            Instant now = clock.instant();
            StoredCredential refreshed = new StoredCredential(
                    grant.accessToken(),
                    grant.refreshToken() != null ? grant.refreshToken() : current.refreshToken(),
                    now.plus(grant.expiresIn()),
                    grant.scopes() != null ? List.copyOf(grant.scopes()) : current.scopes(),
                    current.createdAt(),
                    now);
            tokenStore.put(user, refreshed);
            logger.info("Refreshed access token for user {} (expiresAt={}, rotated={})",
                    user, refreshed.expiresAt(), grant.refreshToken() != null);
            return toValidToken(refreshed);
        });
    }

    private boolean revokeLocked(UserIdentity user) {
        return withUserLock(user, () -> {
            Optional<StoredCredential> credential = readForReplacement(user);
            credential.ifPresent(held -> revokeUpstream(user, held));
            boolean deleted = tokenStore.delete(user);
            logger.info("Disconnected user {} (credentialHeld={})", user, credential.isPresent() || deleted);
            return credential.isPresent() || deleted;
        });
    }

    private void revokeUpstream(UserIdentity user, StoredCredential credential) {
        String token = credential.hasRefreshToken() ? credential.refreshToken() : credential.accessToken();
        try {
            authorizationServer.revoke(token);
        } catch (CustodyException e) {
            logger.warn("Upstream revocation for user {} failed ({}); deleting local credential anyway",
                    user, e.getMessage());
        }
    }

    private Optional<StoredCredential> readForReplacement(UserIdentity user) {
        try {
            return tokenStore.get(user);
        } catch (DecryptionException e) {
            logger.info("Unreadable credential for user {} was purged before being replaced", user);
            return Optional.empty();
        }
    }

    private <T> T withUserLock(UserIdentity user, Supplier<T> action) {
        String key = user.value();
        UserLock userLock = userLocks.compute(key, (k, existing) -> {
            UserLock acquired = existing == null ? new UserLock() : existing;
            acquired.users++;
            return acquired;
        });
        userLock.lock.lock();
        try {
            return action.get();
        } finally {
            userLock.lock.unlock();
            userLocks.computeIfPresent(key, (k, current) -> --current.users == 0 ? null : current);
        }
    }

    /**
     * Runs a task for a user on the worker pool, or joins the one already
     * running for that user, and waits for its result.
     */
    private <T> T runSingleFlight(ConcurrentHashMap<String, CompletableFuture<T>> inFlight,
                                  UserIdentity user, Supplier<T> task, String operation) {
        String key = user.value();
        CompletableFuture<T> started = new CompletableFuture<>();
        CompletableFuture<T> running = inFlight.putIfAbsent(key, started);
        if (running == null) {
            running = started;
            try {
                workers.execute(() -> complete(inFlight, key, started, task));
            } catch (RejectedExecutionException e) {
                IllegalStateException failure = new IllegalStateException(operation + " could not be scheduled", e);
                inFlight.remove(key, started);
                started.completeExceptionally(failure);
                throw failure;
            }
        } else {
            logger.debug("{} for user {} already in flight, waiting for it", operation, user);
        }
        return await(running, operation);
    }

    private static <T> void complete(ConcurrentHashMap<String, CompletableFuture<T>> inFlight, String key,
                                     CompletableFuture<T> future, Supplier<T> task) {
        T result;
        try {
            result = task.get();
        } catch (RuntimeException | Error e) {
            inFlight.remove(key, future);
            future.completeExceptionally(e);
            return;
        }
        inFlight.remove(key, future);
        future.complete(result);
    }

    private static <T> T await(CompletableFuture<T> future, String operation) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamTimeoutException(operation + " was interrupted; it completes in the background", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(operation + " failed", cause);
        }
    }

    private static ValidAccessToken toValidToken(StoredCredential credential) {
        return new ValidAccessToken(credential.accessToken(), credential.expiresAt(), credential.scopes());
    }

    private static String hostOf(String uri) {
        try {
            String host = URI.create(uri).getHost();
            return host == null ? "" : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("custody.google.redirect-base is not a valid URL: " + uri, e);
        }
    }

    /**
     * A user's lock with the number of threads holding or waiting for it.
     * The count is only changed inside {@code userLocks.compute}.
     */
    private static final class UserLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
