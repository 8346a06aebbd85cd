package com.numaansystems.custody.ratelimit;

import com.numaansystems.custody.error.RateLimitExceededException;
import com.numaansystems.custody.store.UserIdentity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;

/**
 * Admission control for internal requests over two dimensions: the calling
 * service (identified by its API key) and the user the request is about.
 *
 * <p>Both counters are charged on every request. The request is denied if
 * either is exhausted, and the reported retry-after is the longer of the
 * denying ones. API keys are fingerprinted with SHA-256 before they are used
 * as counter keys.</p>
 */
public class RequestAdmission {

    private final FixedWindowRateLimiter limiter;
    private final int maxPerKey;
    private final int maxPerUser;

    public RequestAdmission(FixedWindowRateLimiter limiter, int maxPerKey, int maxPerUser) {
        this.limiter = limiter;
        this.maxPerKey = maxPerKey;
        this.maxPerUser = maxPerUser;
    }

    /**
     * @param apiKey the presented API key, already verified by the access gate
     * @param user the subject user, or null if the request names none
     * @throws RateLimitExceededException if either dimension is exhausted
     */
    public void admit(String apiKey, UserIdentity user) {
        Duration retryAfter = null;

        RateLimitDecision byKey = limiter.tryAcquire(callerKey(apiKey), maxPerKey);
        if (!byKey.allowed()) {
            retryAfter = byKey.retryAfter();
        }
        if (user != null) {
            RateLimitDecision byUser = limiter.tryAcquire(userKey(user), maxPerUser);
            if (!byUser.allowed() && (retryAfter == null || byUser.retryAfter().compareTo(retryAfter) > 0)) {
                retryAfter = byUser.retryAfter();
            }
        }

        if (retryAfter != null) {
            throw new RateLimitExceededException(retryAfter);
        }
    }

    public static String callerKey(String apiKey) {
        return "apikey:" + fingerprint(apiKey == null ? "" : apiKey);
    }

    public static String userKey(UserIdentity user) {
        return "user:" + user.value();
    }

    private static String fingerprint(String secret) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
