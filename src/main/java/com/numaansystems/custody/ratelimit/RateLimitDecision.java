package com.numaansystems.custody.ratelimit;

import java.time.Duration;

/**
 * Result of a single admission check.
 *
 * @param allowed whether the request may proceed
 * @param remaining requests left in the current window, zero when denied
 * @param retryAfter time until the window resets; {@link Duration#ZERO} when allowed
 */
public record RateLimitDecision(boolean allowed, int remaining, Duration retryAfter) {

    static RateLimitDecision allow(int remaining) {
        return new RateLimitDecision(true, Math.max(0, remaining), Duration.ZERO);
    }

    static RateLimitDecision deny(Duration retryAfter) {
        return new RateLimitDecision(false, 0, retryAfter.isNegative() ? Duration.ZERO : retryAfter);
    }
}
