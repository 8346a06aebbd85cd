package com.numaansystems.custody.error;

import java.time.Duration;

/**
 * Admission was denied because a fixed window for the caller key or the
 * subject user is exhausted.
 */
public class RateLimitExceededException extends CustodyException {

    private final Duration retryAfter;

    public RateLimitExceededException(Duration retryAfter) {
        super("rate limit exceeded");
        this.retryAfter = retryAfter;
    }

    /**
     * @return time until the denying window resets
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * Retry-After header value: whole seconds, rounded up, never below one.
     *
     * @return seconds to wait before retrying
     */
    public long getRetryAfterSeconds() {
        long millis = retryAfter.toMillis();
        return Math.max(1L, (millis + 999L) / 1000L);
    }

    @Override
    public String errorCode() {
        return "rate_limited";
    }
}
