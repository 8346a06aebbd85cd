package com.numaansystems.custody.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-process fixed-window request counter keyed by subject.
 *
 * <p>A subject's window opens with its first request and lasts
 * {@code window}. Within it at most {@code max} requests are allowed; the
 * next request after the window has elapsed opens a new one. Each update is
 * atomic per subject through {@link ConcurrentHashMap#compute}.</p>
 *
 * <p>Counters are not shared between instances. Elapsed counters are removed
 * by {@link #evictExpired()}, which {@link #scheduleSweeps(Duration)} runs on
 * a fixed delay.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class FixedWindowRateLimiter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration window;
    private ScheduledExecutorService sweeper;

    public FixedWindowRateLimiter(Clock clock, Duration window) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.clock = clock;
        this.window = window;
    }

    /**
     * Counts a request against a subject.
     *
     * @param subjectKey the counter to charge, e.g. {@code user:alice}
     * @param max requests allowed per window
     * @return whether the request is allowed and, if not, when to retry
     */
    public RateLimitDecision tryAcquire(String subjectKey, int max) {
        Instant now = clock.instant();
        Window updated = windows.compute(subjectKey, (key, current) -> {
            if (current == null || !now.isBefore(current.start().plus(window))) {
                return new Window(now, 1);
            }
            return new Window(current.start(), current.count() + 1);
        });

        if (updated.count() <= max) {
            return RateLimitDecision.allow(max - updated.count());
        }
        Duration retryAfter = Duration.between(now, updated.start().plus(window));
        logger.debug("Rate limit reached for {} ({} requests, retry after {})",
                subjectKey, updated.count(), retryAfter);
        return RateLimitDecision.deny(retryAfter);
    }

    /**
     * Removes counters whose window has elapsed.
     *
     * @return the number of counters removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int before = windows.size();
        windows.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().start().plus(window)));
        int removed = before - windows.size();
        if (removed > 0) {
            logger.debug("Evicted {} elapsed rate limit windows", removed);
        }
        return Math.max(0, removed);
    }

    /**
     * @return the number of subjects currently tracked
     */
    public int activeSubjects() {
        return windows.size();
    }

    /**
     * Starts a daemon thread that evicts elapsed counters.
     *
     * @param interval delay between sweeps
     */
    public synchronized void scheduleSweeps(Duration interval) {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rate-limit-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long millis = Math.max(1L, interval.toMillis());
        sweeper.scheduleWithFixedDelay(this::evictExpired, millis, millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
    }

    private record Window(Instant start, int count) {
    }
}
