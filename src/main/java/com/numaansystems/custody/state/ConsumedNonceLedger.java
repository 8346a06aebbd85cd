package com.numaansystems.custody.state;

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
 * Journal of state nonces that have already been redeemed on the callback.
 *
 * <p>A signed state is valid until it expires, so without a journal the same
 * callback URL could be replayed within the TTL. The ledger makes every state
 * single-use: the first {@link #consume(FlowState)} wins, later ones are
 * refused.</p>
 *
 * <h2>Storage</h2>
 * <p>Entries live in an in-memory ConcurrentHashMap and are removed by a
 * scheduled task shortly after the state would have expired anyway. With
 * several custody instances behind a load balancer, a replay that lands on a
 * different instance is only bounded by the state TTL.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class ConsumedNonceLedger implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConsumedNonceLedger.class);

    private static final Duration REMOVAL_GRACE = Duration.ofSeconds(10);

    private final ConcurrentHashMap<String, Instant> consumed = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "nonce-ledger-cleanup");
        thread.setDaemon(true);
        return thread;
    });
    private final Clock clock;
    private final boolean enabled;

    /**
     * @param clock time source used to compute when an entry can be dropped
     * @param enabled when false every state is accepted and nothing is recorded
     */
    public ConsumedNonceLedger(Clock clock, boolean enabled) {
        this.clock = clock;
        this.enabled = enabled;
        if (!enabled) {
            logger.warn("Single-use state enforcement is disabled; states can be replayed until they expire");
        }
    }

    /**
     * Records a state as redeemed.
     *
     * @param state a verified flow state
     * @return true the first time a nonce is seen, false on replay
     */
    public boolean consume(FlowState state) {
        if (!enabled) {
            return true;
        }

        Instant previous = consumed.putIfAbsent(state.nonce(), state.expiresAt());
        if (previous != null) {
            logger.warn("Replayed state rejected for user: {}", state.userIdentity());
            return false;
        }

        long delayMillis = Math.max(0L, Duration.between(clock.instant(), state.expiresAt()).toMillis())
                + REMOVAL_GRACE.toMillis();
        scheduler.schedule(() -> consumed.remove(state.nonce()), delayMillis, TimeUnit.MILLISECONDS);

        logger.debug("State nonce consumed for user: {}", state.userIdentity());
        return true;
    }

    /**
     * @return the number of nonces currently remembered
     */
    public int getConsumedCount() {
        return consumed.size();
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
