package com.numaansystems.custody.state;

import com.numaansystems.custody.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConsumedNonceLedger.
 */
class ConsumedNonceLedgerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private ConsumedNonceLedger ledger;

    @AfterEach
    void tearDown() {
        if (ledger != null) {
            ledger.close();
        }
    }

    @Test
    @DisplayName("Should accept a nonce once and refuse it afterwards")
    void testSingleUse() {
        ledger = new ConsumedNonceLedger(clock, true);
        FlowState state = new FlowState("alice", "nonce-1", NOW, NOW.plusSeconds(300));

        assertTrue(ledger.consume(state));
        assertFalse(ledger.consume(state));
        assertTrue(ledger.consume(new FlowState("alice", "nonce-2", NOW, NOW.plusSeconds(300))));
        assertEquals(2, ledger.getConsumedCount());
    }

    @Test
    @DisplayName("Should accept replays when disabled")
    void testDisabled() {
        ledger = new ConsumedNonceLedger(clock, false);
        FlowState state = new FlowState("alice", "nonce-1", NOW, NOW.plusSeconds(300));

        assertTrue(ledger.consume(state));
        assertTrue(ledger.consume(state));
        assertFalse(ledger.isEnabled());
        assertEquals(0, ledger.getConsumedCount());
    }
}
