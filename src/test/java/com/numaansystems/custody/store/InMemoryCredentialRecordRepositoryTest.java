package com.numaansystems.custody.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCredentialRecordRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final InMemoryCredentialRecordRepository repository = new InMemoryCredentialRecordRepository();

    @Test
    @DisplayName("Should keep the newest write and ignore stale ones")
    void testLastWriteWins() {
        assertTrue(repository.save(record("access-1", T0.plusSeconds(10))));
        assertFalse(repository.save(record("access-0", T0)));
        assertTrue(repository.save(record("access-2", T0.plusSeconds(20))));

        assertEquals("access-2", repository.find("alice").orElseThrow().accessTokenCiphertext());
        assertEquals(1, repository.size());
    }

    @Test
    @DisplayName("Should report whether a record was deleted")
    void testDelete() {
        repository.save(record("access", T0));

        assertTrue(repository.delete("alice"));
        assertFalse(repository.delete("alice"));
        assertTrue(repository.find("alice").isEmpty());
    }

    private static CredentialRecord record(String access, Instant updatedAt) {
        return new CredentialRecord("alice", access, null, T0.plusSeconds(3600), List.of("scope"), T0, updatedAt);
    }
}
