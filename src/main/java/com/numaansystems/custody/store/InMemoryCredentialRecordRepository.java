package com.numaansystems.custody.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Credential records held in a ConcurrentHashMap. Selected with
 * {@code custody.store.type=memory}; everything is lost on restart, so this
 * is meant for local runs and tests.
 */
public class InMemoryCredentialRecordRepository implements CredentialRecordRepository {

    private final ConcurrentHashMap<String, CredentialRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<CredentialRecord> find(String userId) {
        return Optional.ofNullable(records.get(userId));
    }

    @Override
    public boolean save(CredentialRecord record) {
        AtomicBoolean written = new AtomicBoolean(false);
        records.compute(record.userId(), (userId, existing) -> {
            if (existing != null && record.updatedAt().isBefore(existing.updatedAt())) {
                return existing;
            }
            written.set(true);
            return record;
        });
        return written.get();
    }

    @Override
    public boolean delete(String userId) {
        return records.remove(userId) != null;
    }

    public int size() {
        return records.size();
    }
}
