package com.numaansystems.custody.store;

import java.util.Optional;

/**
 * Persistence backend for credential records.
 *
 * <p>Implementations only see ciphertext. Writes follow last-write-wins on
 * {@link CredentialRecord#updatedAt()}: a record older than the one already
 * stored is dropped.</p>
 */
public interface CredentialRecordRepository {

    Optional<CredentialRecord> find(String userId);

    /**
     * Inserts or replaces the record for its user.
     *
     * @param record the record to write
     * @return false if a newer record was already stored and this one was ignored
     */
    boolean save(CredentialRecord record);

    /**
     * @param userId the user to remove
     * @return true if a record existed
     */
    boolean delete(String userId);
}
