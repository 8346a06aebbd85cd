package com.numaansystems.custody.store;

import com.numaansystems.custody.crypto.CredentialCipher;
import com.numaansystems.custody.error.DecryptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Durable mapping from user identity to credential.
 *
 * <p>This is the encryption boundary: callers hand in and get back plaintext
 * tokens, the repository underneath only ever sees values sealed by the
 * {@link CredentialCipher}.</p>
 *
 * <p>The store does not order concurrent writes for the same user beyond
 * last-write-wins on {@code updatedAt}. Callers that read, call Google and
 * write back (refresh, revoke) must serialize per user themselves.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class TokenStore {

    private static final Logger logger = LoggerFactory.getLogger(TokenStore.class);

    private final CredentialRecordRepository repository;
    private final CredentialCipher cipher;

    public TokenStore(CredentialRecordRepository repository, CredentialCipher cipher) {
        this.repository = repository;
        this.cipher = cipher;
    }

    /**
     * Loads and decrypts the credential of a user.
     *
     * <p>A record that cannot be decrypted is treated as corrupted: it is
     * deleted and the call fails, so the same unusable record is never
     * returned twice.</p>
     *
     * @param user the user
     * @return the credential, or empty if the user is not connected
     * @throws DecryptionException if the stored record could not be opened
     */
    public Optional<StoredCredential> get(UserIdentity user) {
        Optional<CredentialRecord> found = repository.find(user.value());
        if (found.isEmpty()) {
            return Optional.empty();
        }
        CredentialRecord record = found.get();
        try {
            String accessToken = cipher.open(record.accessTokenCiphertext());
            String refreshToken = record.refreshTokenCiphertext() == null
                    ? null
                    : cipher.open(record.refreshTokenCiphertext());
            return Optional.of(new StoredCredential(accessToken, refreshToken, record.expiresAt(),
                    record.scopes(), record.createdAt(), record.updatedAt()));
        } catch (DecryptionException e) {
            logger.error("Stored credential for user {} could not be decrypted, purging it: {}",
                    user, e.getMessage());
            repository.delete(user.value());
            throw e;
        }
    }

    /**
     * Encrypts and stores a credential, replacing any older one.
     *
     * @param user the user
     * @param credential the plaintext credential
     * @return false if a newer record was already stored
     */
    public boolean put(UserIdentity user, StoredCredential credential) {
        CredentialRecord record = new CredentialRecord(
                user.value(),
                cipher.seal(credential.accessToken()),
                credential.hasRefreshToken() ? cipher.seal(credential.refreshToken()) : null,
                credential.expiresAt(),
                credential.scopes(),
                credential.createdAt(),
                credential.updatedAt());
        boolean written = repository.save(record);
        logger.debug("Stored credential for user {} (written={}, expiresAt={})",
                user, written, credential.expiresAt());
        return written;
    }

    /**
     * @param user the user
     * @return true if a credential existed
     */
    public boolean delete(UserIdentity user) {
        return repository.delete(user.value());
    }
}
