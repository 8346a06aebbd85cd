package com.numaansystems.custody.store;

import com.numaansystems.custody.crypto.CredentialCipher;
import com.numaansystems.custody.error.DecryptionException;
import com.numaansystems.custody.support.TestKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TokenStore.
 *
 * <p>Verifies that only ciphertext reaches the repository and that
 * undecryptable records are purged.</p>
 */
class TokenStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final UserIdentity ALICE = UserIdentity.of("alice");

    private InMemoryCredentialRecordRepository repository;
    private TokenStore tokenStore;

    @BeforeEach
    void setUp() {
        repository = new InMemoryCredentialRecordRepository();
        tokenStore = new TokenStore(repository, new CredentialCipher("k1", TestKeys.ENCRYPTION_KEY, Map.of()));
    }

    @Test
    @DisplayName("Should encrypt tokens before they reach the repository")
    void testEncryptsAtRest() {
        tokenStore.put(ALICE, credential("ya29.secret-access", "1//secret-refresh"));

        CredentialRecord stored = repository.find("alice").orElseThrow();
        assertFalse(stored.accessTokenCiphertext().contains("secret-access"));
        assertFalse(stored.refreshTokenCiphertext().contains("secret-refresh"));
        assertTrue(stored.accessTokenCiphertext().startsWith("k1:"));
    }

    @Test
    @DisplayName("Should return the decrypted credential")
    void testRoundTrip() {
        tokenStore.put(ALICE, credential("ya29.access", null));

        StoredCredential credential = tokenStore.get(ALICE).orElseThrow();

        assertEquals("ya29.access", credential.accessToken());
        assertNull(credential.refreshToken());
        assertFalse(credential.hasRefreshToken());
        assertEquals(List.of("scope-a"), credential.scopes());
    }

    @Test
    @DisplayName("Should return empty for an unknown user")
    void testMissing() {
        assertTrue(tokenStore.get(UserIdentity.of("nobody")).isEmpty());
    }

    @Test
    @DisplayName("Should purge a record that can no longer be decrypted")
    void testUndecryptableRecordIsPurged() {
        TokenStore otherKeyStore = new TokenStore(repository,
                new CredentialCipher("k1", TestKeys.OTHER_ENCRYPTION_KEY, Map.of()));
        otherKeyStore.put(ALICE, credential("access", "refresh"));

        assertThrows(DecryptionException.class, () -> tokenStore.get(ALICE));
        assertTrue(repository.find("alice").isEmpty(), "Corrupted record should be deleted");
        assertTrue(tokenStore.get(ALICE).isEmpty());
    }

    @Test
    @DisplayName("Should never print token values")
    void testToStringRedacts() {
        StoredCredential credential = credential("ya29.visible?", "1//visible?");

        assertFalse(credential.toString().contains("visible"));
    }

    private static StoredCredential credential(String access, String refresh) {
        return new StoredCredential(access, refresh, T0.plusSeconds(3600), List.of("scope-a"), T0, T0);
    }
}
