package com.numaansystems.custody.crypto;

import com.numaansystems.custody.error.DecryptionException;
import com.numaansystems.custody.support.TestKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CredentialCipher.
 *
 * <p>Covers sealing and opening, tamper detection, key ids and key
 * rotation through retired keys.</p>
 */
class CredentialCipherTest {

    private CredentialCipher cipher;

    @BeforeEach
    void setUp() {
        cipher = new CredentialCipher("k1", TestKeys.ENCRYPTION_KEY, Map.of());
    }

    @Test
    @DisplayName("Should open what it sealed")
    void testSealAndOpen() {
        String sealed = cipher.seal("ya29.access-token");

        assertTrue(sealed.startsWith("k1:"), "Sealed value should carry the key id");
        assertFalse(sealed.contains("ya29"), "Sealed value should not contain the plaintext");
        assertEquals("ya29.access-token", cipher.open(sealed));
    }

    @Test
    @DisplayName("Should use a fresh IV for every seal")
    void testSealIsRandomized() {
        assertNotEquals(cipher.seal("same"), cipher.seal("same"));
    }

    @Test
    @DisplayName("Should seal empty and non-ASCII values")
    void testEdgeValues() {
        assertEquals("", cipher.open(cipher.seal("")));
        assertEquals("jeton-été-✓", cipher.open(cipher.seal("jeton-été-✓")));
    }

    @Test
    @DisplayName("Should reject a ciphertext with a flipped bit")
    void testTamperedCiphertext() {
        String sealed = cipher.seal("refresh-token");
        byte[] payload = Base64.getDecoder().decode(sealed.substring(3));
        payload[payload.length / 2] ^= 0x01;
        String tampered = "k1:" + Base64.getEncoder().encodeToString(payload);

        assertThrows(DecryptionException.class, () -> cipher.open(tampered));
    }

    @Test
    @DisplayName("Should reject a ciphertext sealed under a different key")
    void testForeignKey() {
        CredentialCipher other = new CredentialCipher("k1", TestKeys.OTHER_ENCRYPTION_KEY, Map.of());
        String sealed = other.seal("token");

        assertThrows(DecryptionException.class, () -> cipher.open(sealed));
    }

    @Test
    @DisplayName("Should reject malformed ciphertexts")
    void testMalformedCiphertexts() {
        assertThrows(DecryptionException.class, () -> cipher.open(null));
        assertThrows(DecryptionException.class, () -> cipher.open(""));
        assertThrows(DecryptionException.class, () -> cipher.open("no-key-id"));
        assertThrows(DecryptionException.class, () -> cipher.open("k9:AAAA"));
        assertThrows(DecryptionException.class, () -> cipher.open("k1:%%%not-base64%%%"));
        assertThrows(DecryptionException.class, () -> cipher.open("k1:AAAA"));
    }

    @Test
    @DisplayName("Should open records sealed under a retired key after rotation")
    void testRetiredKey() {
        String sealedWithOldKey = cipher.seal("old-token");

        CredentialCipher rotated = new CredentialCipher("k2", TestKeys.OTHER_ENCRYPTION_KEY,
                Map.of("k1", TestKeys.ENCRYPTION_KEY));

        assertEquals("old-token", rotated.open(sealedWithOldKey));
        assertTrue(rotated.seal("new-token").startsWith("k2:"));
        assertEquals("k2", rotated.getPrimaryKeyId());
    }

    @Test
    @DisplayName("Should accept URL-safe base64 keys")
    void testUrlSafeKey() {
        String urlSafe = TestKeys.ENCRYPTION_KEY.replace('+', '-').replace('/', '_');
        CredentialCipher fromUrlSafe = new CredentialCipher("k1", urlSafe, Map.of());

        assertEquals("token", cipher.open(fromUrlSafe.seal("token")));
    }

    @Test
    @DisplayName("Should refuse missing or wrongly sized keys")
    void testInvalidKeys() {
        assertThrows(IllegalStateException.class, () -> new CredentialCipher("k1", null, Map.of()));
        assertThrows(IllegalStateException.class, () -> new CredentialCipher("k1", "", Map.of()));
        assertThrows(IllegalStateException.class,
                () -> new CredentialCipher("k1", Base64.getEncoder().encodeToString(new byte[16]), Map.of()));
        assertThrows(IllegalStateException.class, () -> new CredentialCipher("k1", "not base64!", Map.of()));
        assertThrows(IllegalStateException.class,
                () -> new CredentialCipher("bad:id", TestKeys.ENCRYPTION_KEY, Map.of()));
        assertThrows(IllegalStateException.class,
                () -> new CredentialCipher("k1", TestKeys.ENCRYPTION_KEY, Map.of("k1", TestKeys.OTHER_ENCRYPTION_KEY)));
    }
}
