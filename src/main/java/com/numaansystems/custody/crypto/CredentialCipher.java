package com.numaansystems.custody.crypto;

import com.numaansystems.custody.config.CustodyProperties;
import com.numaansystems.custody.error.DecryptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Seals and opens token material with AES-256-GCM.
 *
 * <p>Sealed values look like {@code k1:BASE64(IV + ciphertext + tag)}. The key
 * id in front tells {@link #open(String)} which key to use, so a new primary
 * key can be introduced while records sealed under the previous one are still
 * readable through {@code custody.crypto.retired-keys}.</p>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>Fresh 96-bit IV per seal, 128-bit authentication tag</li>
 *   <li>Corrupted, truncated or foreign ciphertexts fail with {@link DecryptionException}</li>
 *   <li>Keys must be exactly 32 bytes; they are never logged</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class CredentialCipher {

    private static final Logger logger = LoggerFactory.getLogger(CredentialCipher.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128; // bits
    private static final int KEY_LENGTH = 32;
    private static final char KEY_ID_SEPARATOR = ':';
    private static final Pattern KEY_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,32}");

    private final SecureRandom secureRandom = new SecureRandom();
    private final String primaryKeyId;
    private final Map<String, SecretKey> keys;

    /**
     * @param keyId id of the key used for sealing
     * @param base64Key the sealing key, base64 (standard or URL-safe) of 32 bytes
     * @param retiredKeys additional keys by id that are only used for opening
     * @throws IllegalStateException if any key or key id is malformed
     */
    public CredentialCipher(String keyId, String base64Key, Map<String, String> retiredKeys) {
        Map<String, SecretKey> parsed = new LinkedHashMap<>();
        parsed.put(requireKeyId(keyId), parseKey(base64Key, "custody.crypto.key"));
        retiredKeys.forEach((id, key) -> {
            if (parsed.containsKey(requireKeyId(id))) {
                throw new IllegalStateException("Retired key id '" + id + "' clashes with another configured key");
            }
            parsed.put(id, parseKey(key, "custody.crypto.retired-keys." + id));
        });
        this.primaryKeyId = keyId;
        this.keys = Collections.unmodifiableMap(parsed);
        logger.info("Credential cipher initialized with primary key '{}' and {} retired key(s)",
                primaryKeyId, keys.size() - 1);
    }

    public static CredentialCipher fromProperties(CustodyProperties.Crypto crypto) {
        return new CredentialCipher(crypto.keyId(), crypto.key(), crypto.retiredKeys());
    }

    /**
     * Encrypts a plaintext token under the primary key.
     *
     * @param plaintext the token, never null
     * @return the sealed value, prefixed with the primary key id
     */
    public String seal(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, keys.get(primaryKeyId), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            ByteBuffer buffer = ByteBuffer.allocate(iv.length + ciphertext.length);
            buffer.put(iv);
            buffer.put(ciphertext);

            return primaryKeyId + KEY_ID_SEPARATOR + Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to seal credential", e);
        }
    }

    /**
     * Decrypts a value produced by {@link #seal(String)}.
     *
     * @param sealed the stored value
     * @return the plaintext token
     * @throws DecryptionException if the value is malformed, names an unknown key, or fails authentication
     */
    public String open(String sealed) {
        if (sealed == null || sealed.isEmpty()) {
            throw new DecryptionException("Ciphertext is empty");
        }
        int separator = sealed.indexOf(KEY_ID_SEPARATOR);
        if (separator <= 0) {
            throw new DecryptionException("Ciphertext carries no key id");
        }
        String keyId = sealed.substring(0, separator);
        SecretKey key = keys.get(keyId);
        if (key == null) {
            throw new DecryptionException("Ciphertext was sealed with unknown key '" + keyId + "'");
        }

        byte[] payload;
        try {
            payload = Base64.getDecoder().decode(sealed.substring(separator + 1));
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Ciphertext is not valid base64", e);
        }
        if (payload.length < GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
            throw new DecryptionException("Ciphertext is too short");
        }

        try {
            ByteBuffer buffer = ByteBuffer.wrap(payload);
            byte[] iv = new byte[GCM_IV_LENGTH];
            buffer.get(iv);
            byte[] encrypted = new byte[buffer.remaining()];
            buffer.get(encrypted);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Ciphertext failed authentication", e);
        }
    }

    public String getPrimaryKeyId() {
        return primaryKeyId;
    }

    private static String requireKeyId(String keyId) {
        if (keyId == null || !KEY_ID_PATTERN.matcher(keyId).matches()) {
            throw new IllegalStateException("Key id must match " + KEY_ID_PATTERN.pattern());
        }
        return keyId;
    }

    private static SecretKey parseKey(String base64Key, String configName) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new IllegalStateException(configName + " is not configured. Generate one with: openssl rand -base64 32");
        }
        byte[] keyBytes;
        try {
            // accept URL-safe keys as well
            String normalized = base64Key.trim().replace('-', '+').replace('_', '/');
            keyBytes = Base64.getDecoder().decode(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(configName + " must be valid base64", e);
        }
        if (keyBytes.length != KEY_LENGTH) {
            throw new IllegalStateException(configName + " must decode to exactly 32 bytes, got " + keyBytes.length);
        }
        return new SecretKeySpec(keyBytes, "AES");
    }
}
