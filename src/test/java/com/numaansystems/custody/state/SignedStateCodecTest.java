package com.numaansystems.custody.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.custody.error.InvalidStateException;
import com.numaansystems.custody.support.MutableClock;
import com.numaansystems.custody.support.TestKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SignedStateCodec.
 *
 * <p>Tests issuing, verification, expiry, tampering and format errors.</p>
 */
class SignedStateCodecTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private SignedStateCodec codec;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        codec = new SignedStateCodec(TestKeys.STATE_SECRET, objectMapper, clock);
    }

    @Test
    @DisplayName("Should decode a freshly issued state")
    void testEncodeDecode() {
        String token = codec.encode("alice@example.com", Duration.ofMinutes(5));

        FlowState state = codec.decode(token);

        assertEquals("alice@example.com", state.userIdentity());
        assertEquals(NOW, state.issuedAt());
        assertEquals(NOW.plusSeconds(300), state.expiresAt());
        assertFalse(state.nonce().isEmpty());
    }

    @Test
    @DisplayName("Should produce URL-safe tokens with three parts")
    void testFormat() {
        String token = codec.encode("user with spaces/and+symbols", Duration.ofMinutes(5));

        assertEquals(3, token.split("\\.").length);
        assertTrue(token.matches("[A-Za-z0-9_.-]+"), "Token should only use URL-safe characters");
    }

    @Test
    @DisplayName("Should issue a different nonce every time")
    void testUniqueNonce() {
        FlowState first = codec.decode(codec.encode("alice", Duration.ofMinutes(5)));
        FlowState second = codec.decode(codec.encode("alice", Duration.ofMinutes(5)));

        assertNotEquals(first.nonce(), second.nonce());
    }

    @Test
    @DisplayName("Should accept a state until its expiry and reject it from then on")
    void testExpiry() {
        String token = codec.encode("alice", Duration.ofSeconds(300));

        clock.advance(Duration.ofSeconds(299));
        assertEquals("alice", codec.decode(token).userIdentity());

        clock.advance(Duration.ofSeconds(1));
        assertThrows(InvalidStateException.class, () -> codec.decode(token));
    }

    @Test
    @DisplayName("Should reject a state issued too far in the future")
    void testIssuedInFuture() {
        clock.set(NOW.plusSeconds(60));
        String token = codec.encode("alice", Duration.ofMinutes(5));
        clock.set(NOW);

        assertThrows(InvalidStateException.class, () -> codec.decode(token));
    }

    @Test
    @DisplayName("Should reject a state with a modified payload")
    void testTamperedPayload() {
        String token = codec.encode("alice", Duration.ofMinutes(5));
        String[] parts = token.split("\\.");
        String payload = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8)
                .replace("\"alice\"", "\"mallory\"");
        String forged = parts[0] + "." + Base64.getUrlEncoder().withoutPadding()
                .encodeToString(payload.getBytes(StandardCharsets.UTF_8)) + "." + parts[2];

        assertThrows(InvalidStateException.class, () -> codec.decode(forged));
    }

    @Test
    @DisplayName("Should reject a state with any single bit of its signature flipped")
    void testSignatureBitFlips() {
        for (int i = 0; i < 20; i++) {
            String token = codec.encode("alice-" + i, Duration.ofMinutes(5));
            int signatureStart = token.lastIndexOf('.') + 1;
            assertEveryBitFlipRejected(token, signatureStart, token.length());
        }
    }

    @Test
    @DisplayName("Should reject a state with any single bit of its payload flipped")
    void testPayloadBitFlips() {
        String token = codec.encode("alice", Duration.ofMinutes(5));
        int payloadStart = token.indexOf('.') + 1;
        int payloadEnd = token.lastIndexOf('.');

        assertEveryBitFlipRejected(token, payloadStart, payloadEnd);
    }

    @Test
    @DisplayName("Should reject a state signed with another secret")
    void testForeignSecret() {
        SignedStateCodec other = new SignedStateCodec("another-secret-of-enough-length", objectMapper, clock);
        String token = other.encode("alice", Duration.ofMinutes(5));

        assertThrows(InvalidStateException.class, () -> codec.decode(token));
    }

    @Test
    @DisplayName("Should reject malformed tokens")
    void testMalformed() {
        assertThrows(InvalidStateException.class, () -> codec.decode(null));
        assertThrows(InvalidStateException.class, () -> codec.decode(""));
        assertThrows(InvalidStateException.class, () -> codec.decode("only.two"));
        assertThrows(InvalidStateException.class, () -> codec.decode("a.b.c.d"));
        assertThrows(InvalidStateException.class, () -> codec.decode("a.b.%%%"));
    }

    @Test
    @DisplayName("Should reject a correctly signed token with another purpose")
    void testWrongPurpose() {
        String token = codec.encode("alice", Duration.ofMinutes(5));
        String[] parts = token.split("\\.");
        String payload = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8)
                .replace(SignedStateCodec.PURPOSE, "password_reset");
        String reencoded = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(payload.getBytes(StandardCharsets.UTF_8));

        // re-sign with the same secret so only the purpose check can fail
        String resigned = resign(parts[0], reencoded);

        assertThrows(InvalidStateException.class, () -> codec.decode(resigned));
    }

    @Test
    @DisplayName("Should refuse invalid arguments when issuing")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> codec.encode("", Duration.ofMinutes(5)));
        assertThrows(IllegalArgumentException.class, () -> codec.encode(null, Duration.ofMinutes(5)));
        assertThrows(IllegalArgumentException.class, () -> codec.encode("alice", Duration.ZERO));
        assertThrows(IllegalStateException.class, () -> new SignedStateCodec("short", objectMapper, clock));
    }

    private void assertEveryBitFlipRejected(String token, int from, int to) {
        for (int position = from; position < to; position++) {
            for (int bit = 0; bit < 7; bit++) {
                char[] chars = token.toCharArray();
                chars[position] = (char) (chars[position] ^ (1 << bit));
                String flipped = new String(chars);
                assertThrows(InvalidStateException.class, () -> codec.decode(flipped),
                        "Flipping bit " + bit + " at position " + position + " should be rejected");
            }
        }
    }

    private static String resign(String header, String payload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(TestKeys.STATE_SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] signature = mac.doFinal((header + "." + payload).getBytes(StandardCharsets.US_ASCII));
            return header + "." + payload + "." + Base64.getUrlEncoder().withoutPadding().encodeToString(signature);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }
}
