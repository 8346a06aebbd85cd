package com.numaansystems.custody.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.numaansystems.custody.error.InvalidStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * Produces and verifies the OAuth {@code state} parameter.
 *
 * <p>The state is a compact, self-contained token that binds the consent flow
 * to the user it was started for. Nothing is stored server side when it is
 * issued; verification relies on the signature and the embedded expiry.</p>
 *
 * <h2>Format</h2>
 * <pre>
 * base64url(header) "." base64url(payload) "." base64url(HMAC-SHA256(header "." payload))
 *
 * header  = {"alg":"HS256","typ":"STATE"}
 * payload = {"u":user,"p":"google_oauth","iat":seconds,"exp":seconds,"n":nonce}
 * </pre>
 * <p>All parts are unpadded URL-safe base64, so the token can travel as a
 * query parameter without further encoding.</p>
 *
 * <h2>Rejection rules</h2>
 * <ul>
 *   <li>Not three dot-separated parts, or a payload that is not base64url</li>
 *   <li>Signature text that differs from the expected one (compared in constant time)</li>
 *   <li>Payload that is not JSON, has the wrong purpose, or lacks fields</li>
 *   <li>Issued more than five seconds in the future</li>
 *   <li>Current time at or after {@code exp}</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class SignedStateCodec {

    private static final Logger logger = LoggerFactory.getLogger(SignedStateCodec.class);

    static final String PURPOSE = "google_oauth";

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String SEPARATOR = ".";
    private static final int NONCE_LENGTH = 16;
    private static final Duration FUTURE_LEEWAY = Duration.ofSeconds(5);

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecretKeySpec signingKey;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();
    private final String encodedHeader;

    /**
     * @param signingSecret process-wide secret used for the HMAC
     * @param objectMapper JSON mapper for the header and payload
     * @param clock time source for issue and expiry checks
     */
    public SignedStateCodec(String signingSecret, ObjectMapper objectMapper, Clock clock) {
        if (signingSecret == null || signingSecret.length() < 16) {
            throw new IllegalStateException("custody.state.signing-secret must be at least 16 characters");
        }
        this.signingKey = new SecretKeySpec(signingSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
        this.objectMapper = objectMapper;
        this.clock = clock;

        ObjectNode header = objectMapper.createObjectNode();
        header.put("alg", "HS256");
        header.put("typ", "STATE");
        this.encodedHeader = encodeJson(header);
    }

    /**
     * Issues a state token for a user.
     *
     * @param userIdentity the user starting the consent flow
     * @param ttl how long the token stays valid, must be positive
     * @return the URL-safe state token
     */
    public String encode(String userIdentity, Duration ttl) {
        if (userIdentity == null || userIdentity.isEmpty()) {
            throw new IllegalArgumentException("userIdentity is required");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }

        byte[] nonce = new byte[NONCE_LENGTH];
        secureRandom.nextBytes(nonce);
        long issuedAt = clock.instant().getEpochSecond();

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("u", userIdentity);
        payload.put("p", PURPOSE);
        payload.put("iat", issuedAt);
        payload.put("exp", issuedAt + ttl.getSeconds());
        payload.put("n", ENCODER.encodeToString(nonce));

        String signingInput = encodedHeader + SEPARATOR + encodeJson(payload);
        return signingInput + SEPARATOR + ENCODER.encodeToString(sign(signingInput));
    }

    /**
     * Verifies a state token and returns its contents.
     *
     * @param token the state received on the callback
     * @return the verified flow state
     * @throws InvalidStateException if the token is malformed, tampered with, or expired
     */
    public FlowState decode(String token) {
        if (token == null || token.isEmpty()) {
            throw new InvalidStateException("State is missing");
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new InvalidStateException("Malformed state");
        }

        // compared as encoded text: the decoder ignores the unused low bits of the last character
        String expectedSignature = ENCODER.encodeToString(sign(parts[0] + SEPARATOR + parts[1]));
        if (!MessageDigest.isEqual(expectedSignature.getBytes(StandardCharsets.US_ASCII),
                parts[2].getBytes(StandardCharsets.UTF_8))) {
            logger.warn("State verification failed: signature mismatch");
            throw new InvalidStateException("Invalid state signature");
        }

        byte[] payloadBytes;
        try {
            payloadBytes = DECODER.decode(parts[1]);
        } catch (IllegalArgumentException e) {
            throw new InvalidStateException("Malformed state", e);
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(payloadBytes);
        } catch (IOException e) {
            throw new InvalidStateException("Invalid state payload", e);
        }
        if (payload == null || !payload.isObject()) {
            throw new InvalidStateException("Invalid state payload");
        }
        if (!PURPOSE.equals(payload.path("p").asText(null))) {
            throw new InvalidStateException("Unexpected state purpose");
        }
        JsonNode iatNode = payload.path("iat");
        JsonNode expNode = payload.path("exp");
        if (!iatNode.canConvertToLong() || !expNode.canConvertToLong()) {
            throw new InvalidStateException("Invalid iat/exp in state");
        }

        Instant issuedAt = Instant.ofEpochSecond(iatNode.asLong());
        Instant expiresAt = Instant.ofEpochSecond(expNode.asLong());
        Instant now = clock.instant();

        if (issuedAt.isAfter(now.plus(FUTURE_LEEWAY))) {
            throw new InvalidStateException("State issued in the future");
        }
        if (!now.isBefore(expiresAt)) {
            logger.info("State verification failed: expired at {}", expiresAt);
            throw new InvalidStateException("State expired");
        }

        String userIdentity = payload.path("u").asText("");
        String nonce = payload.path("n").asText("");
        if (userIdentity.isEmpty() || nonce.isEmpty()) {
            throw new InvalidStateException("State is missing user or nonce");
        }
        return new FlowState(userIdentity, nonce, issuedAt, expiresAt);
    }

    private byte[] sign(String signingInput) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(signingKey);
            return mac.doFinal(signingInput.getBytes(StandardCharsets.US_ASCII));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute state signature", e);
        }
    }

    private String encodeJson(ObjectNode node) {
        try {
            return ENCODER.encodeToString(objectMapper.writeValueAsBytes(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state", e);
        }
    }
}
