package com.numaansystems.custody.security;

import com.numaansystems.custody.error.ForbiddenOriginException;
import com.numaansystems.custody.error.UnauthorizedCallerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Decides whether a caller may use the internal endpoints.
 *
 * <p>Two checks, in order:</p>
 * <ol>
 *   <li>The {@code X-API-Key} header equals the configured internal key
 *       (constant-time comparison). Failure: 401.</li>
 *   <li>If an address allow-list is configured, the remote address matches
 *       one of its entries. Failure: 403.</li>
 * </ol>
 *
 * <p>An empty configured key denies every caller. Neither failure says which
 * part of the check went wrong.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class AccessGate {

    private static final Logger logger = LoggerFactory.getLogger(AccessGate.class);

    public static final String API_KEY_HEADER = "X-API-Key";

    private final byte[] expectedKey;
    private final AddressAllowList allowList;

    public AccessGate(String apiKey, AddressAllowList allowList) {
        this.expectedKey = apiKey == null ? new byte[0] : apiKey.getBytes(StandardCharsets.UTF_8);
        this.allowList = allowList;
        if (expectedKey.length == 0) {
            logger.warn("custody.internal.api-key is not set; all internal requests will be rejected");
        }
    }

    /**
     * @param presentedKey value of the X-API-Key header, may be null
     * @param remoteAddress remote address of the connection
     * @throws UnauthorizedCallerException if the key is missing or wrong
     * @throws ForbiddenOriginException if the address is not allowed
     */
    public void check(String presentedKey, String remoteAddress) {
        if (expectedKey.length == 0 || presentedKey == null
                || !MessageDigest.isEqual(expectedKey, presentedKey.getBytes(StandardCharsets.UTF_8))) {
            logger.warn("Internal request from {} rejected: missing or invalid API key", remoteAddress);
            throw new UnauthorizedCallerException();
        }
        if (!allowList.isEmpty() && !allowList.permits(remoteAddress)) {
            logger.warn("Internal request from {} rejected: address not allowed", remoteAddress);
            throw new ForbiddenOriginException();
        }
    }

    /**
     * @return true if the configured allow-list could not be parsed
     */
    public boolean isMisconfigured() {
        return allowList.isMisconfigured();
    }
}
