package com.numaansystems.custody.controller;

import com.numaansystems.custody.error.ConsentDeniedException;
import com.numaansystems.custody.lifecycle.FlowCompletion;
import com.numaansystems.custody.lifecycle.TokenLifecycleManager;
import com.numaansystems.custody.lifecycle.ValidAccessToken;
import com.numaansystems.custody.store.UserIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Google consent flow and token hand-out.
 *
 * <ul>
 *   <li>GET /auth/google/url - consent URL for a user (public)</li>
 *   <li>GET /auth/google/callback - Google redirects here after consent (public)</li>
 *   <li>GET /auth/google/token - valid access token for a user (internal)</li>
 *   <li>POST /auth/google/revoke - disconnect a user (internal)</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestController
@RequestMapping("/auth/google")
public class OAuthController {

    private static final Logger logger = LoggerFactory.getLogger(OAuthController.class);

    private final TokenLifecycleManager lifecycleManager;

    public OAuthController(TokenLifecycleManager lifecycleManager) {
        this.lifecycleManager = lifecycleManager;
    }

    @GetMapping("/url")
    public ResponseEntity<Map<String, Object>> authorizationUrl(
            @RequestParam(name = "user_id", required = false) String userId) {
        UserIdentity user = UserIdentity.of(userId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("auth_url", lifecycleManager.beginFlow(user));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/callback")
    public ResponseEntity<Map<String, Object>> callback(@RequestParam(required = false) String code,
                                                        @RequestParam(required = false) String state,
                                                        @RequestParam(required = false) String error) {
        if (error != null && !error.isEmpty()) {
            logger.info("Consent callback reported error: {}", error);
            throw new ConsentDeniedException("Google consent was not granted: " + error);
        }

        FlowCompletion completion = lifecycleManager.completeFlow(code, state);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("connected", true);
        body.put("user_id", completion.user().value());
        body.put("scopes", completion.scopes());
        body.put("expires_at", completion.expiresAt().toString());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/token")
    public ResponseEntity<Map<String, Object>> token(
            @RequestParam(name = "user_id", required = false) String userId) {
        ValidAccessToken token = lifecycleManager.getValidToken(UserIdentity.of(userId));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("access_token", token.accessToken());
        body.put("expires_at", token.expiresAt().toString());
        body.put("scopes", token.scopes());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/revoke")
    public ResponseEntity<Map<String, Object>> revoke(
            @RequestParam(name = "user_id", required = false) String userId) {
        boolean held = lifecycleManager.revoke(UserIdentity.of(userId));
        logger.debug("Revoke request completed (credentialHeld={})", held);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("revoked", true);
        return ResponseEntity.ok(body);
    }
}
