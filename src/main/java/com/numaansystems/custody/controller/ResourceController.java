package com.numaansystems.custody.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.numaansystems.custody.lifecycle.TokenLifecycleManager;
import com.numaansystems.custody.lifecycle.ValidAccessToken;
import com.numaansystems.custody.resource.ResourceFetcher;
import com.numaansystems.custody.resource.ResourceType;
import com.numaansystems.custody.store.UserIdentity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reads Google Drive, Docs, Sheets and Slides resources on behalf of a
 * connected user. Internal only.
 */
@RestController
public class ResourceController {

    private final TokenLifecycleManager lifecycleManager;
    private final ResourceFetcher resourceFetcher;

    public ResourceController(TokenLifecycleManager lifecycleManager, ResourceFetcher resourceFetcher) {
        this.lifecycleManager = lifecycleManager;
        this.resourceFetcher = resourceFetcher;
    }

    @GetMapping("/google/{type}/{id}")
    public ResponseEntity<JsonNode> resource(@PathVariable String type,
                                             @PathVariable String id,
                                             @RequestParam(name = "user_id", required = false) String userId) {
        ResourceType resourceType = ResourceType.fromPath(type);
        UserIdentity user = UserIdentity.of(userId);
        ValidAccessToken token = lifecycleManager.getValidToken(user);
        return ResponseEntity.ok(resourceFetcher.fetch(token.accessToken(), resourceType, id));
    }
}
