package com.numaansystems.custody.resource;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads a Google resource with a user's access token.
 */
public interface ResourceFetcher {

    /**
     * @param accessToken a valid access token
     * @param type kind of resource
     * @param id resource id as used by Google
     * @return the resource as returned by the Google API
     */
    JsonNode fetch(String accessToken, ResourceType type, String id);
}
