package com.numaansystems.custody.resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.custody.error.InvalidRequestException;
import com.numaansystems.custody.error.ReauthRequiredException;
import com.numaansystems.custody.error.UpstreamExchangeException;
import com.numaansystems.custody.upstream.UpstreamHttpClient;
import com.numaansystems.custody.upstream.UpstreamResponse;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

import java.io.IOException;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * {@link ResourceFetcher} backed by the Google Drive, Docs, Sheets and
 * Slides REST APIs.
 *
 * <p>A 401 from Google means the token was revoked on Google's side even
 * though it has not expired yet; the user has to reconnect. The stored
 * record is left alone.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class GoogleResourceFetcher implements ResourceFetcher {

    private static final Logger logger = LoggerFactory.getLogger(GoogleResourceFetcher.class);

    private static final Pattern RESOURCE_ID = Pattern.compile("^[A-Za-z0-9_-]{3,200}$");

    private final UpstreamHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, String> baseUrlOverrides;

    /**
     * @param httpClient shared upstream client
     * @param objectMapper JSON mapper for responses
     * @param baseUrlOverrides base URL per type name, for types that should not use Google's default host
     */
    public GoogleResourceFetcher(UpstreamHttpClient httpClient, ObjectMapper objectMapper,
                                 Map<String, String> baseUrlOverrides) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrlOverrides = baseUrlOverrides;
    }

    @Override
    public JsonNode fetch(String accessToken, ResourceType type, String id) {
        if (id == null || !RESOURCE_ID.matcher(id).matches()) {
            throw new InvalidRequestException("Invalid resource id");
        }

        HttpGet request = new HttpGet(baseUrl(type) + type.pathFor(id));
        request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
        request.setHeader(HttpHeaders.ACCEPT, "application/json");

        UpstreamResponse response = httpClient.execute(request, "Google " + type.getPathName() + " request");
        if (response.status() == 401) {
            logger.warn("Google rejected the access token for a {} request", type.getPathName());
            throw new ReauthRequiredException("Google token invalid; user must reconnect");
        }
        if (!response.isSuccess()) {
            throw new UpstreamExchangeException(
                    "Google API error: " + response.status() + " " + response.excerpt());
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new UpstreamExchangeException("Google API returned a malformed response", e);
        }
    }

    private String baseUrl(ResourceType type) {
        String base = baseUrlOverrides.getOrDefault(type.getPathName(), type.getDefaultBaseUrl());
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
