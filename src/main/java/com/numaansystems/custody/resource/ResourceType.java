package com.numaansystems.custody.resource;

import com.numaansystems.custody.error.InvalidRequestException;

import java.util.Locale;

/**
 * Google resources that can be read on behalf of a connected user.
 */
public enum ResourceType {

    DRIVE("drive", "https://www.googleapis.com",
            "/drive/v3/files/{id}?fields=id,name,mimeType,modifiedTime,owners,webViewLink&supportsAllDrives=true"),
    DOCS("docs", "https://docs.googleapis.com", "/v1/documents/{id}"),
    SHEETS("sheets", "https://sheets.googleapis.com", "/v4/spreadsheets/{id}?includeGridData=false"),
    SLIDES("slides", "https://slides.googleapis.com", "/v1/presentations/{id}");

    private final String pathName;
    private final String defaultBaseUrl;
    private final String pathTemplate;

    ResourceType(String pathName, String defaultBaseUrl, String pathTemplate) {
        this.pathName = pathName;
        this.defaultBaseUrl = defaultBaseUrl;
        this.pathTemplate = pathTemplate;
    }

    public String getPathName() {
        return pathName;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    /**
     * @param id an already validated resource id
     * @return the path and query of the resource relative to its base URL
     */
    public String pathFor(String id) {
        return pathTemplate.replace("{id}", id);
    }

    /**
     * @param pathName the type segment of the request path
     * @return the matching type
     * @throws InvalidRequestException if no type has that name
     */
    public static ResourceType fromPath(String pathName) {
        if (pathName != null) {
            String normalized = pathName.trim().toLowerCase(Locale.ROOT);
            for (ResourceType type : values()) {
                if (type.pathName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new InvalidRequestException("Unknown resource type: " + pathName);
    }
}
