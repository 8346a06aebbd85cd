package com.numaansystems.custody.upstream;

/**
 * Status and body of a completed upstream call.
 *
 * @param status HTTP status code
 * @param body response body, empty if there was none
 */
public record UpstreamResponse(int status, String body) {

    private static final int EXCERPT_LENGTH = 200;

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    /**
     * @return the first 200 characters of the body, for messages and logs
     */
    public String excerpt() {
        if (body == null) {
            return "";
        }
        return body.length() <= EXCERPT_LENGTH ? body : body.substring(0, EXCERPT_LENGTH);
    }
}
