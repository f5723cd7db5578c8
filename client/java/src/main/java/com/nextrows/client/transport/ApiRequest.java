package com.nextrows.client.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Immutable request to send to the NextRows API.
 *
 * <p>
 * Carries only what varies per operation; the transport adds the base URL,
 * authorization and content headers and the timeout.
 *
 * @param method the HTTP method
 * @param path   the endpoint path, starting with {@code /}
 * @param body   the JSON body, or null for requests without one
 */
public record ApiRequest(HttpMethod method, String path, JsonNode body) {

    public ApiRequest {
        if (method == null) {
            throw new IllegalArgumentException("method must not be null");
        }
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/'");
        }
    }

    public static ApiRequest get(String path) {
        return new ApiRequest(HttpMethod.GET, path, null);
    }

    public static ApiRequest post(String path, JsonNode body) {
        return new ApiRequest(HttpMethod.POST, path, body);
    }

    public boolean hasBody() {
        return body != null;
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
