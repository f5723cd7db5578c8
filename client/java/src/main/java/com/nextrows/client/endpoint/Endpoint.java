package com.nextrows.client.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.nextrows.client.transport.ApiRequest;

/**
 * Strategy for one API operation: how to build its request and how to read
 * its response.
 *
 * <p>
 * Both halves are pure. The clients run {@link #format} before any I/O and
 * {@link #parse} only on the body of a successful exchange.
 *
 * @param <P> the caller's parameters
 * @param <R> the typed response
 */
public interface Endpoint<P, R> {

    /**
     * Validate the parameters and build the wire request.
     *
     * @param params the caller's parameters
     * @return the request ready for a transport
     * @throws com.nextrows.NextrowsException.ValidationException if the
     *         parameters break a documented limit
     */
    ApiRequest format(P params);

    /**
     * Bind a 2xx response body to the response type.
     *
     * @param body the parsed JSON body
     * @return the typed response
     * @throws com.nextrows.NextrowsException.ResponseParsingException if the
     *         body does not fit the response type
     */
    R parse(JsonNode body);
}
