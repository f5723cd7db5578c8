package com.nextrows.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.nextrows.client.NextrowsApiException;

/**
 * Blocking transport SPI.
 *
 * <p>
 * The client formats the request; the transport handles the exchange. The
 * default implementation is {@link JdkHttpTransport}; tests and callers with
 * their own HTTP stack can plug in any implementation.
 */
@FunctionalInterface
public interface NextrowsTransport extends AutoCloseable {

    /**
     * Execute a request on the calling thread and return the parsed body.
     *
     * @param request the formatted request
     * @return the JSON response body of a 2xx response
     * @throws NextrowsApiException if the exchange fails or the status is not
     *                              2xx
     */
    JsonNode send(ApiRequest request) throws NextrowsApiException;

    /** Release transport resources. No-op by default. */
    @Override
    default void close() {
    }
}
