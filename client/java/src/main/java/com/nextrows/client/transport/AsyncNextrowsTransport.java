package com.nextrows.client.transport;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking counterpart of {@link NextrowsTransport}.
 *
 * <p>
 * Same contract, but failures complete the returned future exceptionally
 * with a {@link com.nextrows.client.NextrowsApiException} instead of being
 * thrown. Cancelling the future must abort the exchange.
 */
@FunctionalInterface
public interface AsyncNextrowsTransport extends AutoCloseable {

    /**
     * Start a request and return immediately.
     *
     * @param request the formatted request
     * @return a future completed with the JSON body of a 2xx response
     */
    CompletableFuture<JsonNode> sendAsync(ApiRequest request);

    /** Release transport resources. No-op by default. */
    @Override
    default void close() {
    }
}
