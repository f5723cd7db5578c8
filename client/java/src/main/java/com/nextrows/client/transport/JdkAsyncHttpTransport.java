package com.nextrows.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.nextrows.client.NextrowsOptions;

import java.net.http.HttpResponse;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-blocking {@link AsyncNextrowsTransport} on
 * {@link java.net.http.HttpClient#sendAsync}.
 *
 * <p>
 * Calls are independent: nothing queues or orders them. Cancelling a
 * returned future cancels the JDK exchange, which aborts the request and
 * frees its connection. {@link #close()} cancels whatever is still in
 * flight before shutting the executor down.
 */
public class JdkAsyncHttpTransport extends AbstractJdkHttpTransport implements AsyncNextrowsTransport {

    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();

    public JdkAsyncHttpTransport(NextrowsOptions options) {
        super(options, "nextrows-async-http-");
    }

    @Override
    public CompletableFuture<JsonNode> sendAsync(ApiRequest request) {
        CompletableFuture<HttpResponse<String>> exchange;
        try {
            exchange = httpClient.sendAsync(toHttpRequest(request), HttpResponse.BodyHandlers.ofString());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        inFlight.add(result);
        exchange.whenComplete((response, failure) -> {
            if (failure != null) {
                result.completeExceptionally(translate(request, failure));
                return;
            }
            try {
                result.complete(readResponse(request, response));
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((body, failure) -> {
            inFlight.remove(result);
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    /**
     * @return the number of exchanges started and not yet completed
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    @Override
    public void close() {
        for (CompletableFuture<?> pending : inFlight) {
            pending.cancel(true);
        }
        super.close();
    }
}
