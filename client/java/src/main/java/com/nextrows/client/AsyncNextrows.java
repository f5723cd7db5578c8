package com.nextrows.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.nextrows.client.endpoint.Endpoint;
import com.nextrows.client.endpoint.Endpoints;
import com.nextrows.client.model.ExtractRequest;
import com.nextrows.client.model.ExtractResponse;
import com.nextrows.client.model.GetCreditsResponse;
import com.nextrows.client.model.RunAppJsonResponse;
import com.nextrows.client.model.RunAppRequest;
import com.nextrows.client.model.RunAppTableResponse;
import com.nextrows.client.transport.ApiRequest;
import com.nextrows.client.transport.AsyncNextrowsTransport;
import com.nextrows.client.transport.JdkAsyncHttpTransport;
import com.nextrows.schema.SchemaNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Asynchronous client for the NextRows API.
 *
 * <p>
 * Same operations as {@link Nextrows}, returning {@link CompletableFuture}s.
 * Methods never throw: local validation failures and
 * {@link NextrowsApiException}s complete the future exceptionally. Calls in
 * flight at the same time are independent and may finish in any order.
 * Cancelling a returned future aborts its request.
 *
 * <p>
 * Open the client in a try-with-resources block; closing it cancels pending
 * calls and releases the connection pool even if a call failed.
 *
 * <pre>{@code
 * try (AsyncNextrows client = new AsyncNextrows("sk-nr-...")) {
 *     CompletableFuture<GetCreditsResponse> credits = client.getCredits();
 *     CompletableFuture<RunAppTableResponse> table = client.runAppTable(
 *             RunAppRequest.of("abc123xyz", AppInput.of("url", "https://example.com")));
 *     CompletableFuture.allOf(credits, table).join();
 * }
 * }</pre>
 */
public final class AsyncNextrows implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncNextrows.class);

    private final NextrowsOptions options;
    private final AsyncNextrowsTransport transport;
    private final Endpoints endpoints;
    private final AtomicBoolean closed = new AtomicBoolean();

    public AsyncNextrows(String apiKey) {
        this(NextrowsOptions.of(apiKey));
    }

    public AsyncNextrows(NextrowsOptions options) {
        this(options, new JdkAsyncHttpTransport(options));
    }

    /**
     * @param options   client configuration
     * @param transport the transport to use; closed with this client
     */
    public AsyncNextrows(NextrowsOptions options, AsyncNextrowsTransport transport) {
        this(options, transport, new SchemaNormalizer());
    }

    public AsyncNextrows(NextrowsOptions options, AsyncNextrowsTransport transport, SchemaNormalizer normalizer) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport must not be null");
        }
        this.options = options;
        this.transport = transport;
        this.endpoints = new Endpoints(normalizer);
    }

    public String apiKey() {
        return options.apiKey();
    }

    public NextrowsOptions options() {
        return options;
    }

    public CompletableFuture<ExtractResponse> extract(ExtractRequest request) {
        return call(endpoints.extract(), request);
    }

    public CompletableFuture<GetCreditsResponse> getCredits() {
        return call(endpoints.credits(), null);
    }

    public CompletableFuture<RunAppJsonResponse<Map<String, Object>>> runAppJson(RunAppRequest request) {
        return call(endpoints.runAppJson(), request);
    }

    public <T> CompletableFuture<RunAppJsonResponse<T>> runAppJson(RunAppRequest request, Class<T> rowType) {
        return call(endpoints.runAppJson(rowType), request);
    }

    public <T> CompletableFuture<RunAppJsonResponse<T>> runAppJson(RunAppRequest request, TypeReference<T> rowType) {
        return call(endpoints.runAppJson(rowType), request);
    }

    public CompletableFuture<RunAppTableResponse> runAppTable(RunAppRequest request) {
        return call(endpoints.runAppTable(), request);
    }

    private <P, R> CompletableFuture<R> call(Endpoint<P, R> endpoint, P params) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("client is closed"));
        }
        ApiRequest request;
        CompletableFuture<JsonNode> exchange;
        try {
            request = endpoint.format(params);
            exchange = transport.sendAsync(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (exchange == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("transport returned no future for " + request));
        }
        CompletableFuture<R> result = exchange.thenApply(endpoint::parse);
        result.whenComplete((value, failure) -> {
            if (result.isCancelled()) {
                log.debug("{} cancelled by caller", request);
                exchange.cancel(true);
            }
        });
        return result;
    }

    /**
     * Cancel pending calls and release the transport. Idempotent.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            transport.close();
        }
    }
}
