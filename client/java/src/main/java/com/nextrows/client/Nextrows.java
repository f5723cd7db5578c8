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
import com.nextrows.client.transport.JdkHttpTransport;
import com.nextrows.client.transport.NextrowsTransport;
import com.nextrows.schema.SchemaNormalizer;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Blocking client for the NextRows API.
 *
 * <p>
 * Every call runs to completion on the calling thread. Instances are
 * thread-safe and meant to be shared; close the client to release its
 * connection pool.
 *
 * <pre>{@code
 * try (Nextrows client = new Nextrows("sk-nr-...")) {
 *     ExtractResponse result = client.extract(ExtractRequest.builder()
 *             .url("https://example.com/products")
 *             .prompt("Extract all product names and prices")
 *             .build());
 * }
 * }</pre>
 *
 * @see AsyncNextrows
 */
public final class Nextrows implements AutoCloseable {

    private final NextrowsOptions options;
    private final NextrowsTransport transport;
    private final Endpoints endpoints;
    private final AtomicBoolean closed = new AtomicBoolean();

    public Nextrows(String apiKey) {
        this(NextrowsOptions.of(apiKey));
    }

    public Nextrows(NextrowsOptions options) {
        this(options, new JdkHttpTransport(options));
    }

    /**
     * @param options   client configuration
     * @param transport the transport to use; closed with this client
     */
    public Nextrows(NextrowsOptions options, NextrowsTransport transport) {
        this(options, transport, new SchemaNormalizer());
    }

    public Nextrows(NextrowsOptions options, NextrowsTransport transport, SchemaNormalizer normalizer) {
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

    /**
     * Extract structured data from URLs or text.
     *
     * @throws com.nextrows.NextrowsException.ValidationException if the request
     *         breaks a limit; nothing is sent in that case
     * @throws NextrowsApiException if the service or network call fails
     */
    public ExtractResponse extract(ExtractRequest request) throws NextrowsApiException {
        return call(endpoints.extract(), request);
    }

    /**
     * Credit balance of the account the API key belongs to.
     */
    public GetCreditsResponse getCredits() throws NextrowsApiException {
        return call(endpoints.credits(), null);
    }

    /**
     * Run a published app; rows come back as column-name to cell-value maps.
     */
    public RunAppJsonResponse<Map<String, Object>> runAppJson(RunAppRequest request) throws NextrowsApiException {
        return call(endpoints.runAppJson(), request);
    }

    /**
     * Run a published app and bind each row to {@code rowType}.
     */
    public <T> RunAppJsonResponse<T> runAppJson(RunAppRequest request, Class<T> rowType)
            throws NextrowsApiException {
        return call(endpoints.runAppJson(rowType), request);
    }

    /**
     * Run a published app and bind each row to a generic {@code rowType}.
     */
    public <T> RunAppJsonResponse<T> runAppJson(RunAppRequest request, TypeReference<T> rowType)
            throws NextrowsApiException {
        return call(endpoints.runAppJson(rowType), request);
    }

    /**
     * Run a published app and get its output as columns and rows.
     */
    public RunAppTableResponse runAppTable(RunAppRequest request) throws NextrowsApiException {
        return call(endpoints.runAppTable(), request);
    }

    private <P, R> R call(Endpoint<P, R> endpoint, P params) throws NextrowsApiException {
        if (closed.get()) {
            throw new IllegalStateException("client is closed");
        }
        ApiRequest request = endpoint.format(params);
        JsonNode body = transport.send(request);
        return endpoint.parse(body);
    }

    /**
     * Release the transport. Idempotent.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            transport.close();
        }
    }
}
