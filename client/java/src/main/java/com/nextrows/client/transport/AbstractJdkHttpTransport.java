package com.nextrows.client.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nextrows.NextrowsException.ResponseParsingException;
import com.nextrows.NextrowsException.ValidationException;
import com.nextrows.client.NextrowsApiException;
import com.nextrows.client.NextrowsApiException.NetworkException;
import com.nextrows.client.NextrowsApiException.RequestTimeoutException;
import com.nextrows.client.NextrowsOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared plumbing for the JDK {@link HttpClient} transports: request
 * construction, header injection, status mapping and body parsing.
 *
 * <p>
 * Each transport owns the executor it hands to its {@link HttpClient};
 * {@link #close()} shuts that executor down.
 */
abstract class AbstractJdkHttpTransport implements AutoCloseable {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Logger log = LoggerFactory.getLogger(AbstractJdkHttpTransport.class);

    protected final HttpClient httpClient;
    private final NextrowsOptions options;
    private final ExecutorService executor;

    protected AbstractJdkHttpTransport(NextrowsOptions options, String threadPrefix) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        this.options = options;
        this.executor = Executors.newCachedThreadPool(daemonThreads(threadPrefix));
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(options.timeout())
                .executor(executor)
                .build();
    }

    public NextrowsOptions options() {
        return options;
    }

    protected HttpRequest toHttpRequest(ApiRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(options.baseUrl() + request.path()))
                .timeout(options.timeout())
                .header("Authorization", "Bearer " + options.apiKey())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
        if (request.method() == HttpMethod.GET) {
            builder.GET();
        } else {
            builder.method(request.method().name(), bodyPublisher(request));
        }
        log.debug("Sending {}", request);
        return builder.build();
    }

    private static HttpRequest.BodyPublisher bodyPublisher(ApiRequest request) {
        if (!request.hasBody()) {
            return HttpRequest.BodyPublishers.noBody();
        }
        try {
            return HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(request.body()));
        } catch (JsonProcessingException e) {
            throw new ValidationException("Request body for " + request + " is not serializable", e);
        }
    }

    /**
     * Turn a completed exchange into a JSON body or a typed failure.
     */
    protected JsonNode readResponse(ApiRequest request, HttpResponse<String> response)
            throws NextrowsApiException {
        int status = response.statusCode();
        String body = response.body();
        log.debug("{} -> {}", request, status);
        if (status < 200 || status >= 300) {
            throw NextrowsApiException.forStatus(status, body);
        }
        if (body == null || body.isBlank()) {
            throw new ResponseParsingException(request + " returned an empty body");
        }
        try {
            return MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ResponseParsingException(request + " returned a body that is not JSON", e);
        }
    }

    /**
     * Map a transport-level failure to {@link RequestTimeoutException} or
     * {@link NetworkException}. Typed failures pass through.
     */
    protected NextrowsApiException translate(ApiRequest request, Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof NextrowsApiException apiException) {
            return apiException;
        }
        if (cause instanceof HttpTimeoutException) {
            return new RequestTimeoutException(
                    request + " timed out after " + options.timeout().toMillis() + " ms", cause);
        }
        if (cause instanceof IOException) {
            return new NetworkException(request + " failed: " + describe(cause), cause);
        }
        return new NetworkException(request + " failed unexpectedly: " + describe(cause), cause);
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
