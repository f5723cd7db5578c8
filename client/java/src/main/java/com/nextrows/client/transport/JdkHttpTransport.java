package com.nextrows.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.nextrows.client.NextrowsApiException;
import com.nextrows.client.NextrowsApiException.NetworkException;
import com.nextrows.client.NextrowsOptions;

import java.io.IOException;
import java.net.http.HttpResponse;

/**
 * Blocking {@link NextrowsTransport} on the JDK {@link java.net.http.HttpClient}.
 *
 * <p>
 * Thread-safe: the underlying client pools connections and may be used from
 * several threads at once.
 */
public class JdkHttpTransport extends AbstractJdkHttpTransport implements NextrowsTransport {

    public JdkHttpTransport(NextrowsOptions options) {
        super(options, "nextrows-http-");
    }

    @Override
    public JsonNode send(ApiRequest request) throws NextrowsApiException {
        HttpResponse<String> response;
        try {
            response = httpClient.send(toHttpRequest(request), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw translate(request, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException(request + " was interrupted", e);
        }
        return readResponse(request, response);
    }
}
