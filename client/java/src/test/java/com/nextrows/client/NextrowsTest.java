package com.nextrows.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nextrows.NextrowsException.ResponseParsingException;
import com.nextrows.NextrowsException.ValidationException;
import com.nextrows.client.NextrowsApiException.AuthException;
import com.nextrows.client.NextrowsApiException.NetworkException;
import com.nextrows.client.NextrowsApiException.NotFoundException;
import com.nextrows.client.NextrowsApiException.PaymentRequiredException;
import com.nextrows.client.NextrowsApiException.RequestTimeoutException;
import com.nextrows.client.NextrowsApiException.UnknownApiException;
import com.nextrows.client.model.AppInput;
import com.nextrows.client.model.ExtractRequest;
import com.nextrows.client.model.ExtractResponse;
import com.nextrows.client.model.ExtractType;
import com.nextrows.client.model.GetCreditsResponse;
import com.nextrows.client.model.RunAppJsonResponse;
import com.nextrows.client.model.RunAppRequest;
import com.nextrows.client.model.RunAppTableResponse;
import com.nextrows.client.transport.ApiRequest;
import com.nextrows.client.transport.NextrowsTransport;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies the blocking client end to end against a local stub of the NextRows API.
 */
class NextrowsTest {

    private static final String API_KEY = "sk-nr-test-api-key";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StubApiServer server;
    private Nextrows client;

    record PricedRow(@JsonProperty("Name") String name, @JsonProperty("Price") double price) {
    }

    @BeforeEach
    void startServer() throws IOException {
        server = StubApiServer.start();
        client = new Nextrows(NextrowsOptions.builder().apiKey(API_KEY).baseUrl(server.baseUrl()).build());
    }

    @AfterEach
    void stopServer() {
        client.close();
        server.close();
    }

    @Test
    void extractReturnsServiceDataUnchanged() throws Exception {
        String body = "{\"success\":true,\"data\":[{\"name\":\"A\",\"price\":\"$1\"}]}";
        server.reply("/v1/extract", 200, body);

        ExtractResponse response = client.extract(new ExtractRequest(
                ExtractType.URL, List.of("https://example.com"), "Extract names and prices", null));

        assertTrue(response.success());
        assertEquals(objectMapper.readTree(body).get("data"), response.data());

        StubApiServer.Received received = server.received().get(0);
        assertEquals("POST", received.method());
        assertEquals("/v1/extract", received.path());
        assertEquals("Bearer " + API_KEY, received.authorization());
        assertEquals("application/json", received.contentType());
        assertEquals(objectMapper.readTree(
                "{\"type\":\"url\",\"data\":[\"https://example.com\"],\"prompt\":\"Extract names and prices\"}"),
                objectMapper.readTree(received.body()));
    }

    @Test
    void runAppJsonPreservesAllResponseFields() throws Exception {
        server.reply("/v1/apps/run/json", 200,
                "{\"success\":true,\"data\":[{\"Name\":\"A\",\"Price\":29.99}],\"runId\":\"run_1\",\"elapsedTime\":100}");

        RunAppJsonResponse<Map<String, Object>> response =
                client.runAppJson(RunAppRequest.of("abc123xyz", AppInput.of("url", "https://example.com")));

        assertTrue(response.success());
        assertEquals(1, response.data().size());
        assertEquals("A", response.data().get(0).get("Name"));
        assertEquals(29.99, response.data().get(0).get("Price"));
        assertEquals("run_1", response.runId());
        assertEquals(100.0, response.elapsedTime());
        assertEquals(objectMapper.readTree(
                "{\"appId\":\"abc123xyz\",\"inputs\":[{\"key\":\"url\",\"value\":\"https://example.com\"}]}"),
                objectMapper.readTree(server.received().get(0).body()));
    }

    @Test
    void runAppJsonBindsCallerRowType() throws Exception {
        server.reply("/v1/apps/run/json", 200,
                "{\"success\":true,\"data\":[{\"Name\":\"A\",\"Price\":29.99},{\"Name\":\"B\",\"Price\":49.99}]}");

        RunAppJsonResponse<PricedRow> response = client.runAppJson(
                RunAppRequest.of("abc123xyz", AppInput.of("maxItems", 10)), PricedRow.class);

        assertEquals(List.of(new PricedRow("A", 29.99), new PricedRow("B", 49.99)), response.data());
    }

    @Test
    void runAppTableReturnsColumnsAndRows() throws Exception {
        server.reply("/v1/apps/run/table", 200, "{\"success\":true,\"data\":{\"columns\":[\"Name\",\"Price\",\"URL\"],"
                + "\"tableData\":[[\"Product A\",29.99,\"https://example.com/a\"],"
                + "[\"Product B\",49.99,\"https://example.com/b\"]]},\"runId\":\"run_abc123\",\"elapsedTime\":2500}");

        RunAppTableResponse response =
                client.runAppTable(RunAppRequest.of("abc123xyz", AppInput.of("url", "https://example.com")));

        assertEquals(List.of("Name", "Price", "URL"), response.data().columns());
        assertEquals(List.of("Product B", 49.99, "https://example.com/b"), response.data().tableData().get(1));
        assertEquals("run_abc123", response.runId());
        assertEquals("/v1/apps/run/table", server.received().get(0).path());
    }

    @Test
    void getCreditsIssuesGetWithoutBody() throws Exception {
        server.reply("/v1/credits", 200, "{\"success\":true,\"data\":{\"credits\":42}}");

        GetCreditsResponse response = client.getCredits();

        assertEquals(42.0, response.data().credits());
        StubApiServer.Received received = server.received().get(0);
        assertEquals("GET", received.method());
        assertEquals("", received.body());
        assertEquals("application/json", received.contentType());
        assertEquals("Bearer " + API_KEY, received.authorization());
    }

    @Test
    void unauthorizedMapsToAuthException() {
        server.reply("/v1/extract", 401, "{\"error\":\"Unauthorized\",\"message\":\"Invalid API key\"}");

        AuthException thrown = assertThrows(AuthException.class, () -> client.extract(ExtractRequest.builder()
                .url("https://example.com")
                .prompt("Extract data")
                .build()));

        assertEquals(401, thrown.getStatusCode());
        assertTrue(thrown.getMessage().contains("Unauthorized"));
        assertTrue(thrown.getResponseBody().contains("Invalid API key"));
    }

    @Test
    void exhaustedCreditsMapToPaymentRequired() {
        server.reply("/v1/apps/run/table", 402, "{\"success\":false,\"error\":\"Credits exhausted\"}");

        PaymentRequiredException thrown = assertThrows(PaymentRequiredException.class,
                () -> client.runAppTable(new RunAppRequest("abc123xyz", List.of())));

        assertEquals("HTTP 402: Credits exhausted", thrown.getMessage());
    }

    @Test
    void unknownAppMapsToNotFound() {
        server.reply("/v1/apps/run/json", 404, "{\"success\":false,\"error\":\"App not found\"}");

        assertThrows(NotFoundException.class, () -> client.runAppJson(new RunAppRequest("invalid-app", List.of())));
    }

    @Test
    void otherStatusesCarryCodeAndRawBody() {
        server.reply("/v1/credits", 503, "upstream unavailable");

        UnknownApiException thrown = assertThrows(UnknownApiException.class, () -> client.getCredits());

        assertEquals(503, thrown.getStatusCode());
        assertEquals("upstream unavailable", thrown.getResponseBody());
        assertTrue(thrown.isHttpError());
    }

    @Test
    void slowResponseMapsToTimeout() throws Exception {
        server.replyAfter("/v1/credits", 3_000, 200, "{\"success\":true,\"data\":{\"credits\":1}}");
        try (Nextrows impatient = new Nextrows(NextrowsOptions.builder()
                .apiKey(API_KEY)
                .baseUrl(server.baseUrl())
                .timeoutMillis(200)
                .build())) {
            RequestTimeoutException thrown = assertThrows(RequestTimeoutException.class, impatient::getCredits);

            assertEquals(-1, thrown.getStatusCode());
        }
    }

    @Test
    void unreachableServiceMapsToNetworkException() throws Exception {
        StubApiServer stopped = StubApiServer.start();
        String deadUrl = stopped.baseUrl();
        stopped.close();

        try (Nextrows offline = new Nextrows(NextrowsOptions.builder().apiKey(API_KEY).baseUrl(deadUrl).build())) {
            NetworkException thrown = assertThrows(NetworkException.class, offline::getCredits);

            assertTrue(thrown.getCause() instanceof IOException);
        }
    }

    @Test
    void nonJsonSuccessBodyIsAParsingFailure() {
        server.reply("/v1/credits", 200, "<html>maintenance</html>");

        assertThrows(ResponseParsingException.class, () -> client.getCredits());
    }

    @Test
    void invalidRequestsNeverReachTheTransport() {
        List<ApiRequest> sent = new ArrayList<>();
        NextrowsTransport recording = request -> {
            sent.add(request);
            return objectMapper.createObjectNode().put("success", true);
        };

        try (Nextrows local = new Nextrows(NextrowsOptions.of(API_KEY), recording)) {
            assertThrows(ValidationException.class,
                    () -> local.extract(new ExtractRequest(ExtractType.URL, List.of(), null, null)));
            assertThrows(ValidationException.class, () -> local.extract(new ExtractRequest(
                    ExtractType.URL, Collections.nCopies(21, "https://example.com"), null, null)));
            assertThrows(ValidationException.class, () -> local.extract(new ExtractRequest(
                    ExtractType.TEXT, List.of("text"), "p".repeat(2001), null)));
        }

        assertEquals(0, sent.size());
    }

    @Test
    void injectedTransportIsClosedWithClientAndCallsAfterCloseFail() {
        AtomicBoolean transportClosed = new AtomicBoolean();
        NextrowsTransport transport = new NextrowsTransport() {
            @Override
            public JsonNode send(ApiRequest request) {
                return objectMapper.createObjectNode().put("success", true);
            }

            @Override
            public void close() {
                transportClosed.set(true);
            }
        };

        Nextrows local = new Nextrows(NextrowsOptions.of(API_KEY), transport);
        local.close();
        local.close();

        assertTrue(transportClosed.get());
        assertThrows(IllegalStateException.class, local::getCredits);
    }

    @Test
    void successFalseEnvelopeIsReturnedNotThrown() throws Exception {
        server.reply("/v1/credits", 200, "{\"success\":false,\"error\":\"Account suspended\"}");

        GetCreditsResponse response = client.getCredits();

        assertFalse(response.success());
        assertNull(response.data());
        assertEquals("Account suspended", response.error());
    }

    @Test
    void exposesConfiguredApiKey() {
        assertEquals(API_KEY, client.apiKey());
        assertInstanceOf(NextrowsOptions.class, client.options());
    }
}
