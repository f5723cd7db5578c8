package com.nextrows.client.endpoint;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.nextrows.client.model.ExtractRequest;
import com.nextrows.client.model.ExtractResponse;
import com.nextrows.client.model.GetCreditsResponse;
import com.nextrows.client.model.RunAppJsonResponse;
import com.nextrows.client.model.RunAppRequest;
import com.nextrows.client.model.RunAppTableResponse;
import com.nextrows.schema.SchemaNormalizer;

import java.util.Map;

/**
 * The four NextRows operations, shared by the blocking and asynchronous
 * clients so both build and read exchanges identically.
 *
 * <p>
 * Row typing for {@code runAppJson} is chosen per call. The element type
 * only steers Jackson's binding of the response; the request is the same
 * for every type.
 */
public final class Endpoints {

    private static final JavaType DEFAULT_ROW =
            Responses.types().constructMapType(Map.class, String.class, Object.class);

    private final ExtractEndpoint extract;
    private final RunAppEndpoint.Json<Map<String, Object>> runAppJson;
    private final RunAppEndpoint.Table runAppTable;
    private final CreditsEndpoint credits;

    public Endpoints(SchemaNormalizer normalizer) {
        if (normalizer == null) {
            throw new IllegalArgumentException("normalizer must not be null");
        }
        this.extract = new ExtractEndpoint(normalizer);
        this.runAppJson = new RunAppEndpoint.Json<>(DEFAULT_ROW);
        this.runAppTable = new RunAppEndpoint.Table();
        this.credits = new CreditsEndpoint();
    }

    public Endpoint<ExtractRequest, ExtractResponse> extract() {
        return extract;
    }

    /**
     * Rows as {@code Map<String, Object>}, column name to cell value.
     */
    public Endpoint<RunAppRequest, RunAppJsonResponse<Map<String, Object>>> runAppJson() {
        return runAppJson;
    }

    public <T> Endpoint<RunAppRequest, RunAppJsonResponse<T>> runAppJson(Class<T> rowType) {
        if (rowType == null) {
            throw new IllegalArgumentException("rowType must not be null");
        }
        return new RunAppEndpoint.Json<>(Responses.types().constructType(rowType));
    }

    public <T> Endpoint<RunAppRequest, RunAppJsonResponse<T>> runAppJson(TypeReference<T> rowType) {
        if (rowType == null) {
            throw new IllegalArgumentException("rowType must not be null");
        }
        return new RunAppEndpoint.Json<>(Responses.types().constructType(rowType));
    }

    public Endpoint<RunAppRequest, RunAppTableResponse> runAppTable() {
        return runAppTable;
    }

    public Endpoint<Void, GetCreditsResponse> credits() {
        return credits;
    }
}
