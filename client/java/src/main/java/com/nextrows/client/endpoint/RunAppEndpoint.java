package com.nextrows.client.endpoint;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nextrows.NextrowsException.ValidationException;
import com.nextrows.client.model.AppInput;
import com.nextrows.client.model.RunAppJsonResponse;
import com.nextrows.client.model.RunAppRequest;
import com.nextrows.client.model.RunAppTableResponse;
import com.nextrows.client.transport.ApiRequest;

/**
 * Shared request side of the two app-run endpoints; they differ only in path
 * and response shape.
 *
 * @param <R> the typed response
 */
abstract class RunAppEndpoint<R> implements Endpoint<RunAppRequest, R> {

    static final String JSON_PATH = "/v1/apps/run/json";
    static final String TABLE_PATH = "/v1/apps/run/table";

    private final String path;

    RunAppEndpoint(String path) {
        this.path = path;
    }

    String path() {
        return path;
    }

    @Override
    public ApiRequest format(RunAppRequest request) {
        if (request == null) {
            throw new ValidationException("run app request must not be null");
        }
        if (request.appId() == null || request.appId().isBlank()) {
            throw new ValidationException("appId must not be null or blank");
        }
        ObjectNode payload = Responses.MAPPER.createObjectNode();
        payload.put("appId", request.appId());
        ArrayNode inputs = payload.putArray("inputs");
        for (AppInput input : request.inputs()) {
            ObjectNode entry = inputs.addObject();
            entry.put("key", input.key());
            entry.set("value", Responses.MAPPER.valueToTree(input.value()));
        }
        return ApiRequest.post(path, payload);
    }

    /** {@code POST /v1/apps/run/json}, rows bound to a caller-chosen type. */
    static final class Json<T> extends RunAppEndpoint<RunAppJsonResponse<T>> {

        private final JavaType responseType;

        Json(JavaType elementType) {
            super(JSON_PATH);
            this.responseType = Responses.types().constructParametricType(RunAppJsonResponse.class, elementType);
        }

        @Override
        public RunAppJsonResponse<T> parse(JsonNode body) {
            return Responses.bind(path(), body, responseType);
        }
    }

    /** {@code POST /v1/apps/run/table}. */
    static final class Table extends RunAppEndpoint<RunAppTableResponse> {

        Table() {
            super(TABLE_PATH);
        }

        @Override
        public RunAppTableResponse parse(JsonNode body) {
            return Responses.bind(path(), body, RunAppTableResponse.class);
        }
    }
}
