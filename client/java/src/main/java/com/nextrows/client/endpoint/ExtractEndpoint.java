package com.nextrows.client.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nextrows.NextrowsException.ValidationException;
import com.nextrows.client.model.ExtractRequest;
import com.nextrows.client.model.ExtractResponse;
import com.nextrows.client.transport.ApiRequest;
import com.nextrows.schema.SchemaNormalizer;

/**
 * {@code POST /v1/extract}. Schemas are normalized into JSON Schema before
 * they are sent; absent optional fields are left out of the payload.
 */
final class ExtractEndpoint implements Endpoint<ExtractRequest, ExtractResponse> {

    static final String PATH = "/v1/extract";

    private final SchemaNormalizer normalizer;

    ExtractEndpoint(SchemaNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public ApiRequest format(ExtractRequest request) {
        if (request == null) {
            throw new ValidationException("extract request must not be null");
        }
        if (request.type() == null) {
            throw new ValidationException("type must be set to URL or TEXT");
        }
        if (request.data() == null || request.data().isEmpty()) {
            throw new ValidationException("data must contain at least one entry");
        }
        if (request.data().size() > ExtractRequest.MAX_DATA_ENTRIES) {
            throw new ValidationException("data must contain at most " + ExtractRequest.MAX_DATA_ENTRIES
                    + " entries, got " + request.data().size());
        }
        if (request.prompt() != null && request.prompt().length() > ExtractRequest.MAX_PROMPT_LENGTH) {
            throw new ValidationException("prompt must be at most " + ExtractRequest.MAX_PROMPT_LENGTH
                    + " characters, got " + request.prompt().length());
        }

        ObjectNode payload = Responses.MAPPER.createObjectNode();
        payload.put("type", request.type().wireValue());
        ArrayNode data = payload.putArray("data");
        for (String entry : request.data()) {
            if (entry == null) {
                throw new ValidationException("data entries must not be null");
            }
            data.add(entry);
        }
        if (request.prompt() != null) {
            payload.put("prompt", request.prompt());
        }
        if (request.schema() != null) {
            payload.set("schema", normalizer.normalize(request.schema()));
        }
        return ApiRequest.post(PATH, payload);
    }

    @Override
    public ExtractResponse parse(JsonNode body) {
        return Responses.bind(PATH, body, ExtractResponse.class);
    }
}
