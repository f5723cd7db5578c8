package com.nextrows.client.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.nextrows.client.model.GetCreditsResponse;
import com.nextrows.client.transport.ApiRequest;

/** {@code GET /v1/credits}; takes no parameters and sends no body. */
final class CreditsEndpoint implements Endpoint<Void, GetCreditsResponse> {

    static final String PATH = "/v1/credits";

    @Override
    public ApiRequest format(Void params) {
        return ApiRequest.get(PATH);
    }

    @Override
    public GetCreditsResponse parse(JsonNode body) {
        return Responses.bind(PATH, body, GetCreditsResponse.class);
    }
}
