package com.nextrows.client.endpoint;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.nextrows.NextrowsException.ResponseParsingException;

/**
 * Structural binding of response envelopes. Every envelope must carry a
 * boolean {@code success}; other fields are optional, unknown fields are
 * ignored and cell values pass through as Jackson reads them.
 */
final class Responses {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Responses() {
    }

    static TypeFactory types() {
        return MAPPER.getTypeFactory();
    }

    static <R> R bind(String path, JsonNode body, JavaType type) {
        if (body == null || !body.isObject()) {
            throw new ResponseParsingException(path + " returned "
                    + (body == null ? "no body" : body.getNodeType() + " instead of a JSON object"));
        }
        JsonNode success = body.get("success");
        if (success == null || !success.isBoolean()) {
            throw new ResponseParsingException(path + " response has no boolean \"success\" field");
        }
        try {
            return MAPPER.convertValue(body, type);
        } catch (IllegalArgumentException e) {
            throw new ResponseParsingException(path + " response does not match " + type.toCanonical()
                    + ": " + rootMessage(e), e);
        }
    }

    static <R> R bind(String path, JsonNode body, Class<R> type) {
        return bind(path, body, types().constructType(type));
    }

    private static String rootMessage(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage();
    }
}
