package com.nextrows.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of an extraction.
 *
 * @param success whether the service reported success
 * @param data    extracted data, shaped by the schema or inferred by the
 *                service; null when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractResponse(boolean success, JsonNode data) {

    public boolean hasData() {
        return data != null && !data.isNull() && !data.isMissingNode();
    }
}
