package com.nextrows.client.model;

import com.nextrows.schema.SchemaInput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request for structured extraction from URLs or text.
 *
 * <p>
 * Limits (1 to 20 {@code data} entries, prompt up to 2000 characters) are
 * checked when the request is formatted, before anything is sent.
 *
 * @param type   whether {@code data} holds URLs or raw text
 * @param data   the sources to extract from
 * @param prompt optional natural-language instruction, or null
 * @param schema optional output schema, or null to let the service infer one
 */
public record ExtractRequest(ExtractType type, List<String> data, String prompt, SchemaInput schema) {

    public static final int MAX_DATA_ENTRIES = 20;
    public static final int MAX_PROMPT_LENGTH = 2000;

    public ExtractRequest {
        data = data != null ? Collections.unmodifiableList(new ArrayList<>(data)) : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Fluent builder; {@link #schema(Object)} accepts any representation {@link SchemaInput#of(Object)} does. */
    public static final class Builder {
        private ExtractType type;
        private final List<String> data = new ArrayList<>();
        private String prompt;
        private SchemaInput schema;

        private Builder() {
        }

        public Builder type(ExtractType type) {
            this.type = type;
            return this;
        }

        public Builder url(String url) {
            this.type = ExtractType.URL;
            this.data.add(url);
            return this;
        }

        public Builder text(String text) {
            this.type = ExtractType.TEXT;
            this.data.add(text);
            return this;
        }

        public Builder data(List<String> data) {
            this.data.clear();
            this.data.addAll(data);
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder schema(SchemaInput schema) {
            this.schema = schema;
            return this;
        }

        public Builder schema(Object schema) {
            this.schema = schema != null ? SchemaInput.of(schema) : null;
            return this;
        }

        public ExtractRequest build() {
            return new ExtractRequest(type, data, prompt, schema);
        }
    }
}
