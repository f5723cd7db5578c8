package com.nextrows.schema;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.module.jsonSchema.JsonSchema;
import com.fasterxml.jackson.module.jsonSchema.JsonSchemaGenerator;
import com.nextrows.NextrowsException.SchemaConversionException;

/**
 * {@link SchemaConverter} backed by {@code jackson-module-jsonSchema}. The
 * module's draft-03 output is passed through {@link SchemaRewriter}.
 *
 * <p>
 * Only loaded once {@link SchemaNormalizer} has confirmed the module is on
 * the classpath.
 */
final class JacksonSchemaConverter implements SchemaConverter {

    private final ObjectMapper mapper;
    private final JsonSchemaGenerator generator;
    private final SchemaRewriter rewriter;

    JacksonSchemaConverter(ObjectMapper mapper) {
        this.mapper = mapper;
        this.generator = new JsonSchemaGenerator(mapper);
        this.rewriter = new SchemaRewriter(mapper);
    }

    @Override
    public ObjectNode convert(JavaType type) {
        JsonSchema schema;
        try {
            schema = generator.generateSchema(type);
        } catch (JsonMappingException e) {
            throw new SchemaConversionException("Cannot derive JSON Schema for " + type.toCanonical(), e);
        }
        JsonNode node = mapper.valueToTree(schema);
        if (node instanceof ObjectNode objectNode) {
            return rewriter.rewrite(objectNode, type);
        }
        throw new SchemaConversionException("Generated schema for " + type.toCanonical() + " is not a JSON object");
    }
}
