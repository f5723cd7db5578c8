package com.nextrows.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.nextrows.NextrowsException.SchemaConversionException;

import java.lang.reflect.Type;
import java.util.Map;

/**
 * A schema supplied by the caller for structured extraction.
 *
 * <p>
 * Exactly two shapes are accepted:
 * <ul>
 * <li>{@link Document}: a canonical JSON Schema object, sent as-is</li>
 * <li>{@link TypeModel}: a Java type whose JSON Schema is derived by
 * introspection before sending</li>
 * </ul>
 *
 * <p>
 * Use {@link #of(Object)} to resolve an arbitrary caller object to one of
 * the two.
 */
public sealed interface SchemaInput permits SchemaInput.Document, SchemaInput.TypeModel {

    /**
     * A canonical JSON Schema document.
     *
     * @param document the schema root; must be a JSON object
     */
    record Document(ObjectNode document) implements SchemaInput {

        public Document {
            if (document == null) {
                throw new IllegalArgumentException("document must not be null");
            }
        }
    }

    /**
     * A Java type to be converted into JSON Schema.
     *
     * @param type the fully resolved type, generics included
     */
    record TypeModel(JavaType type) implements SchemaInput {

        public TypeModel {
            if (type == null) {
                throw new IllegalArgumentException("type must not be null");
            }
        }
    }

    /**
     * Wrap an existing JSON Schema document.
     */
    static SchemaInput document(ObjectNode document) {
        return new Document(document);
    }

    /**
     * Describe the extraction output by a Java class or record.
     */
    static SchemaInput type(Class<?> type) {
        return new TypeModel(TypeFactory.defaultInstance().constructType(type));
    }

    /**
     * Describe the extraction output by a generic type, e.g.
     * {@code new TypeReference<List<Product>>() {}}.
     */
    static SchemaInput type(TypeReference<?> type) {
        return new TypeModel(TypeFactory.defaultInstance().constructType(type));
    }

    /**
     * Resolve a caller-supplied schema object by probing what it is.
     *
     * <p>
     * JSON objects, {@link Map}s and JSON text are treated as canonical
     * documents. {@link Class}, {@link Type}, {@link TypeReference} and
     * {@link JavaType} values are treated as type models.
     *
     * @param schema the schema in any supported representation
     * @return the resolved input
     * @throws SchemaConversionException if the object matches neither shape
     */
    static SchemaInput of(Object schema) {
        if (schema == null) {
            throw new SchemaConversionException("schema must not be null");
        }
        if (schema instanceof SchemaInput input) {
            return input;
        }
        if (schema instanceof JsonNode node) {
            return documentOf(node, node.getNodeType().name());
        }
        if (schema instanceof Map<?, ?> map) {
            try {
                return documentOf(SchemaNormalizer.MAPPER.valueToTree(map), "Map");
            } catch (IllegalArgumentException e) {
                throw new SchemaConversionException("Map schema is not representable as JSON", e);
            }
        }
        if (schema instanceof String text) {
            try {
                return documentOf(SchemaNormalizer.MAPPER.readTree(text), "String");
            } catch (JsonProcessingException e) {
                throw new SchemaConversionException("String schema is not valid JSON", e);
            }
        }
        if (schema instanceof JavaType javaType) {
            return new TypeModel(javaType);
        }
        if (schema instanceof TypeReference<?> reference) {
            return type(reference);
        }
        if (schema instanceof Type type) {
            return new TypeModel(TypeFactory.defaultInstance().constructType(type));
        }
        throw new SchemaConversionException("Unsupported schema representation: "
                + schema.getClass().getName()
                + ". Pass a JSON Schema object or a Java type (requires "
                + SchemaNormalizer.REQUIRED_MODULE + ").");
    }

    private static SchemaInput documentOf(JsonNode node, String source) {
        if (node instanceof ObjectNode objectNode) {
            return new Document(objectNode);
        }
        throw new SchemaConversionException(
                "JSON Schema must be a JSON object, got " + node.getNodeType() + " from " + source);
    }
}
