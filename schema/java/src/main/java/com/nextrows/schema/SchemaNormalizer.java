package com.nextrows.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nextrows.NextrowsException.SchemaConversionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns any {@link SchemaInput} into the canonical JSON Schema document the
 * extraction endpoint accepts.
 *
 * <p>
 * Documents pass through untouched. Type models are converted through a
 * {@link SchemaConverter}; unless one is supplied, the Jackson JSON Schema
 * module is located on first use and an error is raised if it is missing.
 *
 * <p>
 * Stateless apart from the lazily resolved converter; safe to share across
 * threads.
 */
public final class SchemaNormalizer {

    /** Dependency needed for {@link SchemaInput.TypeModel} conversion. */
    public static final String REQUIRED_MODULE = "com.fasterxml.jackson.module:jackson-module-jsonSchema 2.12+";

    static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Logger log = LoggerFactory.getLogger(SchemaNormalizer.class);
    private static final String GENERATOR_CLASS = "com.fasterxml.jackson.module.jsonSchema.JsonSchemaGenerator";

    private final SchemaConverter converter;
    private volatile SchemaConverter resolved;

    /**
     * Create a normalizer that uses Jackson's JSON Schema module when present.
     */
    public SchemaNormalizer() {
        this.converter = null;
    }

    /**
     * Create a normalizer with a caller-provided converter for type models.
     */
    public SchemaNormalizer(SchemaConverter converter) {
        if (converter == null) {
            throw new IllegalArgumentException("converter must not be null");
        }
        this.converter = converter;
    }

    /**
     * Normalize a schema for transmission.
     *
     * @param schema the caller's schema
     * @return the canonical document; the same instance for
     *         {@link SchemaInput.Document} inputs
     * @throws SchemaConversionException if a type model cannot be converted
     */
    public ObjectNode normalize(SchemaInput schema) {
        if (schema == null) {
            throw new SchemaConversionException("schema must not be null");
        }
        if (schema instanceof SchemaInput.Document document) {
            return document.document();
        }
        SchemaInput.TypeModel model = (SchemaInput.TypeModel) schema;
        log.debug("Deriving JSON Schema for {}", model.type().toCanonical());
        ObjectNode converted = converter().convert(model.type());
        if (converted == null) {
            throw new SchemaConversionException("Converter returned no schema for " + model.type().toCanonical());
        }
        return converted;
    }

    /**
     * Normalize any supported schema representation; see
     * {@link SchemaInput#of(Object)}.
     */
    public ObjectNode normalize(Object schema) {
        return normalize(SchemaInput.of(schema));
    }

    /**
     * @return true if type models can be converted with the current classpath
     *         or converter
     */
    public boolean supportsTypeModels() {
        return converter != null || jacksonModulePresent();
    }

    private SchemaConverter converter() {
        if (converter != null) {
            return converter;
        }
        SchemaConverter current = resolved;
        if (current == null) {
            if (!jacksonModulePresent()) {
                throw new SchemaConversionException(
                        "Converting a Java type to JSON Schema requires " + REQUIRED_MODULE
                                + " on the classpath, or pass a JSON Schema document instead.");
            }
            current = new JacksonSchemaConverter(MAPPER);
            resolved = current;
        }
        return current;
    }

    private static boolean jacksonModulePresent() {
        try {
            Class.forName(GENERATOR_CLASS, false, SchemaNormalizer.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }
}
