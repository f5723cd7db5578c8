package com.nextrows.schema;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * SPI for deriving a JSON Schema document from a Java type.
 *
 * <p>
 * The default implementation relies on Jackson's JSON Schema module. Callers
 * who generate schemas with another library can supply their own converter to
 * {@link SchemaNormalizer#SchemaNormalizer(SchemaConverter)}.
 */
@FunctionalInterface
public interface SchemaConverter {

    /**
     * Convert a Java type into a canonical JSON Schema document.
     *
     * @param type the type to introspect
     * @return the schema root object
     * @throws com.nextrows.NextrowsException.SchemaConversionException if the type
     *         cannot be described
     */
    ObjectNode convert(JavaType type);
}
