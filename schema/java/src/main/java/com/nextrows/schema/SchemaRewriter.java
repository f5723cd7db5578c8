package com.nextrows.schema;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nextrows.NextrowsException.SchemaConversionException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites the draft-03 output of {@code jackson-module-jsonSchema} into
 * current JSON Schema.
 *
 * <p>
 * Class-name {@code id} URNs are removed. References between types resolve
 * locally through {@code #/$defs/<SimpleName>} (or {@code #} for the root
 * type). Each object schema lists its mandatory properties in a
 * {@code required} array: record components, primitives and properties
 * marked {@code @JsonProperty(required = true)}.
 */
final class SchemaRewriter {

    static final String DEFS = "$defs";

    private static final String URN_PREFIX = "urn:jsonschema:";
    private static final String ID = "id";
    private static final String REF = "$ref";

    private final ObjectMapper mapper;

    SchemaRewriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    ObjectNode rewrite(ObjectNode root, JavaType type) {
        markRequired(root, type);

        Map<String, Slot> definitions = new LinkedHashMap<>();
        Set<String> referenced = new LinkedHashSet<>();
        collect(new Slot(null, null, -1, root), definitions, referenced);

        Map<String, String> targets = new HashMap<>();
        Set<String> names = new HashSet<>();
        ObjectNode defs = mapper.createObjectNode();
        for (String urn : referenced) {
            Slot slot = definitions.get(urn);
            if (slot == null) {
                throw new SchemaConversionException("Generated schema for " + type.toCanonical()
                        + " references an undefined type " + urn);
            }
            if (slot.node() == root) {
                targets.put(urn, "#");
                continue;
            }
            String name = uniqueName(urn, names);
            slot.replaceWith(mapper.createObjectNode().put(REF, urn));
            defs.set(name, slot.node());
            targets.put(urn, "#/" + DEFS + "/" + name);
        }
        if (!defs.isEmpty()) {
            root.set(DEFS, defs);
        }
        resolve(root, targets);
        return root;
    }

    private void markRequired(JsonNode schema, JavaType type) {
        if (!(schema instanceof ObjectNode node) || type == null) {
            return;
        }
        if (type.isArrayType() || type.isCollectionLikeType()) {
            markRequired(node.get("items"), type.getContentType());
            return;
        }
        if (type.isMapLikeType()) {
            markRequired(node.get("additionalProperties"), type.getContentType());
            return;
        }
        JsonNode properties = node.get("properties");
        if (!(properties instanceof ObjectNode)) {
            return;
        }
        BeanDescription bean = mapper.getSerializationConfig().introspect(type);
        boolean record = type.getRawClass().isRecord();
        ArrayNode required = mapper.createArrayNode();
        for (BeanPropertyDefinition property : bean.findProperties()) {
            JsonNode child = properties.get(property.getName());
            if (child == null) {
                continue;
            }
            // draft-03 puts a boolean "required" on the property itself
            if (child instanceof ObjectNode childNode && childNode.path("required").isBoolean()) {
                childNode.remove("required");
            }
            JavaType propertyType = property.getPrimaryType();
            if (record || property.isRequired() || (propertyType != null && propertyType.isPrimitive())) {
                required.add(property.getName());
            }
            markRequired(child, propertyType);
        }
        if (!required.isEmpty()) {
            node.set("required", required);
        }
    }

    private static void collect(Slot slot, Map<String, Slot> definitions, Set<String> referenced) {
        ObjectNode node = slot.node();
        String id = urn(node.get(ID));
        if (id != null) {
            definitions.putIfAbsent(id, slot);
        }
        String ref = urn(node.get(REF));
        if (ref != null) {
            referenced.add(ref);
        }
        List<Map.Entry<String, JsonNode>> fields = new ArrayList<>();
        node.fields().forEachRemaining(fields::add);
        for (Map.Entry<String, JsonNode> field : fields) {
            JsonNode value = field.getValue();
            if (value instanceof ObjectNode child) {
                collect(new Slot(node, field.getKey(), -1, child), definitions, referenced);
            } else if (value instanceof ArrayNode array) {
                for (int i = 0; i < array.size(); i++) {
                    if (array.get(i) instanceof ObjectNode child) {
                        collect(new Slot(array, null, i, child), definitions, referenced);
                    }
                }
            }
        }
    }

    private static void resolve(JsonNode node, Map<String, String> targets) {
        if (node instanceof ObjectNode object) {
            if (urn(object.get(ID)) != null) {
                object.remove(ID);
            }
            if (object.path("required").isBoolean()) {
                object.remove("required");
            }
            String ref = urn(object.get(REF));
            if (ref != null) {
                object.put(REF, targets.get(ref));
                object.remove("type");
            }
        }
        for (JsonNode child : node) {
            resolve(child, targets);
        }
    }

    private static String urn(JsonNode value) {
        if (value != null && value.isTextual() && value.asText().startsWith(URN_PREFIX)) {
            return value.asText();
        }
        return null;
    }

    private static String uniqueName(String urn, Set<String> taken) {
        String simple = urn.substring(urn.lastIndexOf(':') + 1);
        if (simple.isEmpty()) {
            simple = "Type";
        }
        String name = simple;
        for (int n = 2; !taken.add(name); n++) {
            name = simple + n;
        }
        return name;
    }

    /** Where a schema node sits in its parent, so it can be swapped out. */
    private record Slot(JsonNode parent, String field, int index, ObjectNode node) {

        void replaceWith(JsonNode replacement) {
            if (parent instanceof ObjectNode object) {
                object.set(field, replacement);
            } else if (parent instanceof ArrayNode array) {
                array.set(index, replacement);
            }
        }
    }
}
