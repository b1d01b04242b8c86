package com.tempora.versioning.payload;

import com.fasterxml.jackson.databind.node.JsonNodeType;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Shape constraints for the payloads of one entity type.
 *
 * @param entityType entity type the schema applies to
 * @param requiredAttributes attributes every payload must carry
 * @param attributeTypes expected JSON type per attribute, checked when the attribute is present
 * @param closed when true, attributes not named in either of the above are rejected
 */
public record PayloadSchema(
        String entityType,
        Set<String> requiredAttributes,
        Map<String, JsonNodeType> attributeTypes,
        boolean closed) {

    public PayloadSchema {
        if (entityType == null || entityType.isBlank()) {
            throw new IllegalArgumentException("entityType must not be blank");
        }
        requiredAttributes = requiredAttributes == null ? Set.of() : Set.copyOf(requiredAttributes);
        attributeTypes = attributeTypes == null ? Map.of() : Map.copyOf(attributeTypes);
    }

    /** An open schema that only requires the given attributes. */
    public static PayloadSchema requiring(String entityType, String... attributes) {
        return new PayloadSchema(entityType, Set.of(attributes), Map.of(), false);
    }

    /** Returns a copy that also checks the JSON type of {@code attribute}. */
    public PayloadSchema withType(String attribute, JsonNodeType type) {
        Map<String, JsonNodeType> types = new HashMap<>(attributeTypes);
        types.put(attribute, type);
        return new PayloadSchema(entityType, requiredAttributes, types, closed);
    }

    /** Returns a closed copy of this schema. */
    public PayloadSchema closedSchema() {
        return new PayloadSchema(entityType, requiredAttributes, attributeTypes, true);
    }

    boolean declares(String attribute) {
        return requiredAttributes.contains(attribute) || attributeTypes.containsKey(attribute);
    }
}
