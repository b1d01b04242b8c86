package com.tempora.versioning.payload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.tempora.changeevents.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks a payload against the size limit, the reserved-attribute rules and the schema registered
 * for its entity type. Collects every error rather than stopping at the first.
 */
public final class PayloadValidator {

    private final int maxPayloadBytes;
    private final PayloadSchemaRegistry schemas;

    public PayloadValidator(int maxPayloadBytes, PayloadSchemaRegistry schemas) {
        if (maxPayloadBytes <= 0) {
            throw new IllegalArgumentException("maxPayloadBytes must be positive");
        }
        this.maxPayloadBytes = maxPayloadBytes;
        this.schemas = schemas;
    }

    public ValidationResult validate(String entityType, Payload payload) {
        if (payload == null) {
            return ValidationResult.fail(List.of("payload is required"));
        }
        List<String> errors = new ArrayList<>();

        int size = payload.sizeBytes();
        if (size > maxPayloadBytes) {
            errors.add("payload is %d bytes, limit is %d".formatted(size, maxPayloadBytes));
        }
        payload.get(Payload.ACTIVE_ATTRIBUTE)
                .filter(active -> !active.isBoolean())
                .ifPresent(active -> errors.add(Payload.ACTIVE_ATTRIBUTE + " must be a boolean"));

        schemas.schemaFor(entityType).ifPresent(schema -> checkSchema(schema, payload, errors));

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    public int maxPayloadBytes() {
        return maxPayloadBytes;
    }

    private static void checkSchema(PayloadSchema schema, Payload payload, List<String> errors) {
        for (String required : schema.requiredAttributes()) {
            if (payload.get(required).map(JsonNode::isNull).orElse(true)) {
                errors.add("missing required attribute: " + required);
            }
        }
        for (Map.Entry<String, JsonNodeType> typed : schema.attributeTypes().entrySet()) {
            payload.get(typed.getKey())
                    .filter(value -> !value.isNull() && value.getNodeType() != typed.getValue())
                    .ifPresent(value -> errors.add("attribute %s must be %s but was %s"
                            .formatted(typed.getKey(), typed.getValue(), value.getNodeType())));
        }
        if (schema.closed()) {
            for (String name : payload.attributeNames()) {
                if (!name.equals(Payload.ACTIVE_ATTRIBUTE) && !schema.declares(name)) {
                    errors.add("attribute not allowed for " + schema.entityType() + ": " + name);
                }
            }
        }
    }
}
