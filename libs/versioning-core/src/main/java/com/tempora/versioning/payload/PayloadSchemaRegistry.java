package com.tempora.versioning.payload;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Payload schemas keyed by entity type. Entity types without a registered schema accept any JSON
 * object.
 */
public final class PayloadSchemaRegistry {

    private final ConcurrentMap<String, PayloadSchema> schemas = new ConcurrentHashMap<>();

    /** Registers or replaces the schema for its entity type. */
    public PayloadSchemaRegistry register(PayloadSchema schema) {
        schemas.put(schema.entityType(), schema);
        return this;
    }

    public Optional<PayloadSchema> schemaFor(String entityType) {
        return Optional.ofNullable(schemas.get(entityType));
    }

    public Set<String> entityTypes() {
        return Set.copyOf(schemas.keySet());
    }
}
