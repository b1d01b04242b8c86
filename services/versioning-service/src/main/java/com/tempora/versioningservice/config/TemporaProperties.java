package com.tempora.versioningservice.config;

import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.tempora.versioning.VersionStoreSettings;
import com.tempora.versioning.payload.PayloadSchema;
import com.tempora.versioning.payload.PayloadSchemaRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Store configuration bound from {@code tempora.*}.
 *
 * <pre>
 * tempora:
 *   backend: jdbc
 *   service-name: tempora-prod
 *   default-source-tag: api
 *   lock-timeout: 5s
 *   audit:
 *     sink: logging
 *   schemas:
 *     script_execution:
 *       required: [status]
 *       types: {status: STRING, attempt: NUMBER}
 * </pre>
 *
 * <p>Zero or missing values fall back to the {@link VersionStoreSettings} defaults. Connection
 * settings for the JDBC backend live under {@code tempora.datasource.*}.
 *
 * @param backend persistence backend, {@code memory} (default) or {@code jdbc}
 * @param serviceName value of the {@code service} tag on every meter
 * @param defaultSourceTag source tag applied to writes that do not name one
 * @param maxPayloadBytes largest accepted canonical payload
 * @param lockTimeout longest wait for the per-identity write lock
 * @param maxAttempts attempts per write on concurrent modification
 * @param initialBackoff first retry delay
 * @param perIdentityLocking serialize writers of one identity inside this process (default true)
 * @param audit change-event delivery settings
 * @param schemas payload schemas keyed by entity type
 */
@ConfigurationProperties(prefix = "tempora")
@Validated
public record TemporaProperties(
        @Pattern(regexp = "memory|jdbc") String backend,
        String serviceName,
        String defaultSourceTag,
        int maxPayloadBytes,
        Duration lockTimeout,
        int maxAttempts,
        Duration initialBackoff,
        Boolean perIdentityLocking,
        @Valid Audit audit,
        Map<String, Schema> schemas) {

    public static final String DEFAULT_BACKEND = "memory";
    public static final String DEFAULT_SOURCE_TAG = "api";

    public TemporaProperties {
        if (backend == null || backend.isBlank()) {
            backend = DEFAULT_BACKEND;
        }
        if (defaultSourceTag == null || defaultSourceTag.isBlank()) {
            defaultSourceTag = DEFAULT_SOURCE_TAG;
        }
        if (perIdentityLocking == null) {
            perIdentityLocking = Boolean.TRUE;
        }
        if (audit == null) {
            audit = new Audit(null, null, 0, 0);
        }
        schemas = schemas == null ? Map.of() : Map.copyOf(schemas);
    }

    /**
     * Audit delivery settings.
     *
     * @param sink {@code noop} (default) or {@code logging}
     * @param timeout longest time one delivery may take
     * @param threads delivery threads
     * @param queueCapacity events that may wait before new ones are dropped
     */
    public record Audit(
            @Pattern(regexp = "noop|logging") String sink,
            Duration timeout,
            int threads,
            int queueCapacity) {

        public Audit {
            if (sink == null || sink.isBlank()) {
                sink = "noop";
            }
        }
    }

    /**
     * Payload schema for one entity type.
     *
     * @param required attributes every payload must carry
     * @param types JSON type per attribute ({@code STRING}, {@code NUMBER}, {@code BOOLEAN},
     *     {@code OBJECT}, {@code ARRAY})
     * @param closed reject attributes not named in {@code required} or {@code types}
     */
    public record Schema(List<String> required, Map<String, String> types, boolean closed) {

        public Schema {
            required = required == null ? List.of() : List.copyOf(required);
            types = types == null ? Map.of() : Map.copyOf(types);
        }
    }

    public VersionStoreSettings toSettings() {
        return new VersionStoreSettings(
                maxPayloadBytes,
                lockTimeout,
                maxAttempts,
                initialBackoff,
                audit.timeout(),
                audit.threads(),
                audit.queueCapacity(),
                perIdentityLocking,
                serviceName);
    }

    /**
     * Builds the schema registry.
     *
     * @throws IllegalArgumentException if a type name is not a JSON node type
     */
    public PayloadSchemaRegistry toSchemaRegistry() {
        PayloadSchemaRegistry registry = new PayloadSchemaRegistry();
        schemas.forEach((entityType, schema) -> {
            Map<String, JsonNodeType> types = new HashMap<>();
            schema.types().forEach((attribute, type) ->
                    types.put(attribute, JsonNodeType.valueOf(type.toUpperCase(Locale.ROOT))));
            registry.register(new PayloadSchema(entityType, Set.copyOf(schema.required()), types, schema.closed()));
        });
        return registry;
    }
}
