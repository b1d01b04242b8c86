package com.tempora.observability;

/**
 * Immutable context describing the store operation in progress on the current thread.
 *
 * <p>Set by the versioning engine at the start of every public operation and mirrored into the
 * SLF4J MDC so that every log line emitted during the operation carries it. The values are copied
 * from explicit call parameters; nothing here is a source of truth for tenant or actor.
 *
 * @param correlationId unique ID for the business flow (propagated from the caller, or generated)
 * @param tenantId tenant the operation is scoped to
 * @param actor caller performing the operation (nullable for reads)
 * @param entityType entity type addressed by the operation (nullable for tenant-wide reads)
 * @param businessKey business key addressed by the operation (nullable for tenant-wide reads)
 */
public record WriteContext(
        String correlationId,
        String tenantId,
        String actor,
        String entityType,
        String businessKey) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for actor. */
    public static final String MDC_ACTOR = "actor";

    /** MDC key for entity type. */
    public static final String MDC_ENTITY_TYPE = "entityType";

    /** MDC key for business key. */
    public static final String MDC_BUSINESS_KEY = "businessKey";

    /** Compact constructor: ensures correlationId is never blank. */
    public WriteContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Returns a copy addressed to another entity, keeping correlation, tenant and actor. */
    public WriteContext forEntity(String entityType, String businessKey) {
        return new WriteContext(correlationId, tenantId, actor, entityType, businessKey);
    }
}
