package com.tempora.changeevents;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Change event emitted after a write produced a new version of an entity.
 *
 * <p>Ephemeral: the versioning store does not persist these. They are handed to the audit bridge
 * once the new version is committed and are never produced for a no-op write.
 */
public record ChangeEvent(
        /** Unique identifier for this event instance (UUID v4). */
        String eventId,

        /** What kind of transition the new version represents. */
        ChangeType changeType,

        /** Tenant that owns the entity. */
        String tenantId,

        /** Entity type of the hub row (e.g. "script_execution"). */
        String entityType,

        /** Caller-meaningful identifier of the entity. */
        String businessKey,

        /** Hex-encoded identity key derived from (entityType, tenantId, businessKey). */
        String identityKey,

        /** Version that was current before the write, or null for the first version. */
        Long oldVersionSeq,

        /** Version created by the write. */
        long newVersionSeq,

        /** Attribute payload of the new version. */
        JsonNode payload,

        /** Actor that performed the write, as supplied by the caller. */
        String actor,

        /** Source system tag of the write. */
        String sourceTag,

        /** Effective start of the new version. */
        Instant timestamp,

        /** Correlation ID of the request that performed the write (nullable). */
        String correlationId) {

    /** Returns true when this event records the first version of the entity. */
    @JsonIgnore
    public boolean isFirstVersion() {
        return oldVersionSeq == null;
    }
}
