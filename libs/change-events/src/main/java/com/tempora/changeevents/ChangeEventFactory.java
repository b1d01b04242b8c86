package com.tempora.changeevents;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Factory methods for creating {@link ChangeEvent} instances.
 *
 * <p>Generates the event ID and derives the {@link ChangeType} from the activity flags of the
 * previous and new versions.
 */
public final class ChangeEventFactory {

    private ChangeEventFactory() {
        // utility class, no instantiation
    }

    /**
     * Creates a change event for a committed version.
     *
     * @param oldVersionSeq previous current version, or null for the first version
     * @param wasActive whether the previous version was active (ignored when there was none)
     * @param isActive whether the new version is active
     */
    public static ChangeEvent create(
            String tenantId,
            String entityType,
            String businessKey,
            String identityKey,
            Long oldVersionSeq,
            boolean wasActive,
            long newVersionSeq,
            boolean isActive,
            JsonNode payload,
            String actor,
            String sourceTag,
            Instant timestamp,
            String correlationId) {
        return new ChangeEvent(
                UUID.randomUUID().toString(),
                ChangeType.classify(oldVersionSeq == null, wasActive, isActive),
                tenantId,
                entityType,
                businessKey,
                identityKey,
                oldVersionSeq,
                newVersionSeq,
                payload,
                actor,
                sourceTag,
                timestamp,
                correlationId);
    }
}
