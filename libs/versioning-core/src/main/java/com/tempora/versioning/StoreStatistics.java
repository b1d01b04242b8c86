package com.tempora.versioning;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Statistics for one tenant, one row per entity type.
 *
 * @param tenantId tenant the figures are scoped to
 * @param window look-back window used for {@link EntityTypeStatistics#recentVersions()}
 * @param generatedAt when the figures were computed
 * @param entityTypes per entity type rows, ordered by entity type
 */
public record StoreStatistics(
        String tenantId,
        Duration window,
        Instant generatedAt,
        List<EntityTypeStatistics> entityTypes) {

    public StoreStatistics {
        entityTypes = List.copyOf(entityTypes);
    }

    public long totalIdentities() {
        return entityTypes.stream().mapToLong(EntityTypeStatistics::identityCount).sum();
    }

    public long totalVersions() {
        return entityTypes.stream().mapToLong(EntityTypeStatistics::totalVersions).sum();
    }

    public long openVersions() {
        return entityTypes.stream().mapToLong(EntityTypeStatistics::openVersions).sum();
    }
}
