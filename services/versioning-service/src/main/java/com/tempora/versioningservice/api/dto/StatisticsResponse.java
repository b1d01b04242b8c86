package com.tempora.versioningservice.api.dto;

import com.tempora.versioning.EntityTypeStatistics;
import com.tempora.versioning.StoreStatistics;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Tenant statistics: totals plus one row per entity type.
 *
 * @param windowHours look-back window for {@code recentVersions}
 */
public record StatisticsResponse(
        String tenantId,
        long windowHours,
        Instant generatedAt,
        long totalIdentities,
        long totalVersions,
        long openVersions,
        List<EntityType> entityTypes) {

    public record EntityType(
            String entityType,
            long identityCount,
            Instant lastIdentityCreatedAt,
            long totalVersions,
            long openVersions,
            long recentVersions,
            BigDecimal changeRatePercent) {

        static EntityType from(EntityTypeStatistics row) {
            return new EntityType(
                    row.entityType(),
                    row.identityCount(),
                    row.lastIdentityCreatedAt(),
                    row.totalVersions(),
                    row.openVersions(),
                    row.recentVersions(),
                    row.changeRatePercent());
        }
    }

    public static StatisticsResponse from(StoreStatistics statistics) {
        return new StatisticsResponse(
                statistics.tenantId(),
                statistics.window().toHours(),
                statistics.generatedAt(),
                statistics.totalIdentities(),
                statistics.totalVersions(),
                statistics.openVersions(),
                statistics.entityTypes().stream().map(EntityType::from).toList());
    }
}
