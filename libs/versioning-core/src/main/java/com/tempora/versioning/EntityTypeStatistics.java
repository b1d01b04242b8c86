package com.tempora.versioning;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Hub and satellite counts for one entity type of one tenant.
 *
 * @param entityType the entity type
 * @param identityCount registered identities
 * @param lastIdentityCreatedAt creation time of the newest identity
 * @param totalVersions versions ever written
 * @param openVersions versions with no effective end, i.e. one per written identity
 * @param recentVersions versions whose effective start falls inside the statistics window
 */
public record EntityTypeStatistics(
        String entityType,
        long identityCount,
        Instant lastIdentityCreatedAt,
        long totalVersions,
        long openVersions,
        long recentVersions) {

    /** Share of all versions written inside the window, in percent with two decimals. */
    public BigDecimal changeRatePercent() {
        if (totalVersions == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(recentVersions * 100L)
                .divide(BigDecimal.valueOf(totalVersions), 2, RoundingMode.HALF_UP);
    }
}
