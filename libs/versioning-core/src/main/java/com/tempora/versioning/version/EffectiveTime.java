package com.tempora.versioning.version;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Timestamps used for effective-start and effective-end markers.
 *
 * <p>Truncated to microseconds so a value survives a round trip through a {@code timestamptz}
 * column unchanged. Timestamps only order versions for as-of reads; uniqueness comes from the
 * version sequence.
 */
public final class EffectiveTime {

    private EffectiveTime() {
    }

    public static Instant now(Clock clock) {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * Start time for a version that supersedes {@code current}: now, or the current version's start
     * if the clock has stepped backwards past it.
     */
    public static Instant startAfter(Clock clock, Version current) {
        Instant now = now(clock);
        if (current != null && now.isBefore(current.effectiveStart())) {
            return current.effectiveStart();
        }
        return now;
    }
}
