package com.tempora.versioning.version;

/**
 * Outcome of {@link SatelliteStore#append}.
 *
 * @param outcome whether a new version was written
 * @param version the new version, or the unchanged current version for a no-op
 * @param previous the version that was current before the append; null for the first version and
 *     for no-ops
 */
public record AppendResult(Outcome outcome, Version version, Version previous) {

    public enum Outcome {
        NO_OP,
        VERSIONED
    }

    public static AppendResult noOp(Version current) {
        return new AppendResult(Outcome.NO_OP, current, null);
    }

    public static AppendResult versioned(Version created, Version previous) {
        return new AppendResult(Outcome.VERSIONED, created, previous);
    }

    public boolean changed() {
        return outcome == Outcome.VERSIONED;
    }
}
