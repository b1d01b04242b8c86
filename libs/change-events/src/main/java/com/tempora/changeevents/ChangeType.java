package com.tempora.changeevents;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Kind of transition a new version represents.
 *
 * <p>The {@code value} field holds the canonical string used in JSON serialization.
 */
public enum ChangeType {

    /** First version of a freshly registered identity. */
    CREATED("Created"),

    /** Attribute change on an active entity. */
    UPDATED("Updated"),

    /** Version that marks the entity inactive (logical deletion). */
    DEACTIVATED("Deactivated"),

    /** Active version written after an inactive one. */
    REACTIVATED("Reactivated");

    private final String value;

    ChangeType(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g. "Updated"). */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Classifies a transition from the previous version's activity to the new one's.
     *
     * @param firstVersion true when there is no previous version
     * @param wasActive whether the previous version was active (ignored for the first version)
     * @param isActive whether the new version is active
     */
    public static ChangeType classify(boolean firstVersion, boolean wasActive, boolean isActive) {
        if (firstVersion) {
            return isActive ? CREATED : DEACTIVATED;
        }
        if (wasActive && !isActive) {
            return DEACTIVATED;
        }
        if (!wasActive && isActive) {
            return REACTIVATED;
        }
        return UPDATED;
    }

    /**
     * Parses the canonical string form used in JSON.
     *
     * @throws IllegalArgumentException if the value is not a known change type
     */
    @JsonCreator
    public static ChangeType of(String value) {
        return fromString(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown change type: " + value));
    }

    /**
     * Looks up a ChangeType by its canonical string value.
     *
     * @param value the string to match (e.g. "Deactivated")
     * @return the matching ChangeType, or empty if not found
     */
    public static Optional<ChangeType> fromString(String value) {
        for (ChangeType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
