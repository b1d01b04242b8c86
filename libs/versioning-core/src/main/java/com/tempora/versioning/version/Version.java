package com.tempora.versioning.version;

import com.tempora.versioning.identity.IdentityKey;
import com.tempora.versioning.payload.Payload;
import com.tempora.versioning.payload.PayloadDigest;

import java.time.Instant;

/**
 * Satellite row: one immutable snapshot of an entity's attributes, valid over
 * {@code [effectiveStart, effectiveEnd)}. The current version has a null {@code effectiveEnd}.
 */
public record Version(
        IdentityKey identityKey,
        long versionSeq,
        Instant effectiveStart,
        Instant effectiveEnd,
        PayloadDigest payloadDigest,
        Payload payload,
        String actor,
        String sourceTag) {

    public boolean isCurrent() {
        return effectiveEnd == null;
    }

    /** False once the entity has been logically closed. */
    public boolean isActive() {
        return payload.isActive();
    }

    /** Whether {@code instant} falls inside this version's validity interval. */
    public boolean covers(Instant instant) {
        return !instant.isBefore(effectiveStart) && (effectiveEnd == null || instant.isBefore(effectiveEnd));
    }

    /** Returns this version with its validity ended at {@code end}. */
    public Version closedAt(Instant end) {
        return new Version(identityKey, versionSeq, effectiveStart, end, payloadDigest, payload, actor, sourceTag);
    }
}
