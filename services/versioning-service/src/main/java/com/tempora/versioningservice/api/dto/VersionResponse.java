package com.tempora.versioningservice.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.tempora.versioning.version.Version;
import java.time.Instant;

/**
 * One version of an entity as returned by the read endpoints.
 *
 * @param effectiveEnd null for the current version
 * @param active false once the entity has been closed
 */
public record VersionResponse(
        String identityKey,
        long versionSeq,
        Instant effectiveStart,
        Instant effectiveEnd,
        String payloadDigest,
        JsonNode payload,
        String actor,
        String sourceTag,
        boolean current,
        boolean active) {

    public static VersionResponse from(Version version) {
        return new VersionResponse(
                version.identityKey().hex(),
                version.versionSeq(),
                version.effectiveStart(),
                version.effectiveEnd(),
                version.payloadDigest().hex(),
                version.payload().json(),
                version.actor(),
                version.sourceTag(),
                version.isCurrent(),
                version.isActive());
    }
}
