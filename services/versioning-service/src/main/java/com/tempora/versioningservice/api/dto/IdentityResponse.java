package com.tempora.versioningservice.api.dto;

import com.tempora.versioning.identity.Identity;
import java.time.Instant;

public record IdentityResponse(
        String identityKey, String entityType, String businessKey, Instant createdAt, String sourceTag) {

    public static IdentityResponse from(Identity identity) {
        return new IdentityResponse(
                identity.identityKey().hex(),
                identity.entityType(),
                identity.businessKey(),
                identity.createdAt(),
                identity.sourceTag());
    }
}
