package com.tempora.versioning.identity;

import java.time.Instant;

/**
 * Hub row: the immutable record that an entity exists. Created once, on the first write for its
 * business key, and never mutated or deleted.
 *
 * @param identityKey key derived from the other three identifying fields
 * @param entityType entity type, e.g. {@code script_execution}
 * @param tenantId owning tenant
 * @param businessKey caller-meaningful identifier
 * @param createdAt when the identity was registered
 * @param sourceTag source system of the first write
 */
public record Identity(
        IdentityKey identityKey,
        String entityType,
        String tenantId,
        String businessKey,
        Instant createdAt,
        String sourceTag) {
}
