package com.tempora.versioning;

import com.tempora.versioning.payload.Payload;

/**
 * A write addressed to one entity. The tenant is passed separately as a
 * {@link com.tempora.tenancy.TenantScope}.
 *
 * @param entityType entity type, e.g. {@code script_execution}
 * @param businessKey caller-meaningful identifier
 * @param payload new attribute payload
 * @param actor who is writing; supplied by the caller's authentication layer
 * @param sourceTag source system of the write
 */
public record WriteRequest(
        String entityType,
        String businessKey,
        Payload payload,
        String actor,
        String sourceTag) {
}
