package com.tempora.versioningservice.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code PUT /api/v1/tenants/{tenantId}/entities/{entityType}/{businessKey}}.
 *
 * @param payload attributes of the entity, a JSON object
 * @param actor who is writing; falls back to the {@code X-Actor-ID} header
 * @param sourceTag originating system; falls back to {@code tempora.default-source-tag}
 */
public record WriteEntityRequest(@NotNull JsonNode payload, String actor, String sourceTag) {}
