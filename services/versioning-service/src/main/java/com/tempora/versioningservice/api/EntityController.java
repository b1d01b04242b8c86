package com.tempora.versioningservice.api;

import com.tempora.tenancy.TenantIsolationEnforcer;
import com.tempora.tenancy.TenantScope;
import com.tempora.versioning.VersionedEntityStore;
import com.tempora.versioning.WriteRequest;
import com.tempora.versioning.error.StoreValidationException;
import com.tempora.versioning.payload.Payload;
import com.tempora.versioning.version.Version;
import com.tempora.versioningservice.api.dto.CloseResponse;
import com.tempora.versioningservice.api.dto.IdentityResponse;
import com.tempora.versioningservice.api.dto.StatisticsResponse;
import com.tempora.versioningservice.api.dto.VersionResponse;
import com.tempora.versioningservice.api.dto.WriteEntityRequest;
import com.tempora.versioningservice.api.dto.WriteEntityResponse;
import com.tempora.versioningservice.config.TemporaProperties;
import jakarta.validation.Valid;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface of the versioned entity store.
 *
 * <p>The tenant comes from the path. When the upstream gateway also sets {@code X-Tenant-ID}, the
 * two must agree. The actor comes from the request body or the {@code X-Actor-ID} header.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}")
public class EntityController {

    public static final String TENANT_HEADER = "X-Tenant-ID";
    public static final String ACTOR_HEADER = "X-Actor-ID";

    static final long MAX_WINDOW_HOURS = VersionedEntityStore.MAX_STATISTICS_WINDOW.toHours();

    private final VersionedEntityStore store;
    private final TemporaProperties properties;

    public EntityController(VersionedEntityStore store, TemporaProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    @PutMapping("/entities/{entityType}/{businessKey}")
    public WriteEntityResponse write(
            @PathVariable String tenantId,
            @PathVariable String entityType,
            @PathVariable String businessKey,
            @RequestHeader(name = TENANT_HEADER, required = false) String tenantHeader,
            @RequestHeader(name = ACTOR_HEADER, required = false) String actorHeader,
            @Valid @RequestBody WriteEntityRequest body) {
        TenantScope tenant = scope(tenantId, tenantHeader);
        String actor = body.actor() != null ? body.actor() : actorHeader;
        String sourceTag = body.sourceTag() != null ? body.sourceTag() : properties.defaultSourceTag();
        WriteRequest request = new WriteRequest(entityType, businessKey, Payload.of(body.payload()), actor, sourceTag);
        return WriteEntityResponse.from(store.write(tenant, request));
    }

    /** Current version, or the version valid at {@code asOf} when given. */
    @GetMapping("/entities/{entityType}/{businessKey}")
    public VersionResponse read(
            @PathVariable String tenantId,
            @PathVariable String entityType,
            @PathVariable String businessKey,
            @RequestParam(required = false) Instant asOf,
            @RequestHeader(name = TENANT_HEADER, required = false) String tenantHeader) {
        TenantScope tenant = scope(tenantId, tenantHeader);
        Optional<Version> version = asOf == null
                ? store.readCurrent(tenant, entityType, businessKey)
                : store.readAsOf(tenant, entityType, businessKey, asOf);
        return version.map(VersionResponse::from)
                .orElseThrow(() -> new EntityNotFoundException(entityType, businessKey));
    }

    @GetMapping("/entities/{entityType}/{businessKey}/history")
    public List<VersionResponse> history(
            @PathVariable String tenantId,
            @PathVariable String entityType,
            @PathVariable String businessKey,
            @RequestHeader(name = TENANT_HEADER, required = false) String tenantHeader) {
        return store.history(scope(tenantId, tenantHeader), entityType, businessKey).stream()
                .map(VersionResponse::from)
                .toList();
    }

    @DeleteMapping("/entities/{entityType}/{businessKey}")
    public CloseResponse close(
            @PathVariable String tenantId,
            @PathVariable String entityType,
            @PathVariable String businessKey,
            @RequestHeader(name = TENANT_HEADER, required = false) String tenantHeader,
            @RequestHeader(name = ACTOR_HEADER, required = false) String actor) {
        return new CloseResponse(store.close(scope(tenantId, tenantHeader), entityType, businessKey, actor));
    }

    @GetMapping("/entities/{entityType}")
    public List<IdentityResponse> identities(
            @PathVariable String tenantId,
            @PathVariable String entityType,
            @RequestHeader(name = TENANT_HEADER, required = false) String tenantHeader) {
        return store.listIdentities(scope(tenantId, tenantHeader), entityType).stream()
                .map(IdentityResponse::from)
                .toList();
    }

    @GetMapping("/statistics")
    public StatisticsResponse statistics(
            @PathVariable String tenantId,
            @RequestParam(defaultValue = "24") long windowHours,
            @RequestHeader(name = TENANT_HEADER, required = false) String tenantHeader) {
        TenantScope tenant = scope(tenantId, tenantHeader);
        if (windowHours < 1 || windowHours > MAX_WINDOW_HOURS) {
            throw StoreValidationException.of("windowHours must be between 1 and " + MAX_WINDOW_HOURS);
        }
        return StatisticsResponse.from(store.statistics(tenant, Duration.ofHours(windowHours)));
    }

    private static TenantScope scope(String pathTenant, String headerTenant) {
        return TenantIsolationEnforcer.resolve(pathTenant, headerTenant);
    }
}
