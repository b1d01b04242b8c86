package com.tempora.versioningservice.infrastructure.health;

import com.tempora.versioning.VersionedEntityStore;
import com.tempora.versioning.spi.BackendHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the persistence backend's reachability and whether audit delivery is live or stubbed,
 * under {@code /actuator/health} as {@code versionStore}.
 */
@Component("versionStore")
public class VersionStoreHealthIndicator implements HealthIndicator {

    private final VersionedEntityStore store;

    public VersionStoreHealthIndicator(VersionedEntityStore store) {
        this.store = store;
    }

    @Override
    public Health health() {
        BackendHealth backend = store.health();
        Health.Builder builder = backend.available() ? Health.up() : Health.down();
        return builder
                .withDetail("backend", backend.backend())
                .withDetail("message", backend.message())
                .withDetail("latencyMs", backend.latency().toMillis())
                .withDetail("auditMode", store.auditMode().name())
                .build();
    }
}
