package com.tempora.versioningservice.config;

import com.tempora.observability.OperationTracer;
import com.tempora.persistence.jdbc.config.JdbcStoreConfiguration;
import com.tempora.versioning.VersionedEntityStore;
import com.tempora.versioning.audit.AuditSink;
import com.tempora.versioning.audit.LoggingAuditSink;
import com.tempora.versioning.audit.NoOpAuditSink;
import com.tempora.versioning.memory.InMemoryPersistenceBackend;
import com.tempora.versioning.spi.PersistenceBackend;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Assembles the {@link VersionedEntityStore} from {@link TemporaProperties}.
 *
 * <p>The backend is chosen by {@code tempora.backend}: the in-memory backend by default, or the
 * JDBC backend contributed by {@link JdbcStoreConfiguration}. The audit sink is chosen by
 * {@code tempora.audit.sink}.
 */
@Configuration(proxyBeanMethods = false)
@Import(JdbcStoreConfiguration.class)
public class StoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StoreConfiguration.class);

    @Bean
    @ConditionalOnProperty(prefix = "tempora", name = "backend", havingValue = "memory", matchIfMissing = true)
    public InMemoryPersistenceBackend inMemoryPersistenceBackend() {
        log.warn("Using the in-memory backend: versions are lost when the service stops");
        return new InMemoryPersistenceBackend();
    }

    @Bean
    @ConditionalOnProperty(prefix = "tempora.audit", name = "sink", havingValue = "logging")
    public AuditSink loggingAuditSink() {
        return new LoggingAuditSink();
    }

    @Bean
    @ConditionalOnProperty(prefix = "tempora.audit", name = "sink", havingValue = "noop", matchIfMissing = true)
    public AuditSink noOpAuditSink() {
        return new NoOpAuditSink();
    }

    @Bean(destroyMethod = "shutdown")
    public VersionedEntityStore versionedEntityStore(
            PersistenceBackend backend,
            AuditSink auditSink,
            TemporaProperties properties,
            MeterRegistry meterRegistry,
            ObjectProvider<OpenTelemetry> openTelemetry) {
        return VersionedEntityStore.builder(backend)
                .settings(properties.toSettings())
                .schemas(properties.toSchemaRegistry())
                .auditSink(auditSink)
                .meterRegistry(meterRegistry)
                .tracer(OperationTracer.from(openTelemetry.getIfAvailable(GlobalOpenTelemetry::get)))
                .build();
    }
}
