package com.tempora.versioning;

import com.tempora.changeevents.ChangeEvent;
import com.tempora.changeevents.ChangeEventFactory;
import com.tempora.changeevents.ValidationResult;
import com.tempora.observability.MetricFactory;
import com.tempora.observability.OperationTracer;
import com.tempora.observability.WriteContext;
import com.tempora.observability.WriteContextHolder;
import com.tempora.tenancy.TenantIsolationEnforcer;
import com.tempora.tenancy.TenantScope;
import com.tempora.versioning.audit.AuditBridge;
import com.tempora.versioning.audit.AuditSink;
import com.tempora.versioning.audit.NoOpAuditSink;
import com.tempora.versioning.audit.SinkMode;
import com.tempora.versioning.concurrency.ConcurrencyController;
import com.tempora.versioning.concurrency.OptimisticRetryController;
import com.tempora.versioning.concurrency.PerIdentityLockController;
import com.tempora.versioning.concurrency.RetryPolicy;
import com.tempora.versioning.error.StoreValidationException;
import com.tempora.versioning.identity.HashKeyDeriver;
import com.tempora.versioning.identity.HubRegistry;
import com.tempora.versioning.identity.Identity;
import com.tempora.versioning.identity.IdentityKey;
import com.tempora.versioning.metrics.VersioningMetrics;
import com.tempora.versioning.payload.ChangeDetector;
import com.tempora.versioning.payload.Payload;
import com.tempora.versioning.payload.PayloadSchemaRegistry;
import com.tempora.versioning.payload.PayloadValidator;
import com.tempora.versioning.spi.BackendHealth;
import com.tempora.versioning.spi.PersistenceBackend;
import com.tempora.versioning.version.AppendResult;
import com.tempora.versioning.version.BackendVersionSequencer;
import com.tempora.versioning.version.EffectiveTime;
import com.tempora.versioning.version.SatelliteStore;
import com.tempora.versioning.version.Version;
import com.tempora.versioning.version.VersionSequencer;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the versioning engine.
 *
 * <p>A write derives the identity key, then inside one unit of the {@link ConcurrencyController}
 * registers the identity if absent and appends a version unless the payload digest matches the
 * current version. Only after that unit commits is a change event handed to the
 * {@link AuditBridge}. Every operation takes the tenant explicitly and never touches another
 * tenant's rows.
 *
 * <p>Thread-safe. Build one per backend with {@link #builder(PersistenceBackend)} and call
 * {@link #shutdown()} when done.
 */
public final class VersionedEntityStore {

    private static final Logger log = LoggerFactory.getLogger(VersionedEntityStore.class);

    /** Longest look-back accepted by {@link #statistics}. */
    public static final Duration MAX_STATISTICS_WINDOW = Duration.ofDays(36_500);

    /** Maximum actor length, matching the version table column. */
    public static final int MAX_ACTOR_LENGTH = 100;

    /** Maximum source tag length, matching the identity and version table columns. */
    public static final int MAX_SOURCE_TAG_LENGTH = 100;

    private final PersistenceBackend backend;
    private final HashKeyDeriver deriver;
    private final PayloadValidator payloadValidator;
    private final ConcurrencyController controller;
    private final HubRegistry hubs;
    private final SatelliteStore satellites;
    private final AuditBridge audit;
    private final VersioningMetrics metrics;
    private final OperationTracer tracer;
    private final Clock clock;

    private VersionedEntityStore(Builder builder, VersioningMetrics metrics, ConcurrencyController controller) {
        this.backend = builder.backend;
        this.deriver = new HashKeyDeriver();
        this.payloadValidator = new PayloadValidator(builder.settings.maxPayloadBytes(), builder.schemas);
        this.controller = controller;
        this.hubs = new HubRegistry(backend, controller, deriver, builder.clock);
        this.satellites = new SatelliteStore(backend, controller, builder.sequencer, new ChangeDetector(), builder.clock);
        this.audit = AuditBridge.create(builder.auditSink, builder.settings.auditTimeout(),
                builder.settings.auditThreads(), builder.settings.auditQueueCapacity(), metrics);
        this.metrics = metrics;
        this.tracer = builder.tracer;
        this.clock = builder.clock;
    }

    public static Builder builder(PersistenceBackend backend) {
        return new Builder(backend);
    }

    /**
     * Writes a new version unless the payload equals the current one.
     *
     * @throws StoreValidationException if the request is invalid; nothing is written
     * @throws com.tempora.versioning.error.ConcurrencyConflictException if the write lost every retry
     * @throws com.tempora.versioning.error.PersistenceUnavailableException if the backend failed
     */
    public WriteResult write(TenantScope tenant, WriteRequest request) {
        validate(tenant, request);
        IdentityKey key = deriver.derive(request.entityType(), tenant.tenantId(), request.businessKey());
        WriteContext context = context(tenant, request.actor(), request.entityType(), request.businessKey());

        return WriteContextHolder.callWithContext(context, () -> tracer.trace("tempora.write",
                spanAttributes(tenant, request.entityType()), () -> {
                    long started = System.nanoTime();
                    Committed committed = controller.execute(key, tx -> {
                        Identity identity = hubs.ensureWithin(tx, tenant, key, request.entityType(),
                                request.businessKey(), request.sourceTag()).identity();
                        AppendResult appended = satellites.appendWithin(tx, key, request.payload(),
                                request.actor(), request.sourceTag());
                        return new Committed(identity, appended);
                    });
                    metrics.recordWrite(tenant.tenantId(), committed.appended().changed(), System.nanoTime() - started);
                    metrics.recordPayloadSize(request.payload().sizeBytes());
                    publish(committed, context.correlationId());

                    Version version = committed.appended().version();
                    log.debug("Write to {}/{} {} version {}", request.entityType(), request.businessKey(),
                            committed.appended().changed() ? "created" : "kept", version.versionSeq());
                    return new WriteResult(key, version.versionSeq(), committed.appended().changed());
                }));
    }

    /** The current version, or empty if the entity has never been written. */
    public Optional<Version> readCurrent(TenantScope tenant, String entityType, String businessKey) {
        IdentityKey key = deriver.derive(entityType, tenant.tenantId(), businessKey);
        return WriteContextHolder.callWithContext(context(tenant, null, entityType, businessKey),
                () -> tracer.trace("tempora.read_current", spanAttributes(tenant, entityType),
                        () -> satellites.current(tenant, key)));
    }

    /** The version that was valid at {@code timestamp}, or empty if none was. */
    public Optional<Version> readAsOf(TenantScope tenant, String entityType, String businessKey, Instant timestamp) {
        if (timestamp == null) {
            throw StoreValidationException.of("timestamp is required");
        }
        IdentityKey key = deriver.derive(entityType, tenant.tenantId(), businessKey);
        return WriteContextHolder.callWithContext(context(tenant, null, entityType, businessKey),
                () -> tracer.trace("tempora.read_as_of", spanAttributes(tenant, entityType),
                        () -> satellites.asOf(tenant, key, timestamp)));
    }

    /** Every version of the entity, oldest first. */
    public List<Version> history(TenantScope tenant, String entityType, String businessKey) {
        IdentityKey key = deriver.derive(entityType, tenant.tenantId(), businessKey);
        return WriteContextHolder.callWithContext(context(tenant, null, entityType, businessKey),
                () -> tracer.trace("tempora.history", spanAttributes(tenant, entityType),
                        () -> satellites.history(tenant, key)));
    }

    /**
     * Logically deactivates an entity by writing a copy of its current payload with
     * {@code _active=false}.
     *
     * @return true if a deactivating version was written; false if the entity was never written or
     *     is already inactive
     */
    public boolean close(TenantScope tenant, String entityType, String businessKey, String actor) {
        List<String> errors = new ArrayList<>(deriver.validate(entityType, tenant.tenantId(), businessKey).errors());
        checkAttribution(errors, "actor", actor, MAX_ACTOR_LENGTH);
        if (!errors.isEmpty()) {
            throw new StoreValidationException(ValidationResult.fail(errors));
        }
        IdentityKey key = deriver.derive(entityType, tenant.tenantId(), businessKey);
        WriteContext context = context(tenant, actor, entityType, businessKey);

        return WriteContextHolder.callWithContext(context, () -> tracer.trace("tempora.close",
                spanAttributes(tenant, entityType), () -> {
                    Optional<Committed> committed = controller.execute(key, tx -> {
                        Optional<Identity> identity = tx.findIdentity(key);
                        if (identity.isEmpty()) {
                            return Optional.<Committed>empty();
                        }
                        TenantIsolationEnforcer.enforce(tenant, identity.get().tenantId());
                        Optional<Version> current = tx.currentVersion(key);
                        if (current.isEmpty() || !current.get().isActive()) {
                            return Optional.<Committed>empty();
                        }
                        AppendResult appended = satellites.appendWithin(tx, key,
                                current.get().payload().withActive(false), actor, current.get().sourceTag());
                        return Optional.of(new Committed(identity.get(), appended));
                    });
                    committed.ifPresent(closed -> {
                        publish(closed, context.correlationId());
                        log.info("Closed {}/{} at version {}", entityType, businessKey,
                                closed.appended().version().versionSeq());
                    });
                    return committed.isPresent();
                }));
    }

    /** The tenant's identities of one entity type, or of every type when {@code entityType} is null. */
    public List<Identity> listIdentities(TenantScope tenant, String entityType) {
        return hubs.list(tenant, entityType);
    }

    /** Per entity type counts; versions started within {@code window} count as recent. */
    public StoreStatistics statistics(TenantScope tenant, Duration window) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw StoreValidationException.of("statistics window must be positive");
        }
        if (window.compareTo(MAX_STATISTICS_WINDOW) > 0) {
            throw StoreValidationException.of(
                    "statistics window must not exceed " + MAX_STATISTICS_WINDOW.toDays() + " days");
        }
        Instant now = EffectiveTime.now(clock);
        List<EntityTypeStatistics> rows = backend.read(tx -> tx.statistics(tenant.tenantId(), now.minus(window)));
        return new StoreStatistics(tenant.tenantId(), window, now, rows);
    }

    public BackendHealth health() {
        return backend.probe();
    }

    /** Whether change events reach a real audit destination. */
    public SinkMode auditMode() {
        return audit.mode();
    }

    public HubRegistry hubRegistry() {
        return hubs;
    }

    public SatelliteStore satelliteStore() {
        return satellites;
    }

    /** Stops the audit bridge after delivering queued events. */
    public void shutdown() {
        audit.shutdown();
    }

    private void validate(TenantScope tenant, WriteRequest request) {
        if (request == null) {
            throw StoreValidationException.of("write request is required");
        }
        List<String> errors = new ArrayList<>(
                deriver.validate(request.entityType(), tenant.tenantId(), request.businessKey()).errors());
        checkAttribution(errors, "actor", request.actor(), MAX_ACTOR_LENGTH);
        checkAttribution(errors, "sourceTag", request.sourceTag(), MAX_SOURCE_TAG_LENGTH);
        errors.addAll(payloadValidator.validate(request.entityType(), request.payload()).errors());
        if (!errors.isEmpty()) {
            log.debug("Rejected write to {}/{}: {}", request.entityType(), request.businessKey(), errors);
            throw new StoreValidationException(ValidationResult.fail(errors));
        }
    }

    private static void checkAttribution(List<String> errors, String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            errors.add(field + " must not be blank");
        } else if (value.length() > maxLength) {
            errors.add(field + " must be at most " + maxLength + " characters");
        }
    }

    private void publish(Committed committed, String correlationId) {
        AppendResult appended = committed.appended();
        if (!appended.changed()) {
            return;
        }
        Identity identity = committed.identity();
        Version version = appended.version();
        Version previous = appended.previous();
        ChangeEvent event = ChangeEventFactory.create(
                identity.tenantId(),
                identity.entityType(),
                identity.businessKey(),
                identity.identityKey().hex(),
                previous == null ? null : previous.versionSeq(),
                previous == null || previous.isActive(),
                version.versionSeq(),
                version.isActive(),
                version.payload().json(),
                version.actor(),
                version.sourceTag(),
                version.effectiveStart(),
                correlationId);
        audit.notifyChange(event);
    }

    private static WriteContext context(TenantScope tenant, String actor, String entityType, String businessKey) {
        return new WriteContext(WriteContextHolder.currentOrNewCorrelationId(), tenant.tenantId(), actor,
                entityType, businessKey);
    }

    private static Map<String, String> spanAttributes(TenantScope tenant, String entityType) {
        return Map.of("tenant.id", tenant.tenantId(), "entity.type", entityType);
    }

    private record Committed(Identity identity, AppendResult appended) {
    }

    /** Assembles a store. Only the backend is required. */
    public static final class Builder {

        private final PersistenceBackend backend;
        private VersionStoreSettings settings = VersionStoreSettings.defaults();
        private VersionSequencer sequencer = new BackendVersionSequencer();
        private AuditSink auditSink = new NoOpAuditSink();
        private PayloadSchemaRegistry schemas = new PayloadSchemaRegistry();
        private Clock clock = Clock.systemUTC();
        private MeterRegistry meterRegistry;
        private OperationTracer tracer = OperationTracer.noop();
        private ConcurrencyController controller;

        private Builder(PersistenceBackend backend) {
            if (backend == null) {
                throw new IllegalArgumentException("backend must not be null");
            }
            this.backend = backend;
        }

        public Builder settings(VersionStoreSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder sequencer(VersionSequencer sequencer) {
            this.sequencer = sequencer;
            return this;
        }

        public Builder auditSink(AuditSink auditSink) {
            this.auditSink = auditSink;
            return this;
        }

        public Builder schemas(PayloadSchemaRegistry schemas) {
            this.schemas = schemas;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder tracer(OperationTracer tracer) {
            this.tracer = tracer;
            return this;
        }

        /** Replaces the controller derived from the settings. */
        public Builder concurrencyController(ConcurrencyController controller) {
            this.controller = controller;
            return this;
        }

        public VersionedEntityStore build() {
            VersioningMetrics metrics = meterRegistry == null
                    ? VersioningMetrics.detached()
                    : new VersioningMetrics(new MetricFactory(meterRegistry, settings.serviceName()));
            ConcurrencyController chosen = controller != null ? controller : defaultController(metrics);
            log.info("Versioned entity store on {} backend, locking={}, maxAttempts={}",
                    backend.name(), settings.perIdentityLocking(), settings.maxAttempts());
            return new VersionedEntityStore(this, metrics, chosen);
        }

        private ConcurrencyController defaultController(VersioningMetrics metrics) {
            ConcurrencyController optimistic = new OptimisticRetryController(
                    backend, RetryPolicy.of(settings.maxAttempts(), settings.initialBackoff()), metrics);
            return settings.perIdentityLocking()
                    ? new PerIdentityLockController(optimistic, settings.lockTimeout())
                    : optimistic;
        }
    }
}
