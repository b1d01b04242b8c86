package com.tempora.versioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.tempora.observability.OperationTracer;
import com.tempora.observability.WriteContext;
import com.tempora.observability.WriteContextHolder;
import com.tempora.tenancy.TenantScope;
import com.tempora.versioning.audit.RecordingAuditSink;
import com.tempora.versioning.audit.SinkMode;
import com.tempora.versioning.error.PersistenceUnavailableException;
import com.tempora.versioning.error.StoreValidationException;
import com.tempora.versioning.identity.Identity;
import com.tempora.versioning.identity.IdentityKey;
import com.tempora.versioning.memory.InMemoryPersistenceBackend;
import com.tempora.versioning.metrics.VersioningMetrics;
import com.tempora.versioning.payload.Payload;
import com.tempora.versioning.payload.PayloadSchema;
import com.tempora.versioning.payload.PayloadSchemaRegistry;
import com.tempora.versioning.spi.BackendHealth;
import com.tempora.versioning.spi.PersistenceBackend;
import com.tempora.versioning.spi.PersistenceBackendContractTest;
import com.tempora.versioning.spi.StoreTransaction;
import com.tempora.versioning.spi.TransactionWork;
import com.tempora.versioning.version.Version;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("VersionedEntityStore")
class VersionedEntityStoreTest {

    private static final TenantScope T1 = TenantScope.of("T1");
    private static final String TYPE = "script_execution";

    private VersionedEntityStore store;

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.shutdown();
        }
        WriteContextHolder.clear();
    }

    private static WriteRequest request(String key, Payload payload) {
        return new WriteRequest(TYPE, key, payload, "alice", "ci");
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("rejects an invalid request with every error and writes nothing")
        void collectsErrors() {
            store = VersionedEntityStore.builder(new InMemoryPersistenceBackend()).build();
            WriteRequest invalid = new WriteRequest("", "BUILD_1", Payload.parse("{\"_active\":1}"), " ", null);

            assertThatThrownBy(() -> store.write(T1, invalid))
                    .isInstanceOf(StoreValidationException.class)
                    .satisfies(e -> assertThat(((StoreValidationException) e).errors()).containsExactly(
                            "entityType must not be blank",
                            "actor must not be blank",
                            "sourceTag must not be blank",
                            "_active must be a boolean"));
            assertThat(store.listIdentities(T1, null)).isEmpty();
        }

        @Test
        @DisplayName("enforces the configured payload size limit")
        void payloadLimit() {
            store = VersionedEntityStore.builder(new InMemoryPersistenceBackend())
                    .settings(VersionStoreSettings.defaults().withMaxPayloadBytes(32))
                    .build();

            assertThatThrownBy(() -> store.write(T1, request("BUILD_1",
                    Payload.fromMap(Map.of("log", "x".repeat(64))))))
                    .isInstanceOf(StoreValidationException.class)
                    .hasMessageContaining("limit is 32");
        }

        @Test
        @DisplayName("applies the schema registered for the entity type")
        void schema() {
            store = VersionedEntityStore.builder(new InMemoryPersistenceBackend())
                    .schemas(new PayloadSchemaRegistry().register(
                            PayloadSchema.requiring(TYPE, "status").withType("status", JsonNodeType.STRING)))
                    .build();

            assertThatThrownBy(() -> store.write(T1, request("BUILD_1", Payload.fromMap(Map.of("step", 1)))))
                    .isInstanceOf(StoreValidationException.class)
                    .hasMessageContaining("missing required attribute: status");
            assertThat(store.write(T1, request("BUILD_1", Payload.fromMap(Map.of("status", "STARTED")))).changed())
                    .isTrue();
        }

        @Test
        @DisplayName("close requires an actor and as-of reads require a timestamp")
        void otherOperations() {
            store = VersionedEntityStore.builder(new InMemoryPersistenceBackend()).build();

            assertThatThrownBy(() -> store.close(T1, TYPE, "BUILD_1", ""))
                    .isInstanceOf(StoreValidationException.class);
            assertThatThrownBy(() -> store.readAsOf(T1, TYPE, "BUILD_1", null))
                    .isInstanceOf(StoreValidationException.class);
            assertThatThrownBy(() -> store.statistics(T1, Duration.ZERO))
                    .isInstanceOf(StoreValidationException.class);
            assertThatThrownBy(() -> store.statistics(T1, Duration.ofSeconds(Long.MAX_VALUE)))
                    .isInstanceOf(StoreValidationException.class)
                    .hasMessageContaining("must not exceed");
        }
    }

    @Nested
    @DisplayName("persistence failures")
    class PersistenceFailures {

        @Test
        @DisplayName("a backend failure mid-write leaves the visible state unchanged")
        void stateUnchanged() {
            InMemoryPersistenceBackend delegate = new InMemoryPersistenceBackend();
            FailingBackend backend = new FailingBackend(delegate);
            store = VersionedEntityStore.builder(backend).build();
            store.write(T1, request("BUILD_1", Payload.fromMap(Map.of("status", "STARTED"))));

            backend.failInserts = true;
            assertThatThrownBy(() -> store.write(T1, request("BUILD_1",
                    Payload.fromMap(Map.of("status", "COMPLETED")))))
                    .isInstanceOf(PersistenceUnavailableException.class);
            assertThatThrownBy(() -> store.write(T1, request("BUILD_2",
                    Payload.fromMap(Map.of("status", "STARTED")))))
                    .isInstanceOf(PersistenceUnavailableException.class);

            Version current = store.readCurrent(T1, TYPE, "BUILD_1").orElseThrow();
            assertThat(current.versionSeq()).isEqualTo(1L);
            assertThat(current.isCurrent()).isTrue();
            assertThat(store.history(T1, TYPE, "BUILD_1")).hasSize(1);
            assertThat(store.listIdentities(T1, null)).extracting(Identity::businessKey).containsExactly("BUILD_1");
        }
    }

    @Nested
    @DisplayName("optimistic strategy without local locking")
    class OptimisticOnly {

        @Test
        @DisplayName("concurrent writers converge through retries")
        void concurrentWritersRetry() throws Exception {
            store = VersionedEntityStore.builder(new InMemoryPersistenceBackend())
                    .settings(VersionStoreSettings.defaults()
                            .withPerIdentityLocking(false)
                            .withRetries(40, Duration.ofMillis(1)))
                    .build();

            List<WriteResult> results = PersistenceBackendContractTest.runConcurrently(8,
                    i -> () -> store.write(T1, request("OPT_1", Payload.fromMap(Map.of("writer", i)))));

            assertThat(results).extracting(WriteResult::versionSeq).doesNotHaveDuplicates();
            List<Version> history = store.history(T1, TYPE, "OPT_1");
            assertThat(history).hasSize(8);
            assertThat(history).filteredOn(Version::isCurrent).hasSize(1);
        }
    }

    @Nested
    @DisplayName("observability")
    class Observability {

        @Test
        @DisplayName("records write outcomes per tenant")
        void metrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            store = VersionedEntityStore.builder(new InMemoryPersistenceBackend()).meterRegistry(registry).build();
            Payload payload = Payload.fromMap(Map.of("status", "STARTED"));

            store.write(T1, request("BUILD_1", payload));
            store.write(T1, request("BUILD_1", payload));

            assertThat(registry.get(VersioningMetrics.WRITES)
                    .tag(VersioningMetrics.TAG_OUTCOME, VersioningMetrics.OUTCOME_VERSIONED)
                    .tag("tenant", "T1").counter().count()).isEqualTo(1.0);
            assertThat(registry.get(VersioningMetrics.WRITES)
                    .tag(VersioningMetrics.TAG_OUTCOME, VersioningMetrics.OUTCOME_NOOP).counter().count())
                    .isEqualTo(1.0);
            assertThat(registry.get(VersioningMetrics.WRITE_DURATION).timer().count()).isEqualTo(2);
            assertThat(registry.get(VersioningMetrics.PAYLOAD_SIZE).summary().count()).isEqualTo(2);
        }

        @Test
        @DisplayName("traces writes and keeps the caller's correlation id")
        void tracing() throws Exception {
            InMemorySpanExporter exporter = InMemorySpanExporter.create();
            OperationTracer tracer = OperationTracer.from(OpenTelemetrySdk.builder()
                    .setTracerProvider(SdkTracerProvider.builder()
                            .addSpanProcessor(SimpleSpanProcessor.create(exporter)).build())
                    .build());
            RecordingAuditSink sink = new RecordingAuditSink();
            store = VersionedEntityStore.builder(new InMemoryPersistenceBackend())
                    .tracer(tracer).auditSink(sink).build();
            WriteContextHolder.set(new WriteContext("req-77", null, null, null, null));

            store.write(T1, request("BUILD_1", Payload.fromMap(Map.of("status", "STARTED"))));

            SpanData span = exporter.getFinishedSpanItems().get(0);
            assertThat(span.getName()).isEqualTo("tempora.write");
            assertThat(span.getAttributes().get(AttributeKey.stringKey("tenant.id"))).isEqualTo("T1");
            assertThat(span.getAttributes().get(AttributeKey.stringKey("correlation.id"))).isEqualTo("req-77");
            assertThat(sink.awaitEvents(1, Duration.ofSeconds(5)).get(0).correlationId()).isEqualTo("req-77");
            assertThat(WriteContextHolder.get().orElseThrow().correlationId()).isEqualTo("req-77");
        }

        @Test
        @DisplayName("reports the audit sink mode and backend health")
        void modeAndHealth() {
            store = VersionedEntityStore.builder(new InMemoryPersistenceBackend()).build();

            assertThat(store.auditMode()).isEqualTo(SinkMode.STUB);
            assertThat(store.health().available()).isTrue();
        }
    }

    /** Delegating backend whose transactions can be made to fail on version inserts. */
    private static final class FailingBackend implements PersistenceBackend {

        private final PersistenceBackend delegate;
        private volatile boolean failInserts;

        private FailingBackend(PersistenceBackend delegate) {
            this.delegate = delegate;
        }

        @Override
        public <T> T inTransaction(TransactionWork<T> work) {
            return delegate.inTransaction(tx -> work.run(failing(tx)));
        }

        @Override
        public <T> T read(TransactionWork<T> work) {
            return delegate.read(work);
        }

        @Override
        public BackendHealth probe() {
            return delegate.probe();
        }

        @Override
        public String name() {
            return "failing";
        }

        private StoreTransaction failing(StoreTransaction tx) {
            return new StoreTransaction() {
                @Override
                public Optional<Identity> findIdentity(IdentityKey key) {
                    return tx.findIdentity(key);
                }

                @Override
                public Optional<Identity> findIdentity(String tenantId, String entityType, String businessKey) {
                    return tx.findIdentity(tenantId, entityType, businessKey);
                }

                @Override
                public boolean insertIdentityIfAbsent(Identity identity) {
                    return tx.insertIdentityIfAbsent(identity);
                }

                @Override
                public List<Identity> listIdentities(String tenantId, String entityType) {
                    return tx.listIdentities(tenantId, entityType);
                }

                @Override
                public Optional<Version> currentVersion(IdentityKey key) {
                    return tx.currentVersion(key);
                }

                @Override
                public Optional<Version> versionAsOf(IdentityKey key, Instant at) {
                    return tx.versionAsOf(key, at);
                }

                @Override
                public List<Version> history(IdentityKey key) {
                    return tx.history(key);
                }

                @Override
                public long nextVersionSeq() {
                    return tx.nextVersionSeq();
                }

                @Override
                public void advanceCurrent(IdentityKey key, Long expectedSeq, long newSeq) {
                    tx.advanceCurrent(key, expectedSeq, newSeq);
                }

                @Override
                public void closeVersion(IdentityKey key, long versionSeq, Instant effectiveEnd) {
                    tx.closeVersion(key, versionSeq, effectiveEnd);
                }

                @Override
                public void insertVersion(Version version) {
                    if (failInserts) {
                        throw new PersistenceUnavailableException("disk full");
                    }
                    tx.insertVersion(version);
                }

                @Override
                public List<EntityTypeStatistics> statistics(String tenantId, Instant since) {
                    return tx.statistics(tenantId, since);
                }
            };
        }
    }
}
