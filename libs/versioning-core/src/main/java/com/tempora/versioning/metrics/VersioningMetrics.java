package com.tempora.versioning.metrics;

import com.tempora.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

/** Meters recorded by the versioning engine. */
public final class VersioningMetrics {

    public static final String WRITES = "tempora.writes";
    public static final String WRITE_DURATION = "tempora.write.duration";
    public static final String CONFLICTS_RETRIED = "tempora.conflicts.retried";
    public static final String CONFLICTS_SURFACED = "tempora.conflicts.surfaced";
    public static final String AUDIT_FAILURES = "tempora.audit.failures";
    public static final String PAYLOAD_SIZE = "tempora.payload.size";

    public static final String TAG_OUTCOME = "outcome";
    public static final String OUTCOME_VERSIONED = "versioned";
    public static final String OUTCOME_NOOP = "noop";

    private final MetricFactory factory;
    private final Timer writeDuration;
    private final Counter conflictsRetried;
    private final Counter conflictsSurfaced;
    private final Counter auditFailures;
    private final DistributionSummary payloadSize;

    public VersioningMetrics(MetricFactory factory) {
        this.factory = factory;
        this.writeDuration = factory.timer(WRITE_DURATION, "Time spent in write, including retries");
        this.conflictsRetried = factory.counter(CONFLICTS_RETRIED, "Concurrency conflicts retried internally");
        this.conflictsSurfaced = factory.counter(CONFLICTS_SURFACED, "Concurrency conflicts returned to callers");
        this.auditFailures = factory.counter(AUDIT_FAILURES, "Change events the audit sink failed to accept");
        this.payloadSize = factory.distributionSummary(PAYLOAD_SIZE, "Canonical payload size of writes", "bytes");
    }

    /** Metrics recorded into a private in-memory registry. */
    public static VersioningMetrics detached() {
        return new VersioningMetrics(new MetricFactory(new SimpleMeterRegistry(), "tempora"));
    }

    public void recordWrite(String tenantId, boolean changed, long elapsedNanos) {
        factory.tenantCounter(WRITES, "Writes by outcome", tenantId,
                TAG_OUTCOME, changed ? OUTCOME_VERSIONED : OUTCOME_NOOP).increment();
        writeDuration.record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordPayloadSize(int bytes) {
        payloadSize.record(bytes);
    }

    public void recordConflictRetried() {
        conflictsRetried.increment();
    }

    public void recordConflictSurfaced() {
        conflictsSurfaced.increment();
    }

    public void recordAuditFailure() {
        auditFailures.increment();
    }

    public MetricFactory factory() {
        return factory;
    }
}
