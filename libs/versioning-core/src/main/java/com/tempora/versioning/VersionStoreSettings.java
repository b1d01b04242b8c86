package com.tempora.versioning;

import java.time.Duration;

/**
 * Tuning for a {@link VersionedEntityStore}. Zero, negative or null values fall back to the
 * defaults.
 *
 * @param maxPayloadBytes largest accepted canonical payload
 * @param lockTimeout longest wait for the per-identity write lock
 * @param maxAttempts attempts per write when the backend reports a concurrent change
 * @param initialBackoff wait before the first retry; doubled on each further retry
 * @param auditTimeout longest time one audit delivery may take
 * @param auditThreads threads delivering audit events
 * @param auditQueueCapacity events that may wait for delivery before new ones are dropped
 * @param perIdentityLocking serialize writers of one identity inside this process
 * @param serviceName value of the {@code service} tag on every meter
 */
public record VersionStoreSettings(
        int maxPayloadBytes,
        Duration lockTimeout,
        int maxAttempts,
        Duration initialBackoff,
        Duration auditTimeout,
        int auditThreads,
        int auditQueueCapacity,
        boolean perIdentityLocking,
        String serviceName) {

    public static final int DEFAULT_MAX_PAYLOAD_BYTES = 64 * 1024;
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(10);
    public static final Duration DEFAULT_AUDIT_TIMEOUT = Duration.ofSeconds(2);
    public static final int DEFAULT_AUDIT_THREADS = 2;
    public static final int DEFAULT_AUDIT_QUEUE_CAPACITY = 1000;
    public static final String DEFAULT_SERVICE_NAME = "tempora";

    public VersionStoreSettings {
        if (maxPayloadBytes <= 0) {
            maxPayloadBytes = DEFAULT_MAX_PAYLOAD_BYTES;
        }
        if (lockTimeout == null || lockTimeout.isNegative() || lockTimeout.isZero()) {
            lockTimeout = DEFAULT_LOCK_TIMEOUT;
        }
        if (maxAttempts <= 0) {
            maxAttempts = DEFAULT_MAX_ATTEMPTS;
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            initialBackoff = DEFAULT_INITIAL_BACKOFF;
        }
        if (auditTimeout == null || auditTimeout.isNegative() || auditTimeout.isZero()) {
            auditTimeout = DEFAULT_AUDIT_TIMEOUT;
        }
        if (auditThreads <= 0) {
            auditThreads = DEFAULT_AUDIT_THREADS;
        }
        if (auditQueueCapacity <= 0) {
            auditQueueCapacity = DEFAULT_AUDIT_QUEUE_CAPACITY;
        }
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = DEFAULT_SERVICE_NAME;
        }
    }

    public static VersionStoreSettings defaults() {
        return new VersionStoreSettings(0, null, 0, null, null, 0, 0, true, null);
    }

    public VersionStoreSettings withMaxPayloadBytes(int bytes) {
        return new VersionStoreSettings(bytes, lockTimeout, maxAttempts, initialBackoff, auditTimeout,
                auditThreads, auditQueueCapacity, perIdentityLocking, serviceName);
    }

    public VersionStoreSettings withLockTimeout(Duration timeout) {
        return new VersionStoreSettings(maxPayloadBytes, timeout, maxAttempts, initialBackoff, auditTimeout,
                auditThreads, auditQueueCapacity, perIdentityLocking, serviceName);
    }

    public VersionStoreSettings withAuditTimeout(Duration timeout) {
        return new VersionStoreSettings(maxPayloadBytes, lockTimeout, maxAttempts, initialBackoff, timeout,
                auditThreads, auditQueueCapacity, perIdentityLocking, serviceName);
    }

    public VersionStoreSettings withPerIdentityLocking(boolean enabled) {
        return new VersionStoreSettings(maxPayloadBytes, lockTimeout, maxAttempts, initialBackoff, auditTimeout,
                auditThreads, auditQueueCapacity, enabled, serviceName);
    }

    public VersionStoreSettings withRetries(int attempts, Duration backoff) {
        return new VersionStoreSettings(maxPayloadBytes, lockTimeout, attempts, backoff, auditTimeout,
                auditThreads, auditQueueCapacity, perIdentityLocking, serviceName);
    }
}
