package com.tempora.versioning.concurrency;

import com.tempora.versioning.error.ConcurrencyConflictException;
import com.tempora.versioning.identity.IdentityKey;
import com.tempora.versioning.metrics.VersioningMetrics;
import com.tempora.versioning.spi.PersistenceBackend;
import com.tempora.versioning.spi.TransactionWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Runs each unit of work in its own backend transaction and relies on the backend's current-slot
 * compare-and-set to detect a concurrent writer. A lost race rolls back and is retried with
 * jittered exponential backoff, up to {@link RetryPolicy#maxAttempts()}.
 *
 * <p>This strategy works across processes sharing one database.
 */
public final class OptimisticRetryController implements ConcurrencyController {

    private static final Logger log = LoggerFactory.getLogger(OptimisticRetryController.class);

    private final PersistenceBackend backend;
    private final RetryPolicy policy;
    private final VersioningMetrics metrics;

    public OptimisticRetryController(PersistenceBackend backend, RetryPolicy policy, VersioningMetrics metrics) {
        this.backend = backend;
        this.policy = policy;
        this.metrics = metrics;
    }

    @Override
    public <T> T execute(IdentityKey key, TransactionWork<T> work) {
        int attempt = 1;
        while (true) {
            try {
                return backend.inTransaction(work);
            } catch (ConcurrencyConflictException e) {
                if (attempt >= policy.maxAttempts()) {
                    log.warn("Giving up on {} after {} attempts: {}", key, attempt, e.getMessage());
                    metrics.recordConflictSurfaced();
                    throw e;
                }
                metrics.recordConflictRetried();
                Duration backoff = jitter(policy.backoffAfter(attempt));
                log.debug("Conflict on {} (attempt {}), retrying in {} ms", key, attempt, backoff.toMillis());
                sleep(backoff, e);
                attempt++;
            }
        }
    }

    private static Duration jitter(Duration backoff) {
        long millis = backoff.toMillis();
        if (millis <= 1) {
            return backoff;
        }
        return backoff.plusMillis(ThreadLocalRandom.current().nextLong(millis / 2 + 1));
    }

    private static void sleep(Duration backoff, ConcurrencyConflictException conflict) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            conflict.addSuppressed(ie);
            throw conflict;
        }
    }
}
