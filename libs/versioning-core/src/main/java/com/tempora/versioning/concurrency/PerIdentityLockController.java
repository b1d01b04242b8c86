package com.tempora.versioning.concurrency;

import com.tempora.versioning.error.ConcurrencyConflictException;
import com.tempora.versioning.identity.IdentityKey;
import com.tempora.versioning.spi.TransactionWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes writers of the same identity inside this process with a striped set of fair
 * {@link ReentrantLock}s, then hands the work to a delegate controller.
 *
 * <p>An identity always maps to the same stripe. Two identities may share a stripe, which only
 * costs throughput. Waiting longer than {@code lockTimeout} fails the call with
 * {@link ConcurrencyConflictException} before anything is written.
 */
public final class PerIdentityLockController implements ConcurrencyController {

    private static final Logger log = LoggerFactory.getLogger(PerIdentityLockController.class);

    /** Default number of lock stripes. */
    public static final int DEFAULT_STRIPES = 256;

    private final ConcurrencyController delegate;
    private final Duration lockTimeout;
    private final ReentrantLock[] stripes;

    public PerIdentityLockController(ConcurrencyController delegate, Duration lockTimeout) {
        this(delegate, lockTimeout, DEFAULT_STRIPES);
    }

    public PerIdentityLockController(ConcurrencyController delegate, Duration lockTimeout, int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be at least 1");
        }
        this.delegate = delegate;
        this.lockTimeout = lockTimeout;
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock(true);
        }
    }

    @Override
    public <T> T execute(IdentityKey key, TransactionWork<T> work) {
        ReentrantLock lock = stripeFor(key);
        acquire(lock, key);
        try {
            return delegate.execute(key, work);
        } finally {
            lock.unlock();
        }
    }

    private void acquire(ReentrantLock lock, IdentityKey key) {
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Timed out after {} ms waiting for the write lock of {}", lockTimeout.toMillis(), key);
                throw new ConcurrencyConflictException(
                        "Timed out waiting for the write lock of identity " + key);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyConflictException("Interrupted waiting for the write lock of identity " + key, e);
        }
    }

    ReentrantLock stripeFor(IdentityKey key) {
        return stripes[Math.floorMod(key.hashCode(), stripes.length)];
    }
}
