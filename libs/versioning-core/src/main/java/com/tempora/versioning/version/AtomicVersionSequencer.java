package com.tempora.versioning.version;

import com.tempora.versioning.identity.IdentityKey;
import com.tempora.versioning.spi.StoreTransaction;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local sequencer backed by a single {@link AtomicLong}. Only suitable when one process owns
 * the store; values are not persisted.
 */
public final class AtomicVersionSequencer implements VersionSequencer {

    private final AtomicLong counter;

    public AtomicVersionSequencer() {
        this(0L);
    }

    /** Starts issuing from {@code lastIssued + 1}. */
    public AtomicVersionSequencer(long lastIssued) {
        if (lastIssued < 0) {
            throw new IllegalArgumentException("lastIssued must not be negative");
        }
        this.counter = new AtomicLong(lastIssued);
    }

    @Override
    public long next(StoreTransaction tx, IdentityKey key) {
        return counter.incrementAndGet();
    }

    public long lastIssued() {
        return counter.get();
    }
}
