package com.tempora.versioning.spi;

/**
 * Storage for identities, versions and the version sequence.
 *
 * <p>Implementations must make each {@link #inTransaction} call atomic: either everything the work
 * wrote becomes visible together, or nothing does. A lost compare-and-set on the current slot is
 * reported as {@link com.tempora.versioning.error.ConcurrencyConflictException}; an I/O failure as
 * {@link com.tempora.versioning.error.PersistenceUnavailableException}. Any exception thrown by the
 * work itself rolls the transaction back and propagates unchanged.
 */
public interface PersistenceBackend {

    /** Runs {@code work} in a read-write transaction and commits it. */
    <T> T inTransaction(TransactionWork<T> work);

    /** Runs read-only work. Backends may use a cheaper path than {@link #inTransaction}. */
    default <T> T read(TransactionWork<T> work) {
        return inTransaction(work);
    }

    /** Checks that the backend is reachable. Never throws. */
    BackendHealth probe();

    /** Short backend name used in logs and health output. */
    String name();
}
