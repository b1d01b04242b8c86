package com.tempora.versioning.error;

/**
 * A concurrent writer changed the current version of the same identity first, or the per-identity
 * lock could not be acquired in time.
 *
 * <p>Raised by persistence backends when a compare-and-set on the current slot loses. The
 * concurrency controller retries these internally; callers only see one when retries are exhausted.
 */
public class ConcurrencyConflictException extends VersionStoreException {

    public ConcurrencyConflictException(String message) {
        super(message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
