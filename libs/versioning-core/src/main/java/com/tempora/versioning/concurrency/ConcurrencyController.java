package com.tempora.versioning.concurrency;

import com.tempora.versioning.identity.IdentityKey;
import com.tempora.versioning.spi.TransactionWork;

/**
 * Runs the hub-ensure, current-read, close and insert steps of a write as one atomic unit with
 * respect to other writers of the same identity.
 *
 * <p>Implementations guarantee that no two successful writes to one identity ever leave two open
 * versions, and that a failed call leaves nothing behind.
 */
public interface ConcurrencyController {

    /**
     * Executes {@code work} for {@code key}. The work may be run more than once, so it must not
     * have side effects outside the transaction.
     *
     * @throws com.tempora.versioning.error.ConcurrencyConflictException if the conflict could not be
     *     resolved within the controller's bounds
     */
    <T> T execute(IdentityKey key, TransactionWork<T> work);
}
