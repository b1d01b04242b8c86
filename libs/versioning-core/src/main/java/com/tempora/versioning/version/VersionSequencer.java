package com.tempora.versioning.version;

import com.tempora.versioning.identity.IdentityKey;
import com.tempora.versioning.spi.StoreTransaction;

/**
 * Issues version numbers. Values are unique and strictly increasing across all callers and are
 * never derived from the clock.
 */
public interface VersionSequencer {

    /**
     * Returns the next version number for a write to {@code key}.
     *
     * @param tx the transaction the version will be written in
     */
    long next(StoreTransaction tx, IdentityKey key);
}
