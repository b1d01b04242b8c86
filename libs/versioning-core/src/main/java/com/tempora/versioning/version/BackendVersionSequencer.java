package com.tempora.versioning.version;

import com.tempora.versioning.identity.IdentityKey;
import com.tempora.versioning.spi.StoreTransaction;

/** Draws version numbers from the persistence backend's own sequence. The default sequencer. */
public final class BackendVersionSequencer implements VersionSequencer {

    @Override
    public long next(StoreTransaction tx, IdentityKey key) {
        return tx.nextVersionSeq();
    }
}
