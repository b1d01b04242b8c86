package com.tempora.versioning.version;

import com.tempora.tenancy.TenantIsolationEnforcer;
import com.tempora.tenancy.TenantScope;
import com.tempora.versioning.concurrency.ConcurrencyController;
import com.tempora.versioning.error.ConcurrencyConflictException;
import com.tempora.versioning.error.StoreValidationException;
import com.tempora.versioning.identity.Identity;
import com.tempora.versioning.identity.IdentityKey;
import com.tempora.versioning.payload.ChangeDetector;
import com.tempora.versioning.payload.Payload;
import com.tempora.versioning.payload.PayloadDigest;
import com.tempora.versioning.spi.PersistenceBackend;
import com.tempora.versioning.spi.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Versioned attribute history of registered identities.
 *
 * <p>Versions are never updated in place. A change closes the current version and appends a new
 * one in the same transaction; a write whose digest matches the current version writes nothing.
 * Reads check that the identity belongs to the caller's tenant.
 */
public final class SatelliteStore {

    private static final Logger log = LoggerFactory.getLogger(SatelliteStore.class);

    private final PersistenceBackend backend;
    private final ConcurrencyController controller;
    private final VersionSequencer sequencer;
    private final ChangeDetector changeDetector;
    private final Clock clock;

    public SatelliteStore(
            PersistenceBackend backend,
            ConcurrencyController controller,
            VersionSequencer sequencer,
            ChangeDetector changeDetector,
            Clock clock) {
        this.backend = backend;
        this.controller = controller;
        this.sequencer = sequencer;
        this.changeDetector = changeDetector;
        this.clock = clock;
    }

    public Optional<Version> current(TenantScope scope, IdentityKey key) {
        return backend.read(tx -> ownedIdentity(tx, scope, key).flatMap(identity -> tx.currentVersion(key)));
    }

    /** The version valid at {@code at}; empty before the first version or for an unknown key. */
    public Optional<Version> asOf(TenantScope scope, IdentityKey key, Instant at) {
        return backend.read(tx -> ownedIdentity(tx, scope, key).flatMap(identity -> tx.versionAsOf(key, at)));
    }

    /** Every version in ascending sequence order. */
    public List<Version> history(TenantScope scope, IdentityKey key) {
        return backend.read(tx -> ownedIdentity(tx, scope, key).map(identity -> tx.history(key)).orElse(List.of()));
    }

    /**
     * Appends a version to a registered identity unless the payload matches the current version.
     *
     * @throws StoreValidationException if the identity has not been registered
     */
    public AppendResult append(TenantScope scope, IdentityKey key, Payload payload, String actor, String sourceTag) {
        return controller.execute(key, tx -> {
            if (ownedIdentity(tx, scope, key).isEmpty()) {
                throw StoreValidationException.of("identity " + key + " is not registered");
            }
            return appendWithin(tx, key, payload, actor, sourceTag);
        });
    }

    /** The append algorithm, inside a transaction the caller already holds. */
    public AppendResult appendWithin(
            StoreTransaction tx, IdentityKey key, Payload payload, String actor, String sourceTag) {
        Optional<Version> current = tx.currentVersion(key);
        PayloadDigest digest = changeDetector.digest(payload);
        if (current.isPresent() && !changeDetector.hasChanged(current.get().payloadDigest(), digest)) {
            return AppendResult.noOp(current.get());
        }

        Version previous = current.orElse(null);
        long versionSeq = sequencer.next(tx, key);
        if (previous != null && versionSeq <= previous.versionSeq()) {
            throw new ConcurrencyConflictException("Sequencer issued %d for %s whose current version is %d"
                    .formatted(versionSeq, key, previous.versionSeq()));
        }
        Instant start = EffectiveTime.startAfter(clock, previous);

        // swap the current slot first so a losing writer fails before touching version rows
        tx.advanceCurrent(key, previous == null ? null : previous.versionSeq(), versionSeq);
        if (previous != null) {
            tx.closeVersion(key, previous.versionSeq(), start);
        }
        Version created = new Version(key, versionSeq, start, null, digest, payload, actor, sourceTag);
        tx.insertVersion(created);

        log.debug("Appended version {} to {} (previous {})", versionSeq, key,
                previous == null ? "none" : previous.versionSeq());
        return AppendResult.versioned(created, previous == null ? null : previous.closedAt(start));
    }

    private static Optional<Identity> ownedIdentity(StoreTransaction tx, TenantScope scope, IdentityKey key) {
        Optional<Identity> identity = tx.findIdentity(key);
        identity.ifPresent(found -> TenantIsolationEnforcer.enforce(scope, found.tenantId()));
        return identity;
    }
}
