package com.tempora.versioning.identity;

import com.tempora.tenancy.TenantIsolationEnforcer;
import com.tempora.tenancy.TenantScope;
import com.tempora.versioning.concurrency.ConcurrencyController;
import com.tempora.versioning.error.ConcurrencyConflictException;
import com.tempora.versioning.error.StoreValidationException;
import com.tempora.versioning.spi.PersistenceBackend;
import com.tempora.versioning.spi.StoreTransaction;
import com.tempora.versioning.version.EffectiveTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Append-only registry of identities.
 *
 * <p>{@link #ensure} is insert-if-absent: whichever concurrent caller inserts first gets
 * {@link EnsureOutcome#CREATED}, every other caller gets {@link EnsureOutcome#ALREADY_EXISTS} and
 * the winner's row. Identities are never updated or removed.
 */
public final class HubRegistry {

    private static final Logger log = LoggerFactory.getLogger(HubRegistry.class);

    private final PersistenceBackend backend;
    private final ConcurrencyController controller;
    private final HashKeyDeriver deriver;
    private final Clock clock;

    public HubRegistry(
            PersistenceBackend backend, ConcurrencyController controller, HashKeyDeriver deriver, Clock clock) {
        this.backend = backend;
        this.controller = controller;
        this.deriver = deriver;
        this.clock = clock;
    }

    /**
     * Registers the identity if it does not exist yet.
     *
     * @throws StoreValidationException if {@code key} is not the key derived from the other fields
     */
    public EnsureResult ensure(
            TenantScope scope, IdentityKey key, String entityType, String businessKey, String sourceTag) {
        IdentityKey derived = deriver.derive(entityType, scope.tenantId(), businessKey);
        if (!derived.equals(key)) {
            throw StoreValidationException.of("identity key does not match (entityType, tenantId, businessKey)");
        }
        return controller.execute(key, tx -> ensureWithin(tx, scope, key, entityType, businessKey, sourceTag));
    }

    /** {@link #ensure} inside a transaction the caller already holds. */
    public EnsureResult ensureWithin(
            StoreTransaction tx,
            TenantScope scope,
            IdentityKey key,
            String entityType,
            String businessKey,
            String sourceTag) {
        Optional<Identity> existing = tx.findIdentity(key);
        if (existing.isPresent()) {
            TenantIsolationEnforcer.enforce(scope, existing.get().tenantId());
            return EnsureResult.alreadyExists(existing.get());
        }

        Identity identity = new Identity(
                key, entityType, scope.tenantId(), businessKey, EffectiveTime.now(clock), sourceTag);
        if (tx.insertIdentityIfAbsent(identity)) {
            log.debug("Registered identity {} for {}/{}", key, entityType, businessKey);
            return EnsureResult.created(identity);
        }

        Identity winner = tx.findIdentity(key).orElseThrow(() ->
                new ConcurrencyConflictException("Identity " + key + " not visible after losing its insert race"));
        TenantIsolationEnforcer.enforce(scope, winner.tenantId());
        return EnsureResult.alreadyExists(winner);
    }

    /** Resolves a business key to its identity key, if registered. */
    public Optional<IdentityKey> lookup(TenantScope scope, String entityType, String businessKey) {
        return backend.read(tx -> tx.findIdentity(scope.tenantId(), entityType, businessKey))
                .map(Identity::identityKey);
    }

    /**
     * Loads an identity by key.
     *
     * @throws com.tempora.tenancy.TenantMismatchException if it belongs to another tenant
     */
    public Optional<Identity> find(TenantScope scope, IdentityKey key) {
        Optional<Identity> identity = backend.read(tx -> tx.findIdentity(key));
        identity.ifPresent(found -> TenantIsolationEnforcer.enforce(scope, found.tenantId()));
        return identity;
    }

    /** Lists the tenant's identities of one type, or of every type when {@code entityType} is null. */
    public List<Identity> list(TenantScope scope, String entityType) {
        return backend.read(tx -> tx.listIdentities(scope.tenantId(), entityType));
    }
}
