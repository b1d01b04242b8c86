package com.tempora.versioning.spi;

import com.tempora.versioning.EntityTypeStatistics;
import com.tempora.versioning.identity.Identity;
import com.tempora.versioning.identity.IdentityKey;
import com.tempora.versioning.version.Version;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Operations available inside a backend transaction.
 *
 * <p>Reads see the transaction's own writes. Tenant filtering is the caller's job: every method
 * that lists rows takes the tenant explicitly, and single-row lookups return the stored tenant so
 * the caller can check it.
 */
public interface StoreTransaction {

    Optional<Identity> findIdentity(IdentityKey key);

    Optional<Identity> findIdentity(String tenantId, String entityType, String businessKey);

    /**
     * Inserts the identity unless one with the same key already exists.
     *
     * @return true if this call inserted it, false if it was already there
     */
    boolean insertIdentityIfAbsent(Identity identity);

    /**
     * Lists a tenant's identities ordered by entity type then business key.
     *
     * @param entityType restricts the listing to one type; null lists every type
     */
    List<Identity> listIdentities(String tenantId, String entityType);

    /** The open version of an identity, if it has ever been written. */
    Optional<Version> currentVersion(IdentityKey key);

    /** The version whose {@code [effectiveStart, effectiveEnd)} interval contains {@code at}. */
    Optional<Version> versionAsOf(IdentityKey key, Instant at);

    /** All versions of an identity in ascending {@code versionSeq} order. */
    List<Version> history(IdentityKey key);

    /** Draws the next value from the backend's global version sequence. */
    long nextVersionSeq();

    /**
     * Compare-and-set on the identity's current slot.
     *
     * @param expectedSeq the version the caller read as current, or null if it read none
     * @param newSeq the version that becomes current
     * @throws com.tempora.versioning.error.ConcurrencyConflictException if the slot no longer holds
     *     {@code expectedSeq}
     */
    void advanceCurrent(IdentityKey key, Long expectedSeq, long newSeq);

    /**
     * Sets {@code effectiveEnd} on an open version.
     *
     * @throws com.tempora.versioning.error.ConcurrencyConflictException if the version is not open
     */
    void closeVersion(IdentityKey key, long versionSeq, Instant effectiveEnd);

    void insertVersion(Version version);

    /** Per entity type counts for a tenant; {@code since} bounds the "recent versions" figure. */
    List<EntityTypeStatistics> statistics(String tenantId, Instant since);
}
