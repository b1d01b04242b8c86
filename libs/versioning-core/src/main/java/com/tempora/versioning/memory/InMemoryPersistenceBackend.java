package com.tempora.versioning.memory;

import com.tempora.versioning.EntityTypeStatistics;
import com.tempora.versioning.error.ConcurrencyConflictException;
import com.tempora.versioning.identity.Identity;
import com.tempora.versioning.identity.IdentityKey;
import com.tempora.versioning.spi.BackendHealth;
import com.tempora.versioning.spi.PersistenceBackend;
import com.tempora.versioning.spi.StoreTransaction;
import com.tempora.versioning.spi.TransactionWork;
import com.tempora.versioning.version.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Heap-resident backend for tests, embedded use and single-process deployments.
 *
 * <p>A transaction reads committed state plus its own staged writes and applies the staged writes
 * on commit under the write lock, after checking that every current-slot swap still matches what
 * the transaction read. A transaction that throws is simply discarded, so nothing it staged is ever
 * visible. Read-only work runs under the read lock and sees a consistent snapshot.
 */
public final class InMemoryPersistenceBackend implements PersistenceBackend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPersistenceBackend.class);

    public static final String NAME = "memory";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<IdentityKey, Identity> identities = new HashMap<>();
    private final Map<NaturalKey, IdentityKey> naturalIndex = new HashMap<>();
    private final Map<IdentityKey, NavigableMap<Long, Version>> versions = new HashMap<>();
    private final Map<IdentityKey, Long> currentSlots = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public <T> T inTransaction(TransactionWork<T> work) {
        InMemoryTransaction tx = new InMemoryTransaction();
        T result = work.run(tx);
        commit(tx);
        return result;
    }

    @Override
    public <T> T read(TransactionWork<T> work) {
        return underReadLock(() -> {
            InMemoryTransaction tx = new InMemoryTransaction();
            T result = work.run(tx);
            if (!tx.isEmpty()) {
                throw new IllegalStateException("Read-only work attempted to write");
            }
            return result;
        });
    }

    @Override
    public BackendHealth probe() {
        return BackendHealth.available(NAME, Duration.ZERO);
    }

    @Override
    public String name() {
        return NAME;
    }

    private void commit(InMemoryTransaction tx) {
        if (tx.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            verify(tx);
            apply(tx);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void verify(InMemoryTransaction tx) {
        for (Identity identity : tx.stagedIdentities.values()) {
            if (identities.containsKey(identity.identityKey())) {
                throw new ConcurrencyConflictException(
                        "Identity " + identity.identityKey() + " was registered by a concurrent writer");
            }
        }
        for (Map.Entry<IdentityKey, SlotSwap> swap : tx.stagedSlots.entrySet()) {
            Long committed = currentSlots.get(swap.getKey());
            Long expected = swap.getValue().expected();
            if (expected == null ? committed != null : !expected.equals(committed)) {
                throw new ConcurrencyConflictException(
                        "Current version of " + swap.getKey() + " changed concurrently");
            }
        }
    }

    private void apply(InMemoryTransaction tx) {
        for (Identity identity : tx.stagedIdentities.values()) {
            identities.put(identity.identityKey(), identity);
            naturalIndex.put(NaturalKey.of(identity), identity.identityKey());
        }
        for (Map.Entry<VersionRef, Instant> close : tx.stagedCloses.entrySet()) {
            VersionRef ref = close.getKey();
            NavigableMap<Long, Version> history = versions.get(ref.key());
            Version open = history == null ? null : history.get(ref.versionSeq());
            if (open != null) {
                history.put(ref.versionSeq(), open.closedAt(close.getValue()));
            }
        }
        for (Version version : tx.stagedVersions) {
            versions.computeIfAbsent(version.identityKey(), key -> new TreeMap<>())
                    .put(version.versionSeq(), version);
        }
        tx.stagedSlots.forEach((key, swap) -> currentSlots.put(key, swap.updated()));
        log.trace("Committed {} identities and {} versions", tx.stagedIdentities.size(), tx.stagedVersions.size());
    }

    private <T> T underReadLock(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private record NaturalKey(String tenantId, String entityType, String businessKey) {

        static NaturalKey of(Identity identity) {
            return new NaturalKey(identity.tenantId(), identity.entityType(), identity.businessKey());
        }
    }

    private record VersionRef(IdentityKey key, long versionSeq) {
    }

    private record SlotSwap(Long expected, long updated) {
    }

    private final class InMemoryTransaction implements StoreTransaction {

        private final Map<IdentityKey, Identity> stagedIdentities = new LinkedHashMap<>();
        private final Map<IdentityKey, SlotSwap> stagedSlots = new HashMap<>();
        private final Map<VersionRef, Instant> stagedCloses = new HashMap<>();
        private final List<Version> stagedVersions = new ArrayList<>();

        boolean isEmpty() {
            return stagedIdentities.isEmpty() && stagedSlots.isEmpty()
                    && stagedCloses.isEmpty() && stagedVersions.isEmpty();
        }

        @Override
        public Optional<Identity> findIdentity(IdentityKey key) {
            Identity staged = stagedIdentities.get(key);
            if (staged != null) {
                return Optional.of(staged);
            }
            return underReadLock(() -> Optional.ofNullable(identities.get(key)));
        }

        @Override
        public Optional<Identity> findIdentity(String tenantId, String entityType, String businessKey) {
            NaturalKey natural = new NaturalKey(tenantId, entityType, businessKey);
            for (Identity staged : stagedIdentities.values()) {
                if (NaturalKey.of(staged).equals(natural)) {
                    return Optional.of(staged);
                }
            }
            return underReadLock(() -> Optional.ofNullable(naturalIndex.get(natural)).map(identities::get));
        }

        @Override
        public boolean insertIdentityIfAbsent(Identity identity) {
            if (findIdentity(identity.identityKey()).isPresent()) {
                return false;
            }
            stagedIdentities.put(identity.identityKey(), identity);
            return true;
        }

        @Override
        public List<Identity> listIdentities(String tenantId, String entityType) {
            List<Identity> result = underReadLock(() -> new ArrayList<>(identities.values()));
            result.addAll(stagedIdentities.values());
            result.removeIf(identity -> !identity.tenantId().equals(tenantId)
                    || (entityType != null && !identity.entityType().equals(entityType)));
            result.sort(Comparator.comparing(Identity::entityType).thenComparing(Identity::businessKey));
            return result;
        }

        @Override
        public Optional<Version> currentVersion(IdentityKey key) {
            Long slot = visibleSlot(key);
            return slot == null ? Optional.empty() : Optional.ofNullable(visibleVersions(key).get(slot));
        }

        @Override
        public Optional<Version> versionAsOf(IdentityKey key, Instant at) {
            return visibleVersions(key).descendingMap().values().stream()
                    .filter(version -> version.covers(at))
                    .findFirst();
        }

        @Override
        public List<Version> history(IdentityKey key) {
            return new ArrayList<>(visibleVersions(key).values());
        }

        @Override
        public long nextVersionSeq() {
            return sequence.incrementAndGet();
        }

        @Override
        public void advanceCurrent(IdentityKey key, Long expectedSeq, long newSeq) {
            Long visible = visibleSlot(key);
            if (expectedSeq == null ? visible != null : !expectedSeq.equals(visible)) {
                throw new ConcurrencyConflictException("Current version of " + key + " changed concurrently");
            }
            SlotSwap already = stagedSlots.get(key);
            Long committedExpectation = already != null ? already.expected() : expectedSeq;
            stagedSlots.put(key, new SlotSwap(committedExpectation, newSeq));
        }

        @Override
        public void closeVersion(IdentityKey key, long versionSeq, Instant effectiveEnd) {
            Version open = visibleVersions(key).get(versionSeq);
            if (open == null || !open.isCurrent()) {
                throw new ConcurrencyConflictException(
                        "Version " + versionSeq + " of " + key + " is no longer open");
            }
            stagedCloses.put(new VersionRef(key, versionSeq), effectiveEnd);
        }

        @Override
        public void insertVersion(Version version) {
            stagedVersions.add(version);
        }

        @Override
        public List<EntityTypeStatistics> statistics(String tenantId, Instant since) {
            return underReadLock(() -> {
                Map<String, List<Identity>> byType = new TreeMap<>();
                for (Identity identity : identities.values()) {
                    if (identity.tenantId().equals(tenantId)) {
                        byType.computeIfAbsent(identity.entityType(), type -> new ArrayList<>()).add(identity);
                    }
                }
                List<EntityTypeStatistics> rows = new ArrayList<>();
                byType.forEach((entityType, members) -> rows.add(statisticsFor(entityType, members, since)));
                return rows;
            });
        }

        private EntityTypeStatistics statisticsFor(String entityType, List<Identity> members, Instant since) {
            Instant lastCreated = null;
            long total = 0;
            long open = 0;
            long recent = 0;
            for (Identity identity : members) {
                if (lastCreated == null || identity.createdAt().isAfter(lastCreated)) {
                    lastCreated = identity.createdAt();
                }
                for (Version version : versions.getOrDefault(identity.identityKey(), new TreeMap<>()).values()) {
                    total++;
                    if (version.isCurrent()) {
                        open++;
                    }
                    if (!version.effectiveStart().isBefore(since)) {
                        recent++;
                    }
                }
            }
            return new EntityTypeStatistics(entityType, members.size(), lastCreated, total, open, recent);
        }

        private Long visibleSlot(IdentityKey key) {
            SlotSwap staged = stagedSlots.get(key);
            if (staged != null) {
                return staged.updated();
            }
            return underReadLock(() -> currentSlots.get(key));
        }

        private NavigableMap<Long, Version> visibleVersions(IdentityKey key) {
            NavigableMap<Long, Version> merged = underReadLock(() -> {
                NavigableMap<Long, Version> committed = versions.get(key);
                return committed == null ? new TreeMap<>() : new TreeMap<>(committed);
            });
            stagedCloses.forEach((ref, end) -> {
                if (ref.key().equals(key)) {
                    merged.computeIfPresent(ref.versionSeq(), (seq, version) -> version.closedAt(end));
                }
            });
            for (Version version : stagedVersions) {
                if (version.identityKey().equals(key)) {
                    merged.put(version.versionSeq(), version);
                }
            }
            return merged;
        }
    }
}
