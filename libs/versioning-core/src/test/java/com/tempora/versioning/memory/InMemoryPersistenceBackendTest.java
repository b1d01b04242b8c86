package com.tempora.versioning.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tempora.versioning.error.ConcurrencyConflictException;
import com.tempora.versioning.identity.HashKeyDeriver;
import com.tempora.versioning.identity.Identity;
import com.tempora.versioning.identity.IdentityKey;
import com.tempora.versioning.payload.ChangeDetector;
import com.tempora.versioning.payload.Payload;
import com.tempora.versioning.spi.PersistenceBackend;
import com.tempora.versioning.spi.PersistenceBackendContractTest;
import com.tempora.versioning.version.Version;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryPersistenceBackend")
class InMemoryPersistenceBackendTest extends PersistenceBackendContractTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    @Override
    protected PersistenceBackend createBackend() {
        return new InMemoryPersistenceBackend();
    }

    private static final IdentityKey KEY = new HashKeyDeriver().derive(TYPE, "T1", "BUILD_1");

    private static Identity identity() {
        return new Identity(KEY, TYPE, "T1", "BUILD_1", T0, "ci");
    }

    private static Version version(long seq, Map<String, ?> attributes) {
        Payload payload = Payload.fromMap(attributes);
        return new Version(KEY, seq, T0, null, new ChangeDetector().digest(payload), payload, "alice", "ci");
    }

    @Nested
    @DisplayName("transactions")
    class Transactions {

        @Test
        @DisplayName("work that throws leaves nothing behind")
        void rollbackOnException() {
            assertThatThrownBy(() -> backend.inTransaction(tx -> {
                tx.insertIdentityIfAbsent(identity());
                tx.advanceCurrent(KEY, null, 1L);
                tx.insertVersion(version(1L, Map.of("status", "STARTED")));
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(backend.read(tx -> tx.findIdentity(KEY)).isPresent()).isFalse();
            assertThat(backend.read(tx -> tx.currentVersion(KEY)).isPresent()).isFalse();
        }

        @Test
        @DisplayName("reads inside a transaction see its own staged writes")
        void readYourWrites() {
            Version current = backend.inTransaction(tx -> {
                tx.insertIdentityIfAbsent(identity());
                tx.advanceCurrent(KEY, null, 1L);
                tx.insertVersion(version(1L, Map.of("status", "STARTED")));
                assertThat(tx.findIdentity("T1", TYPE, "BUILD_1")).isPresent();
                return tx.currentVersion(KEY).orElseThrow();
            });

            assertThat(current.versionSeq()).isEqualTo(1L);
        }

        @Test
        @DisplayName("a slot swap based on a stale read fails on commit")
        void staleSwapConflicts() {
            backend.inTransaction(tx -> {
                tx.insertIdentityIfAbsent(identity());
                tx.advanceCurrent(KEY, null, 1L);
                tx.insertVersion(version(1L, Map.of("status", "STARTED")));
                return null;
            });

            assertThatThrownBy(() -> backend.inTransaction(tx -> {
                tx.advanceCurrent(KEY, 1L, 3L);
                // a concurrent writer commits version 2 before this transaction does
                backend.inTransaction(inner -> {
                    inner.advanceCurrent(KEY, 1L, 2L);
                    inner.closeVersion(KEY, 1L, T0);
                    inner.insertVersion(version(2L, Map.of("status", "RUNNING")));
                    return null;
                });
                return null;
            })).isInstanceOf(ConcurrencyConflictException.class);

            assertThat(backend.read(tx -> tx.currentVersion(KEY)).orElseThrow().versionSeq()).isEqualTo(2L);
        }

        @Test
        @DisplayName("closing a version that is not open is a conflict")
        void closeClosedVersion() {
            assertThatThrownBy(() -> backend.inTransaction(tx -> {
                tx.closeVersion(KEY, 1L, T0);
                return null;
            })).isInstanceOf(ConcurrencyConflictException.class);
        }

        @Test
        @DisplayName("read-only work may not write")
        void readOnly() {
            assertThatThrownBy(() -> backend.read(tx -> tx.insertIdentityIfAbsent(identity())))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(backend.read(tx -> tx.findIdentity(KEY)).isPresent()).isFalse();
        }
    }
}
