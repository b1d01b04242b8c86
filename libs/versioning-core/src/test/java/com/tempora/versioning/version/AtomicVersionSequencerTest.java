package com.tempora.versioning.version;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tempora.versioning.identity.HashKeyDeriver;
import com.tempora.versioning.identity.IdentityKey;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AtomicVersionSequencer")
class AtomicVersionSequencerTest {

    private static final IdentityKey KEY = new HashKeyDeriver().derive("t", "T1", "k");

    @Test
    @DisplayName("continues after the seeded value")
    void seeded() {
        AtomicVersionSequencer sequencer = new AtomicVersionSequencer(41);

        assertThat(sequencer.next(null, KEY)).isEqualTo(42);
        assertThat(sequencer.next(null, KEY)).isEqualTo(43);
        assertThat(sequencer.lastIssued()).isEqualTo(43);
        assertThatThrownBy(() -> new AtomicVersionSequencer(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("never issues a value twice under contention")
    void uniqueUnderContention() throws Exception {
        AtomicVersionSequencer sequencer = new AtomicVersionSequencer();
        Set<Long> issued = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            List<Future<?>> futures = IntStream.range(0, 16)
                    .<Future<?>>mapToObj(i -> pool.submit(() -> {
                        for (int n = 0; n < 1000; n++) {
                            issued.add(sequencer.next(null, KEY));
                        }
                    }))
                    .toList();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(issued).hasSize(16_000);
        assertThat(sequencer.lastIssued()).isEqualTo(16_000);
    }
}
