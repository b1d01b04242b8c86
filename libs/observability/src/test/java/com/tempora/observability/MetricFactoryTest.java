package com.tempora.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "versioning-test");
    }

    @Test
    @DisplayName("rejects missing registry or service name")
    void rejectsInvalidConstruction() {
        assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("registry");
        assertThatThrownBy(() -> new MetricFactory(registry, " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("serviceName");
    }

    @Test
    @DisplayName("counter carries service and extra tags")
    void counterTags() {
        Counter counter = factory.counter("tempora.writes", "Writes", "outcome", "noop");
        counter.increment();

        assertThat(counter.getId().getTag("service")).isEqualTo("versioning-test");
        assertThat(counter.getId().getTag("outcome")).isEqualTo("noop");
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("tenant counters are segmented per tenant")
    void tenantCounters() {
        factory.tenantCounter("tempora.writes", "Writes", "T1", "outcome", "versioned").increment();
        factory.tenantCounter("tempora.writes", "Writes", "T1", "outcome", "versioned").increment();
        factory.tenantCounter("tempora.writes", "Writes", "T2", "outcome", "versioned").increment();

        assertThat(registry.get("tempora.writes").tag("tenant", "T1").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("tempora.writes").tag("tenant", "T2").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("timer and distribution summary record values")
    void timerAndSummary() {
        Timer timer = factory.timer("tempora.write.duration", "Write latency");
        timer.record(Duration.ofMillis(20));
        DistributionSummary summary =
                factory.distributionSummary("tempora.payload.size", "Payload size", "bytes");
        summary.record(512);

        assertThat(timer.count()).isEqualTo(1);
        assertThat(summary.totalAmount()).isEqualTo(512.0);
        assertThat(summary.getId().getBaseUnit()).isEqualTo("bytes");
    }
}
