package com.agentverse.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MetricFactory}: construction checks and service tagging.
 */
@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "authz-test");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void rejectsNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank service name")
        void rejectsBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, " "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }
    }

    @Test
    @DisplayName("counter carries the service tag and extra tags")
    void counterTags() {
        factory.counter("authz.decisions", "decisions", "outcome", "allow").increment(2);

        var counter = registry.get("authz.decisions")
                .tag(MetricFactory.TAG_SERVICE, "authz-test")
                .tag("outcome", "allow")
                .counter();
        assertThat(counter.count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("requesting the same counter twice returns the same meter")
    void counterIsShared() {
        factory.counter("authz.decisions", "decisions", "outcome", "deny").increment();
        factory.counter("authz.decisions", "decisions", "outcome", "deny").increment();

        assertThat(registry.get("authz.decisions").tag("outcome", "deny").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("timer records durations")
    void timerRecords() {
        factory.timer("authz.decision.duration", "latency").record(Duration.ofMillis(5));

        assertThat(registry.get("authz.decision.duration").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("gauge samples its source on every read and carries the service tag")
    void gaugeSamplesSource() {
        AtomicLong size = new AtomicLong(42);
        factory.gauge("authz.cache.size", "entries", size, AtomicLong::doubleValue, "provider", "caffeine");

        assertThat(registry.get("authz.cache.size").tag("service", "authz-test").tag("provider", "caffeine")
                .gauge().value()).isEqualTo(42.0);
        size.set(7);
        assertThat(registry.get("authz.cache.size").gauge().value()).isEqualTo(7.0);
    }

    @Test
    @DisplayName("odd tag lists are rejected")
    void oddTags() {
        assertThatThrownBy(() -> factory.counter("x", "x", "only-key"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
