package com.warden.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "warden-gateway");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank service name")
        void shouldRejectBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }
    }

    @Test
    @DisplayName("counters carry the service tag and extra tags, and are shared by name and tags")
    void counter() {
        Counter allow = factory.counter("warden.authorization.decisions", "Decisions", "outcome", "ALLOW");
        allow.increment();
        factory.counter("warden.authorization.decisions", "Decisions", "outcome", "ALLOW").increment();

        assertThat(allow.count()).isEqualTo(2.0);
        assertThat(allow.getId().getTag("service")).isEqualTo("warden-gateway");
        assertThat(allow.getId().getTag("outcome")).isEqualTo("ALLOW");
    }

    @Test
    @DisplayName("timers carry the service tag")
    void timer() {
        Timer timer = factory.timer("warden.mediation.duration", "Mediation latency");
        timer.record(Duration.ofMillis(5));

        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.getId().getTag("service")).isEqualTo("warden-gateway");
    }

    @Test
    @DisplayName("gauges sample their supplier")
    void gauge() {
        var tracked = new AtomicInteger(3);
        factory.gauge("warden.ratelimit.clients", "Tracked clients", tracked::get);
        tracked.set(7);

        assertThat(registry.get("warden.ratelimit.clients").tag("service", "warden-gateway").gauge().value())
                .isEqualTo(7.0);
    }
}
