package com.supplytrace.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
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
        factory = new MetricFactory(registry, "ledger-test");
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
    @DisplayName("counter carries service and extra tags")
    void counterTags() {
        var counter = factory.counter("ledger.operations", "ops", "operation", "register");
        counter.increment();

        var found = registry.get("ledger.operations")
                .tag("service", "ledger-test")
                .tag("operation", "register")
                .counter();
        assertThat(found.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("same name and tags resolve to the same counter")
    void counterIsShared() {
        factory.counter("ledger.operations", "ops", "outcome", "accepted").increment();
        factory.counter("ledger.operations", "ops", "outcome", "accepted").increment();

        assertThat(registry.get("ledger.operations").tag("outcome", "accepted").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("gauge follows the returned AtomicLong")
    void gaugeFollowsValue() {
        var value = factory.gauge("ledger.products", "issued ids");
        value.set(7);

        assertThat(registry.get("ledger.products").gauge().value()).isEqualTo(7.0);
    }
}
