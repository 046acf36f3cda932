package com.supplytrace.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.supplytrace.observability.testing.TestCorrelationContextFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set() / get()")
    class SetGet {

        @Test
        @DisplayName("stores context and populates MDC")
        void storesAndPopulatesMdc() {
            CorrelationContextHolder.set(TestCorrelationContextFactory.createDefault());

            assertThat(CorrelationContextHolder.get()).isPresent();
            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("test-corr-001");
            assertThat(MDC.get(CorrelationContext.MDC_CALLER_ID)).isEqualTo("0xtest-caller");
            assertThat(MDC.get(CorrelationContext.MDC_REQUEST_ID)).isEqualTo("req-test-001");
        }

        @Test
        @DisplayName("null caller removes the MDC key")
        void nullCallerRemovesKey() {
            MDC.put(CorrelationContext.MDC_CALLER_ID, "stale");

            CorrelationContextHolder.set(TestCorrelationContextFactory.withCorrelationId("c-1"));

            assertThat(MDC.get(CorrelationContext.MDC_CALLER_ID)).isNull();
        }

        @Test
        @DisplayName("rejects null context")
        void rejectsNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("clear() removes context and MDC keys")
    void clearRemovesEverything() {
        CorrelationContextHolder.set(TestCorrelationContextFactory.createDefault());

        CorrelationContextHolder.clear();

        assertThat(CorrelationContextHolder.get()).isEmpty();
        assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
    }

    @Nested
    @DisplayName("currentCorrelationId()")
    class CurrentCorrelationId {

        @Test
        @DisplayName("returns the bound correlation ID")
        void returnsBound() {
            CorrelationContextHolder.set(TestCorrelationContextFactory.withCorrelationId("bound-1"));

            assertThat(CorrelationContextHolder.currentCorrelationId()).isEqualTo("bound-1");
        }

        @Test
        @DisplayName("generates a fresh ID when nothing is bound")
        void generatesWhenUnbound() {
            var first = CorrelationContextHolder.currentCorrelationId();
            var second = CorrelationContextHolder.currentCorrelationId();

            assertThat(first).isNotBlank().isNotEqualTo(second);
        }
    }

    @Test
    @DisplayName("runWithContext() restores the previous context")
    void runWithContextRestores() {
        CorrelationContextHolder.set(TestCorrelationContextFactory.withCorrelationId("outer"));
        var seen = new String[1];

        CorrelationContextHolder.runWithContext(
                TestCorrelationContextFactory.withCorrelationId("inner"),
                () -> seen[0] = CorrelationContextHolder.currentCorrelationId());

        assertThat(seen[0]).isEqualTo("inner");
        assertThat(CorrelationContextHolder.currentCorrelationId()).isEqualTo("outer");
    }

    @Test
    @DisplayName("CorrelationContext rejects blank correlation ID")
    void contextRejectsBlank() {
        assertThatThrownBy(() -> new CorrelationContext(" ", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
    }
}
