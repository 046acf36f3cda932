package com.supplytrace.ledger.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.supplytrace.ledger.api.CallerHeaders;
import com.supplytrace.observability.CorrelationContext;
import com.supplytrace.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("generates correlation ID when none provided")
    void generatesCorrelationId() throws Exception {
        var response = new MockHttpServletResponse();
        FilterChain chain = (req, resp) -> {};

        filter.doFilter(new MockHttpServletRequest(), response, chain);

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank();
    }

    @Test
    @DisplayName("binds correlation ID and caller while the chain runs")
    void bindsContextDuringChain() throws Exception {
        var captured = new AtomicReference<CorrelationContext>();
        FilterChain chain = (req, resp) -> captured.set(CorrelationContextHolder.get().orElse(null));
        var request = new MockHttpServletRequest();
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "chain-123");
        request.addHeader(CallerHeaders.CALLER_IDENTITY, "0xcaller");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, chain);

        assertThat(captured.get().correlationId()).isEqualTo("chain-123");
        assertThat(captured.get().callerId()).isEqualTo("0xcaller");
        assertThat(captured.get().requestId()).isNotBlank();
        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER))
                .isEqualTo("chain-123");
    }

    @Test
    @DisplayName("clears the context after the request completes")
    void clearsAfterRequest() throws Exception {
        FilterChain chain = (req, resp) -> {};

        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), chain);

        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
