package com.supplytrace.ledger.infrastructure.web;

import com.supplytrace.ledger.api.CallerHeaders;
import com.supplytrace.observability.CorrelationContext;
import com.supplytrace.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation ID for every HTTP request.
 *
 * <p>The ID from {@code X-Correlation-ID} (or a fresh UUID) is bound to
 * {@link CorrelationContextHolder} together with the caller identity, which puts both into the
 * SLF4J MDC and onto every event the request publishes. The ID is echoed in the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        String caller = request.getHeader(CallerHeaders.CALLER_IDENTITY);

        CorrelationContextHolder.set(
                new CorrelationContext(correlationId, caller, UUID.randomUUID().toString()));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Servlet threads are pooled.
            CorrelationContextHolder.clear();
        }
    }
}
