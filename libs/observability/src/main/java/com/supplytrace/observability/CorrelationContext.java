package com.supplytrace.observability;

/**
 * Immutable correlation context that follows one request through the ledger.
 * <p>
 * Every incoming request should establish a {@code CorrelationContext}. Its values are put
 * into the SLF4J MDC for log output and stamped on the domain events the request produces.
 *
 * @param correlationId unique ID for the request flow (propagated from the caller when present)
 * @param callerId      identity of the caller performing the operation (nullable for system work)
 * @param requestId     unique ID for this specific request
 */
public record CorrelationContext(
        String correlationId,
        String callerId,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for caller identity. */
    public static final String MDC_CALLER_ID = "callerId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * Compact constructor; ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }
}
