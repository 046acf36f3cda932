package com.supplytrace.ledger.domain;

import com.supplytrace.observability.MetricFactory;
import com.supplytrace.security.NotOwnerException;
import com.supplytrace.security.UnauthorizedException;
import io.micrometer.core.instrument.Counter;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/** Operation outcome counters and the issued-products gauge. */
public class LedgerMetrics {

    static final String METRIC_OPERATIONS = "ledger.operations";
    static final String METRIC_PRODUCTS = "ledger.products";

    static final String OUTCOME_ACCEPTED = "accepted";
    static final String OUTCOME_UNAUTHORIZED = "unauthorized";
    static final String OUTCOME_NOT_OWNER = "not_owner";
    static final String OUTCOME_ALREADY_COMPLETED = "already_completed";
    static final String OUTCOME_ERROR = "error";

    private final MetricFactory metricFactory;
    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final AtomicLong products;

    public LedgerMetrics(MetricFactory metricFactory) {
        this.metricFactory = metricFactory;
        this.products = metricFactory.gauge(METRIC_PRODUCTS, "Number of product ids issued");
    }

    public void recordAccepted(String operation) {
        counter(operation, OUTCOME_ACCEPTED).increment();
    }

    public void recordRejected(String operation, RuntimeException failure) {
        counter(operation, outcomeOf(failure)).increment();
    }

    public void updateProductCount(long count) {
        products.set(count);
    }

    static String outcomeOf(RuntimeException failure) {
        if (failure instanceof NotOwnerException) {
            return OUTCOME_NOT_OWNER;
        }
        if (failure instanceof UnauthorizedException) {
            return OUTCOME_UNAUTHORIZED;
        }
        if (failure instanceof AlreadyCompletedException) {
            return OUTCOME_ALREADY_COMPLETED;
        }
        return OUTCOME_ERROR;
    }

    private Counter counter(String operation, String outcome) {
        return counters.computeIfAbsent(
                operation + '|' + outcome,
                ignored -> metricFactory.counter(
                        METRIC_OPERATIONS,
                        "Ledger operations by outcome",
                        "operation", operation,
                        "outcome", outcome));
    }
}
