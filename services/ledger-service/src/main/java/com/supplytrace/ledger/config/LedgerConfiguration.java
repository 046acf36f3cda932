package com.supplytrace.ledger.config;

import com.supplytrace.eventmodel.EventPublisher;
import com.supplytrace.eventmodel.InMemoryEventLog;
import com.supplytrace.eventmodel.LoggingEventPublisher;
import com.supplytrace.ledger.domain.InMemoryLedgerStore;
import com.supplytrace.ledger.domain.LedgerMetrics;
import com.supplytrace.ledger.domain.LedgerStore;
import com.supplytrace.ledger.domain.RecordLedger;
import com.supplytrace.ledger.domain.SupplyChainLedger;
import com.supplytrace.observability.MetricFactory;
import com.supplytrace.security.AccessGuard;
import com.supplytrace.security.Identity;
import com.supplytrace.security.InMemoryRoleAssignmentStore;
import com.supplytrace.security.RoleAssignmentStore;
import com.supplytrace.security.RoleRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Wires the ledger components. Stores are plain beans handed to each component through its
 * constructor; swap the in-memory beans for durable adapters to persist state.
 */
@Configuration
public class LedgerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InMemoryEventLog eventLog() {
        return new InMemoryEventLog();
    }

    @Bean
    @Primary
    public EventPublisher eventPublisher(InMemoryEventLog eventLog) {
        return new LoggingEventPublisher(eventLog);
    }

    @Bean
    public RoleAssignmentStore roleAssignmentStore() {
        return new InMemoryRoleAssignmentStore();
    }

    @Bean
    public LedgerStore ledgerStore() {
        return new InMemoryLedgerStore();
    }

    @Bean
    public RoleRegistry roleRegistry(
            RoleAssignmentStore store, EventPublisher publisher, Clock clock,
            LedgerServiceProperties properties) {
        return new RoleRegistry(store, publisher, clock, Identity.of(properties.adminIdentity()));
    }

    @Bean
    public AccessGuard accessGuard(RoleRegistry roleRegistry) {
        return new AccessGuard(roleRegistry);
    }

    @Bean
    public RecordLedger recordLedger(
            LedgerStore store, AccessGuard guard, EventPublisher publisher, Clock clock) {
        return new RecordLedger(store, guard, publisher, clock);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, LedgerServiceProperties properties) {
        return new MetricFactory(meterRegistry, properties.name());
    }

    @Bean
    public LedgerMetrics ledgerMetrics(MetricFactory metricFactory) {
        return new LedgerMetrics(metricFactory);
    }

    @Bean
    public SupplyChainLedger supplyChainLedger(
            RoleRegistry roleRegistry, RecordLedger recordLedger, LedgerMetrics ledgerMetrics) {
        return new SupplyChainLedger(roleRegistry, recordLedger, ledgerMetrics);
    }
}
