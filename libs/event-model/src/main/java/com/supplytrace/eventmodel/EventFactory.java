package com.supplytrace.eventmodel;

import java.time.Instant;
import java.util.UUID;

/**
 * Factory methods for creating {@link EventEnvelope} instances.
 *
 * <p>Fills in the defaults (UUID event id, version 1, direct causation) so producers only supply
 * what is specific to the event. The timestamp comes from the producer so it matches the clock
 * the producer stamps its own state with.
 */
public final class EventFactory {

    /** Causation marker for events caused directly by an incoming command. */
    public static final String DIRECT_CAUSATION = "direct";

    private EventFactory() {
        // utility class
    }

    /**
     * Creates a new event envelope bound to an existing correlation ID.
     *
     * @param occurredAt when the state change was committed
     */
    public static <T> EventEnvelope<T> create(
            EventType eventType,
            String producer,
            String correlationId,
            Instant occurredAt,
            EventEntity entity,
            T payload) {
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                eventType.value(),
                1,
                occurredAt,
                producer,
                correlationId,
                DIRECT_CAUSATION,
                entity,
                payload);
    }
}
