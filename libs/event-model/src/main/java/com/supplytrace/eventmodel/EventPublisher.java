package com.supplytrace.eventmodel;

/**
 * Outbound port for domain events.
 *
 * <p>Producers call {@link #publish} once per committed state change, in commit order.
 * Implementations must not reorder events.
 */
@FunctionalInterface
public interface EventPublisher {

    /**
     * Publishes one event.
     *
     * @param event the envelope to publish (never null)
     */
    void publish(EventEnvelope<?> event);
}
