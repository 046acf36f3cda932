package com.supplytrace.eventmodel;

import java.time.Instant;

/**
 * Canonical envelope for every domain event the ledger emits.
 *
 * <p>The envelope carries standard metadata (identification, correlation, versioning) alongside
 * the event-specific payload. Envelopes are immutable once created.
 *
 * @param <T> the type of the event-specific payload
 */
public record EventEnvelope<T>(
        /** Unique identifier for this event instance (UUID v4). */
        String eventId,

        /** The type/name of this event (e.g. "ProductRegistered"). */
        String eventType,

        /** Schema version of this event type, starting at 1. */
        int eventVersion,

        /** When the event occurred. */
        Instant occurredAt,

        /** Name of the component that produced this event. */
        String producer,

        /** Correlation ID linking the event to the request that caused it. */
        String correlationId,

        /** ID of the command or event that directly caused this event. */
        String causationId,

        /** The entity this event relates to. */
        EventEntity entity,

        /** Event-specific data. */
        T payload) {}
