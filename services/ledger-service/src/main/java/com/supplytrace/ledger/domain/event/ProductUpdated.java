package com.supplytrace.ledger.domain.event;

/** Payload of the {@code ProductUpdated} event. */
public record ProductUpdated(long productId) {}
