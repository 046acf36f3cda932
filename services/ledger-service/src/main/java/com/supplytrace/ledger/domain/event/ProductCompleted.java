package com.supplytrace.ledger.domain.event;

/** Payload of the {@code ProductCompleted} event. */
public record ProductCompleted(long productId) {}
