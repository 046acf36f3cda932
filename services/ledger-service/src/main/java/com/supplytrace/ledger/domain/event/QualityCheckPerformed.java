package com.supplytrace.ledger.domain.event;

/** Payload of the {@code QualityCheckPerformed} event. */
public record QualityCheckPerformed(long productId, String checkpointName, boolean passed) {}
