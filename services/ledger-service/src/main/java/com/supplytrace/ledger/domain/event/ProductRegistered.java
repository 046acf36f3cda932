package com.supplytrace.ledger.domain.event;

import com.supplytrace.security.Identity;

/** Payload of the {@code ProductRegistered} event. */
public record ProductRegistered(long productId, String name, Identity manufacturer) {}
