package com.supplytrace.ledger.api;

import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Body of product registration and update requests. Field contents are not validated beyond
 * presence.
 */
public record ProductDetailsRequest(
        @NotNull String name,
        @NotNull String originLocation,
        @NotNull String batchNumber,
        @NotNull Instant expirationDate) {}
