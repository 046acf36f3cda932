package com.supplytrace.ledger.api;

import com.supplytrace.ledger.domain.ProductRecord;
import java.time.Instant;

/** JSON view of a {@link ProductRecord}. */
public record ProductResponse(
        long id,
        String name,
        String originLocation,
        String batchNumber,
        String manufacturer,
        Instant createdAt,
        Instant expirationDate,
        boolean completed) {

    static ProductResponse from(ProductRecord product) {
        return new ProductResponse(
                product.id(),
                product.name(),
                product.originLocation(),
                product.batchNumber(),
                product.manufacturer().value(),
                product.createdAt(),
                product.expirationDate(),
                product.completed());
    }
}
