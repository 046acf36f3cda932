package com.supplytrace.ledger.domain;

import com.supplytrace.security.Identity;
import java.time.Instant;

/**
 * A tracked product.
 *
 * <p>{@code id}, {@code manufacturer} and {@code createdAt} never change after registration.
 * The other descriptive fields may be rewritten by the manufacturer until the product is
 * completed; {@code completed} only ever goes from false to true.
 *
 * @param id             ledger-assigned id, 0 for the zero record
 * @param name           free-form product name
 * @param originLocation free-form place of origin
 * @param batchNumber    free-form batch reference
 * @param manufacturer   the identity that registered the product (its owner)
 * @param createdAt      ledger time of registration
 * @param expirationDate caller-supplied expiration, not checked against createdAt
 * @param completed      whether the retailer closed the product's journey
 */
public record ProductRecord(
        long id,
        String name,
        String originLocation,
        String batchNumber,
        Identity manufacturer,
        Instant createdAt,
        Instant expirationDate,
        boolean completed) {

    private static final ProductRecord ZERO =
            new ProductRecord(0, "", "", "", Identity.ZERO, Instant.EPOCH, Instant.EPOCH, false);

    public ProductRecord {
        if (name == null || originLocation == null || batchNumber == null) {
            throw new IllegalArgumentException("name, originLocation and batchNumber must not be null");
        }
        if (manufacturer == null || createdAt == null || expirationDate == null) {
            throw new IllegalArgumentException(
                    "manufacturer, createdAt and expirationDate must not be null");
        }
    }

    /** The all-default record returned for ids that hold nothing. */
    public static ProductRecord zero() {
        return ZERO;
    }

    /** False for the zero record and for anything stored against an unregistered id. */
    public boolean isRegistered() {
        return id != 0;
    }

    /** Copy stored under the given id. */
    public ProductRecord withId(long newId) {
        return new ProductRecord(
                newId, name, originLocation, batchNumber, manufacturer, createdAt, expirationDate,
                completed);
    }

    /** Copy with the four mutable fields replaced. */
    public ProductRecord withDetails(
            String newName, String newOriginLocation, String newBatchNumber, Instant newExpiration) {
        return new ProductRecord(
                id, newName, newOriginLocation, newBatchNumber, manufacturer, createdAt,
                newExpiration, completed);
    }

    /** Copy with {@code completed} set. */
    public ProductRecord markCompleted() {
        return new ProductRecord(
                id, name, originLocation, batchNumber, manufacturer, createdAt, expirationDate, true);
    }
}
