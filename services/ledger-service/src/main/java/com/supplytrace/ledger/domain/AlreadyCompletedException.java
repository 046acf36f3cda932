package com.supplytrace.ledger.domain;

/**
 * Thrown when a product whose journey is complete is asked to change again.
 */
public class AlreadyCompletedException extends RuntimeException {

    private final long productId;

    public AlreadyCompletedException(long productId) {
        super("Product %d has already completed its journey".formatted(productId));
        this.productId = productId;
    }

    public long productId() {
        return productId;
    }
}
