package com.supplytrace.eventmodel;

import java.util.Optional;

/**
 * All domain event types emitted by the ledger.
 *
 * <p>The {@code value} field holds the canonical string used in JSON serialization.
 */
public enum EventType {

    // ---- Product lifecycle ----
    PRODUCT_REGISTERED("ProductRegistered"),
    QUALITY_CHECK_PERFORMED("QualityCheckPerformed"),
    PRODUCT_COMPLETED("ProductCompleted"),
    PRODUCT_UPDATED("ProductUpdated"),

    // ---- Access control ----
    ROLE_GRANTED("RoleGranted"),
    ROLE_REVOKED("RoleRevoked");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /** The canonical string representation used in JSON (e.g. "ProductRegistered"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an EventType by its canonical string value.
     *
     * @param value the string to match (e.g. "ProductCompleted")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known event type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
