package com.supplytrace.security;

/**
 * Opaque principal reference (an account address or equivalent).
 * <p>
 * Only equality and hashing matter; the value has no internal structure.
 *
 * @param value the principal reference, never blank
 */
public record Identity(String value) {

    /** The zero identity carried by records that were never registered. */
    public static final Identity ZERO = new Identity("0x0000000000000000000000000000000000000000");

    public Identity {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("identity must not be null or blank");
        }
    }

    public static Identity of(String value) {
        return new Identity(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
