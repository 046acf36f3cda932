package com.supplytrace.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Supply chain roles.
 * <p>
 * Roles are flat: holding one never implies another, so an ADMIN that wants to register
 * products must also be granted MANUFACTURER. ADMIN administers every role, itself included.
 */
public enum Role {

    ADMIN("DEFAULT_ADMIN_ROLE"),
    MANUFACTURER("MANUFACTURER_ROLE"),
    DISTRIBUTOR("DISTRIBUTOR_ROLE"),
    RETAILER("RETAILER_ROLE");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "MANUFACTURER_ROLE"). */
    public String value() {
        return value;
    }

    /** The role whose holders may grant and revoke this role. */
    public Role adminRole() {
        return ADMIN;
    }

    /**
     * Looks up a Role by its canonical value ("RETAILER_ROLE") or its name ("retailer").
     *
     * @param value the string to match
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Role role : values()) {
            if (role.value.equals(value) || role.name().equals(value.toUpperCase(Locale.ROOT))) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #fromString(String)} but fails for unknown names.
     *
     * @throws IllegalArgumentException if the value does not name a role
     */
    public static Role parse(String value) {
        return fromString(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
    }
}
