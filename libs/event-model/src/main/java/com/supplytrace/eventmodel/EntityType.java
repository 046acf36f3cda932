package com.supplytrace.eventmodel;

/** Kinds of entity an event can relate to. */
public enum EntityType {
    PRODUCT("Product"),
    ROLE_ASSIGNMENT("RoleAssignment");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    /** Canonical string representation. */
    public String value() {
        return value;
    }
}
