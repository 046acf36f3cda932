package com.supplytrace.eventmodel;

/**
 * Identifies the entity an event relates to.
 *
 * @param entityType the kind of entity, e.g. "Product" or "RoleAssignment"
 * @param entityId unique identifier of the entity instance
 */
public record EventEntity(String entityType, String entityId) {

    /** Shorthand for {@code new EventEntity(type.value(), id)}. */
    public static EventEntity of(EntityType type, String id) {
        return new EventEntity(type.value(), id);
    }
}
