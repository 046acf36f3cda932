package com.supplytrace.security;

import java.util.Set;

/**
 * Storage port for the {@code (identity, role) -> granted} relation.
 * <p>
 * Absence of an entry means "not granted". Implementations need not be thread-safe; callers
 * serialize mutations.
 */
public interface RoleAssignmentStore {

    boolean isAssigned(Identity identity, Role role);

    /**
     * Marks the role as granted.
     *
     * @return true if the assignment changed, false if it was already granted
     */
    boolean assign(Identity identity, Role role);

    /**
     * Marks the role as not granted.
     *
     * @return true if the assignment changed, false if it was not granted
     */
    boolean unassign(Identity identity, Role role);

    /** All roles currently granted to the identity. */
    Set<Role> rolesOf(Identity identity);
}
