package com.supplytrace.security;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/** {@link RoleAssignmentStore} backed by a plain map. Not thread-safe. */
public class InMemoryRoleAssignmentStore implements RoleAssignmentStore {

    private final Map<Identity, EnumSet<Role>> assignments = new HashMap<>();

    @Override
    public boolean isAssigned(Identity identity, Role role) {
        EnumSet<Role> roles = assignments.get(identity);
        return roles != null && roles.contains(role);
    }

    @Override
    public boolean assign(Identity identity, Role role) {
        return assignments.computeIfAbsent(identity, ignored -> EnumSet.noneOf(Role.class)).add(role);
    }

    @Override
    public boolean unassign(Identity identity, Role role) {
        EnumSet<Role> roles = assignments.get(identity);
        if (roles == null || !roles.remove(role)) {
            return false;
        }
        if (roles.isEmpty()) {
            assignments.remove(identity);
        }
        return true;
    }

    @Override
    public Set<Role> rolesOf(Identity identity) {
        EnumSet<Role> roles = assignments.get(identity);
        return roles == null ? Set.of() : Set.copyOf(roles);
    }
}
