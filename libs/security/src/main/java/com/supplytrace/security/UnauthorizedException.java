package com.supplytrace.security;

import java.util.Set;

/**
 * Thrown when a caller lacks the role (or ownership) an operation requires.
 * <p>
 * Raised before any state is touched, so a failed call never leaves partial changes behind.
 */
public class UnauthorizedException extends RuntimeException {

    private final Identity caller;
    private final Set<Role> requiredRoles;

    public UnauthorizedException(Identity caller, Set<Role> requiredRoles) {
        super("Identity '%s' holds none of the required roles %s".formatted(caller, requiredRoles));
        this.caller = caller;
        this.requiredRoles = Set.copyOf(requiredRoles);
    }

    protected UnauthorizedException(Identity caller, String message) {
        super(message);
        this.caller = caller;
        this.requiredRoles = Set.of();
    }

    public Identity caller() {
        return caller;
    }

    /** The roles that would have satisfied the check; empty for non-role checks. */
    public Set<Role> requiredRoles() {
        return requiredRoles;
    }
}
