package com.supplytrace.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stateless policy evaluator run at the top of every mutating ledger operation.
 * <p>
 * Combines role lookups in the {@link RoleRegistry} with ownership checks. Guards only read;
 * their single side effect is the exception they throw.
 */
public final class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final RoleRegistry roles;

    public AccessGuard(RoleRegistry roles) {
        if (roles == null) {
            throw new IllegalArgumentException("roles must not be null");
        }
        this.roles = roles;
    }

    /**
     * Checks if the caller holds ANY of the given roles.
     */
    public boolean hasAnyRole(Identity caller, Set<Role> required) {
        for (Role role : required) {
            if (roles.has(caller, role)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Requires the caller to hold at least one of the given roles.
     *
     * @throws UnauthorizedException if it holds none of them
     */
    public void requireAnyOf(Identity caller, Set<Role> required) {
        if (!hasAnyRole(caller, required)) {
            log.debug("Denied {}: requires any of {}", caller, required);
            throw new UnauthorizedException(caller, required);
        }
    }

    /** Requires the caller to hold exactly this role. */
    public void requireRole(Identity caller, Role role) {
        requireAnyOf(caller, EnumSet.of(role));
    }

    /**
     * Requires the caller to be the owner of a record.
     *
     * @param caller      the identity performing the operation
     * @param recordOwner the owner stored on the record
     * @throws NotOwnerException if they differ
     */
    public void requireOwner(Identity caller, Identity recordOwner) {
        if (!caller.equals(recordOwner)) {
            log.debug("Denied {}: record is owned by {}", caller, recordOwner);
            throw new NotOwnerException(caller, recordOwner);
        }
    }
}
