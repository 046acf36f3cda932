package com.supplytrace.security;

/**
 * Thrown when a caller tries to modify a record owned by another identity.
 */
public class NotOwnerException extends UnauthorizedException {

    private final Identity owner;

    public NotOwnerException(Identity caller, Identity owner) {
        super(caller, "Identity '%s' is not the owner of this record".formatted(caller));
        this.owner = owner;
    }

    public Identity owner() {
        return owner;
    }
}
