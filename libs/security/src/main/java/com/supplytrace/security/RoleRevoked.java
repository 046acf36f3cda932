package com.supplytrace.security;

/**
 * Payload of the {@code RoleRevoked} event.
 *
 * @param role    the revoked role
 * @param account the identity that lost it
 * @param sender  the identity that revoked it (the account itself for a renunciation)
 */
public record RoleRevoked(Role role, Identity account, Identity sender) {}
