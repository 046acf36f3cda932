package com.supplytrace.security;

/**
 * Payload of the {@code RoleGranted} event.
 *
 * @param role    the granted role
 * @param account the identity that received it
 * @param sender  the identity that granted it
 */
public record RoleGranted(Role role, Identity account, Identity sender) {}
