package com.supplytrace.ledger.api;

public record RoleMembershipResponse(String role, String identity, boolean granted) {}
