package com.supplytrace.ledger.api;

import java.util.List;

public record IdentityRolesResponse(String identity, List<String> roles) {}
