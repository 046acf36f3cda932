package com.supplytrace.ledger.api;

public record ProductRegisteredResponse(long productId) {}
