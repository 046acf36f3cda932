package com.supplytrace.ledger.api;

import com.supplytrace.security.Identity;

/** Header carrying the authenticated caller, set by the upstream gateway. */
public final class CallerHeaders {

    public static final String CALLER_IDENTITY = "X-Caller-Identity";

    private CallerHeaders() {
        // constants
    }

    static Identity caller(String headerValue) {
        return Identity.of(headerValue);
    }
}
