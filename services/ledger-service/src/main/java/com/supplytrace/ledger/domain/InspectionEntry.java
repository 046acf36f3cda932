package com.supplytrace.ledger.domain;

import com.supplytrace.security.Identity;
import java.time.Instant;

/**
 * One quality check recorded against a product.
 *
 * @param inspector      identity that performed the check
 * @param timestamp      ledger time the check was recorded
 * @param checkpointName where or what was checked
 * @param passed         outcome of the check
 * @param notes          free-form remarks
 */
public record InspectionEntry(
        Identity inspector, Instant timestamp, String checkpointName, boolean passed, String notes) {

    public InspectionEntry {
        if (inspector == null || timestamp == null) {
            throw new IllegalArgumentException("inspector and timestamp must not be null");
        }
        if (checkpointName == null || notes == null) {
            throw new IllegalArgumentException("checkpointName and notes must not be null");
        }
    }
}
