package com.supplytrace.ledger.api;

import jakarta.validation.constraints.NotNull;

/** Body of a quality check submission. Missing notes are stored as an empty string. */
public record QualityCheckRequest(@NotNull String checkpointName, boolean passed, String notes) {

    public QualityCheckRequest {
        if (notes == null) {
            notes = "";
        }
    }
}
