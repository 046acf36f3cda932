package com.supplytrace.ledger.api;

import com.supplytrace.ledger.domain.InspectionEntry;
import java.time.Instant;

/** JSON view of an {@link InspectionEntry}. */
public record InspectionEntryResponse(
        String inspector, Instant timestamp, String checkpointName, boolean passed, String notes) {

    static InspectionEntryResponse from(InspectionEntry entry) {
        return new InspectionEntryResponse(
                entry.inspector().value(),
                entry.timestamp(),
                entry.checkpointName(),
                entry.passed(),
                entry.notes());
    }
}
