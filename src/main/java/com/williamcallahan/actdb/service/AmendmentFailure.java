package com.williamcallahan.actdb.service;

import com.williamcallahan.actdb.domain.identifier.ActIdentifier;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Captures a single act that could not be processed on a date, with the stage it had reached.
 *
 * @param act the act being extracted from or amended
 * @param date recalculated date
 * @param stage last stage the act completed before the failure
 * @param details failure details for diagnostics
 */
public record AmendmentFailure(ActIdentifier act, LocalDate date, AmendmentStage stage, String details) {

    public AmendmentFailure {
        Objects.requireNonNull(act, "Act is required");
        Objects.requireNonNull(date, "Date is required");
        Objects.requireNonNull(stage, "Failure stage is required");
        Objects.requireNonNull(details, "Failure details are required");
    }

    static AmendmentFailure of(ActIdentifier act, LocalDate date, AmendmentStage stage, Exception e) {
        return new AmendmentFailure(act, date, stage, e.getClass().getSimpleName() + ": " + e.getMessage());
    }
}
