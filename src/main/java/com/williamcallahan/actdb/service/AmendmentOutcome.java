package com.williamcallahan.actdb.service;

import com.williamcallahan.actdb.domain.identifier.ActIdentifier;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of recalculating one date.
 *
 * @param status status indicator ("success" or "partial-success")
 * @param date recalculated date
 * @param amendedActs acts whose new version was stored
 * @param failures per-act failures
 */
public record AmendmentOutcome(String status, LocalDate date, List<ActIdentifier> amendedActs,
        List<AmendmentFailure> failures) {
    private static final String STATUS_SUCCESS = "success";
    private static final String STATUS_PARTIAL_SUCCESS = "partial-success";

    public AmendmentOutcome {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(date, "Date is required");
        amendedActs = amendedActs == null ? List.of() : List.copyOf(amendedActs);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    /**
     * Creates the outcome of a completed date.
     *
     * @param date recalculated date
     * @param amendedActs acts whose new version was stored
     * @param failures per-act failures
     * @return outcome with a status derived from the failures
     */
    public static AmendmentOutcome success(LocalDate date, List<ActIdentifier> amendedActs,
            List<AmendmentFailure> failures) {
        boolean hasFailures = failures != null && !failures.isEmpty();
        String status = hasFailures ? STATUS_PARTIAL_SUCCESS : STATUS_SUCCESS;
        return new AmendmentOutcome(status, date, amendedActs, failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
