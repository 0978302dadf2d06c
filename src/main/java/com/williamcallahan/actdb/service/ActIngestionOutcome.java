package com.williamcallahan.actdb.service;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of adding act files to the database.
 *
 * @param status status indicator ("success" or "partial-success")
 * @param processed number of acts stored
 * @param failures per-file failures
 */
public record ActIngestionOutcome(String status, int processed, List<ActIngestionFailure> failures) {
    private static final String STATUS_SUCCESS = "success";
    private static final String STATUS_PARTIAL_SUCCESS = "partial-success";

    public ActIngestionOutcome {
        Objects.requireNonNull(status, "Status is required");
        if (processed < 0) {
            throw new IllegalArgumentException("Processed count must be non-negative");
        }
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static ActIngestionOutcome success(int processed, List<ActIngestionFailure> failures) {
        boolean hasFailures = failures != null && !failures.isEmpty();
        String status = hasFailures ? STATUS_PARTIAL_SUCCESS : STATUS_SUCCESS;
        return new ActIngestionOutcome(status, processed, failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
