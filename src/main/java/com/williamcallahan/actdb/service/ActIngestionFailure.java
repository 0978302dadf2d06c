package com.williamcallahan.actdb.service;

import java.util.Objects;

/**
 * Captures a single act file that could not be added, with the phase that failed.
 *
 * @param filePath path of the act file
 * @param phase ingestion phase that failed ("read" or "store")
 * @param details failure details for diagnostics
 */
public record ActIngestionFailure(String filePath, String phase, String details) {

    public ActIngestionFailure {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("File path is required");
        }
        if (phase == null || phase.isBlank()) {
            throw new IllegalArgumentException("Failure phase is required");
        }
        Objects.requireNonNull(details, "Failure details are required");
    }
}
