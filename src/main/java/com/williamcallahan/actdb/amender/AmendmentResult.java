package com.williamcallahan.actdb.amender;

import com.williamcallahan.actdb.domain.structure.Act;

import java.util.Objects;

/**
 * Act produced by applying one modification.
 *
 * @param act the amended act
 * @param needsFullReparse whether semantic info must be recomputed for the whole act
 */
public record AmendmentResult(Act act, NeedsFullReparse needsFullReparse) {

    public AmendmentResult {
        Objects.requireNonNull(act, "Amended act is required");
        Objects.requireNonNull(needsFullReparse, "Reparse flag is required");
    }
}
