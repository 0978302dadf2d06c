package com.williamcallahan.actdb.domain.semantic;

import java.util.Objects;

/**
 * Single "replace 'from' with 'to' in target" instruction.
 *
 * @param reference target of the replacement
 * @param from replaced text
 * @param to replacement text
 */
public record TextAmendmentInstruction(TextAmendmentReference reference, String from, String to) {

    public TextAmendmentInstruction {
        Objects.requireNonNull(reference, "Text amendment target is required");
        Objects.requireNonNull(from, "Replaced text is required");
        Objects.requireNonNull(to, "Replacement text is required");
    }
}
