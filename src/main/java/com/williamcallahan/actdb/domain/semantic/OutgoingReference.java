package com.williamcallahan.actdb.domain.semantic;

import com.williamcallahan.actdb.domain.reference.Reference;

import java.util.Objects;

/**
 * Cross-reference span inside an element's text. Only consumers such as renderers read these.
 *
 * @param start start offset in the text
 * @param end end offset in the text, exclusive
 * @param reference referenced position
 */
public record OutgoingReference(int start, int end, Reference reference) {

    public OutgoingReference {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid reference span: " + start + "-" + end);
        }
        Objects.requireNonNull(reference, "Referenced position is required");
    }
}
