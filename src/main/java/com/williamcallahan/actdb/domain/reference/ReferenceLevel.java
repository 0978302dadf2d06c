package com.williamcallahan.actdb.domain.reference;

/**
 * Levels of a {@link Reference}, from the outermost to the innermost.
 */
public enum ReferenceLevel {
    ACT,
    ARTICLE,
    PARAGRAPH,
    POINT,
    SUBPOINT
}
