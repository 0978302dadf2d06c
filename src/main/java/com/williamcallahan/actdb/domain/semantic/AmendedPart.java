package com.williamcallahan.actdb.domain.semantic;

/**
 * Which text of a sub-article element a text amendment edits.
 */
public enum AmendedPart {
    /** Leaf text, intro and wrap-up of every contained element. */
    ALL,
    /** Only the intro of exactly the referenced element. */
    INTRO_ONLY,
    /** Only the wrap-up of exactly the referenced element. */
    WRAP_UP_ONLY
}
