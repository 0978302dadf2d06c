package com.williamcallahan.actdb.domain.structure;

/**
 * Structural header kinds, declared from the highest nesting level to the lowest.
 * The declaration order is the comparison order used when resolving cut points.
 */
public enum StructuralElementType {
    BOOK,
    PART,
    TITLE,
    CHAPTER
}
