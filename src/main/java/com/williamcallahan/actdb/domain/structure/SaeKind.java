package com.williamcallahan.actdb.domain.structure;

import com.williamcallahan.actdb.domain.reference.ReferenceLevel;

import java.util.Set;

/**
 * Levels of the sub-article element hierarchy. Each kind fixes the reference level it is
 * addressed at and the kinds it may directly contain; subpoints contain nothing.
 */
public enum SaeKind {
    PARAGRAPH(ReferenceLevel.PARAGRAPH),
    ALPHABETIC_POINT(ReferenceLevel.POINT),
    NUMERIC_POINT(ReferenceLevel.POINT),
    ALPHABETIC_SUBPOINT(ReferenceLevel.SUBPOINT),
    NUMERIC_SUBPOINT(ReferenceLevel.SUBPOINT);

    private final ReferenceLevel level;

    SaeKind(ReferenceLevel level) {
        this.level = level;
    }

    public ReferenceLevel level() {
        return level;
    }

    public Set<SaeKind> allowedChildren() {
        return switch (this) {
            case PARAGRAPH -> Set.of(ALPHABETIC_POINT, NUMERIC_POINT);
            case ALPHABETIC_POINT -> Set.of(ALPHABETIC_SUBPOINT, NUMERIC_SUBPOINT);
            case NUMERIC_POINT -> Set.of(ALPHABETIC_SUBPOINT);
            case ALPHABETIC_SUBPOINT, NUMERIC_SUBPOINT -> Set.of();
        };
    }
}
