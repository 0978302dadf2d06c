package com.williamcallahan.actdb.domain.structure;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Top-level child of an act: a structural header, a subtitle or an article.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = StructuralElement.class, name = "StructuralElement"),
    @JsonSubTypes.Type(value = Subtitle.class, name = "Subtitle"),
    @JsonSubTypes.Type(value = Article.class, name = "Article")
})
public sealed interface ActChild permits StructuralElement, Subtitle, Article {

    /**
     * Returns the last modification stamp of this child, or null if it was never amended.
     *
     * @return last change
     */
    LastChange lastChange();

    /**
     * Returns a copy carrying the given modification stamp.
     *
     * @param change new stamp
     * @return stamped copy
     */
    ActChild withLastChange(LastChange change);
}
