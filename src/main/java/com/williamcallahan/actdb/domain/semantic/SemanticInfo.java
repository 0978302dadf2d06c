package com.williamcallahan.actdb.domain.semantic;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Parser-computed annotations of a sub-article element.
 *
 * @param specialPhrase amendment or enforcement-date instruction carried by the element, or null
 * @param outgoingReferences cross-reference spans inside the element's text
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SemanticInfo(SpecialPhrase specialPhrase, List<OutgoingReference> outgoingReferences) {

    private static final SemanticInfo EMPTY = new SemanticInfo(null, List.of());

    public SemanticInfo {
        outgoingReferences = outgoingReferences == null ? List.of() : List.copyOf(outgoingReferences);
    }

    public static SemanticInfo empty() {
        return EMPTY;
    }

    public static SemanticInfo of(SpecialPhrase specialPhrase) {
        return new SemanticInfo(specialPhrase, List.of());
    }
}
