package com.williamcallahan.actdb.domain.structure;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Nested content of a container body.
 *
 * <p>{@link Elements} holds regular children of one kind. The two block-amendment variants hold
 * quoted text that is not part of the act itself but is spliced into another act when the
 * amendment takes effect.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = SaeContent.Elements.class, name = "Elements"),
    @JsonSubTypes.Type(value = SaeContent.BlockAmendmentContent.class, name = "BlockAmendment"),
    @JsonSubTypes.Type(value = SaeContent.StructuralBlockAmendmentContent.class, name = "StructuralBlockAmendment")
})
public sealed interface SaeContent
        permits SaeContent.Elements, SaeContent.BlockAmendmentContent, SaeContent.StructuralBlockAmendmentContent {

    /**
     * Regular children, all of the same kind.
     *
     * @param children child elements
     */
    record Elements(List<SubArticleElement> children) implements SaeContent {
        public Elements {
            children = children == null ? List.of() : List.copyOf(children);
            requireSingleKind(children);
        }
    }

    /**
     * Quoted sub-article elements of a block amendment.
     *
     * @param children quoted elements, all of the same kind
     */
    record BlockAmendmentContent(List<SubArticleElement> children) implements SaeContent {
        public BlockAmendmentContent {
            children = children == null ? List.of() : List.copyOf(children);
            requireSingleKind(children);
        }
    }

    /**
     * Quoted top-level act children of a structural block amendment.
     *
     * @param children quoted headers, subtitles and articles
     */
    record StructuralBlockAmendmentContent(List<ActChild> children) implements SaeContent {
        public StructuralBlockAmendmentContent {
            children = children == null ? List.of() : List.copyOf(children);
        }
    }

    private static void requireSingleKind(List<SubArticleElement> children) {
        if (children.stream().map(SubArticleElement::kind).distinct().count() > 1) {
            throw new IllegalArgumentException("Nested elements must all be of the same kind");
        }
    }
}
