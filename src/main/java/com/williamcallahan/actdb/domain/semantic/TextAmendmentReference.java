package com.williamcallahan.actdb.domain.semantic;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.williamcallahan.actdb.domain.identifier.ActIdentifier;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.reference.StructuralReference;

import java.util.Objects;

/**
 * Target of a text amendment.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = TextAmendmentReference.Sae.class, name = "SAE"),
    @JsonSubTypes.Type(value = TextAmendmentReference.StructuralTitle.class, name = "Structural"),
    @JsonSubTypes.Type(value = TextAmendmentReference.ArticleTitle.class, name = "ArticleTitle")
})
public sealed interface TextAmendmentReference permits TextAmendmentReference.Sae,
        TextAmendmentReference.StructuralTitle, TextAmendmentReference.ArticleTitle {

    /**
     * Act the amendment applies to, or null if the reference is relative.
     *
     * @return amended act
     */
    ActIdentifier act();

    /**
     * Text of paragraphs, points and subpoints.
     *
     * @param reference amended position(s)
     * @param amendedPart which part of the text is edited
     */
    record Sae(Reference reference, AmendedPart amendedPart) implements TextAmendmentReference {
        public Sae {
            Objects.requireNonNull(reference, "Amended reference is required");
            amendedPart = amendedPart == null ? AmendedPart.ALL : amendedPart;
        }

        @Override
        public ActIdentifier act() {
            return reference.act();
        }
    }

    /**
     * Title of a structural header or subtitle.
     *
     * @param reference amended header
     */
    record StructuralTitle(StructuralReference reference) implements TextAmendmentReference {
        public StructuralTitle {
            Objects.requireNonNull(reference, "Amended structural reference is required");
        }

        @Override
        public ActIdentifier act() {
            return reference.act();
        }
    }

    /**
     * Title of one or more articles.
     *
     * @param reference amended article(s)
     */
    record ArticleTitle(Reference reference) implements TextAmendmentReference {
        public ArticleTitle {
            Objects.requireNonNull(reference, "Amended reference is required");
        }

        @Override
        public ActIdentifier act() {
            return reference.act();
        }
    }
}
