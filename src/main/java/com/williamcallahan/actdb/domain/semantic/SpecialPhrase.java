package com.williamcallahan.actdb.domain.semantic;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.reference.StructuralReference;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Legal instruction recognised in the text of a sub-article element.
 *
 * <p>All references carried by amending phrases are absolute (they name the amended act).
 * Enforcement-date positions are relative to the act containing the phrase.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = SpecialPhrase.ArticleTitleAmendment.class, name = "ArticleTitleAmendment"),
    @JsonSubTypes.Type(value = SpecialPhrase.BlockAmendment.class, name = "BlockAmendment"),
    @JsonSubTypes.Type(value = SpecialPhrase.EnforcementDate.class, name = "EnforcementDate"),
    @JsonSubTypes.Type(value = SpecialPhrase.Repeal.class, name = "Repeal"),
    @JsonSubTypes.Type(value = SpecialPhrase.StructuralBlockAmendment.class, name = "StructuralBlockAmendment"),
    @JsonSubTypes.Type(value = SpecialPhrase.StructuralRepeal.class, name = "StructuralRepeal"),
    @JsonSubTypes.Type(value = SpecialPhrase.TextAmendment.class, name = "TextAmendment")
})
public sealed interface SpecialPhrase permits SpecialPhrase.ArticleTitleAmendment, SpecialPhrase.BlockAmendment,
        SpecialPhrase.EnforcementDate, SpecialPhrase.Repeal, SpecialPhrase.StructuralBlockAmendment,
        SpecialPhrase.StructuralRepeal, SpecialPhrase.TextAmendment {

    /**
     * Reports whether the phrase amends another act (as opposed to declaring an enforcement date).
     *
     * @return true for amending phrases
     */
    @JsonIgnore
    default boolean isAmending() {
        return !(this instanceof EnforcementDate);
    }

    /**
     * "In the title of article X, the words 'from' are replaced with 'to'."
     *
     * @param position amended article(s)
     * @param from replaced text
     * @param to replacement text
     */
    record ArticleTitleAmendment(Reference position, String from, String to) implements SpecialPhrase {
        public ArticleTitleAmendment {
            Objects.requireNonNull(position, "Amended position is required");
            Objects.requireNonNull(from, "Replaced text is required");
            Objects.requireNonNull(to, "Replacement text is required");
        }
    }

    /**
     * Introduces quoted sub-article elements replacing or inserting the given position.
     *
     * @param position replaced (or inserted) position
     * @param pureInsertion the position does not exist yet
     */
    record BlockAmendment(Reference position, boolean pureInsertion) implements SpecialPhrase {
        public BlockAmendment {
            Objects.requireNonNull(position, "Amended position is required");
        }
    }

    /**
     * Declares when (parts of) the act containing the phrase take effect.
     *
     * @param positions governed positions; empty for the default date of the act
     * @param structuralPositions governed structural ranges
     * @param date the declared date
     * @param inlineRepeal date the act repeals itself, or null
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record EnforcementDate(
            List<Reference> positions,
            List<StructuralReference> structuralPositions,
            EnforcementDateType date,
            LocalDate inlineRepeal) implements SpecialPhrase {
        public EnforcementDate {
            positions = positions == null ? List.of() : List.copyOf(positions);
            structuralPositions = structuralPositions == null ? List.of() : List.copyOf(structuralPositions);
            Objects.requireNonNull(date, "Enforcement date is required");
        }

        @JsonIgnore
        public boolean isDefault() {
            return positions.isEmpty() && structuralPositions.isEmpty();
        }
    }

    /**
     * Repeals the given positions.
     *
     * @param positions repealed positions
     */
    record Repeal(List<Reference> positions) implements SpecialPhrase {
        public Repeal {
            positions = positions == null ? List.of() : List.copyOf(positions);
            if (positions.isEmpty()) {
                throw new IllegalArgumentException("Repeal needs at least one position");
            }
        }
    }

    /**
     * Introduces quoted act children replacing or inserting the given structural position.
     *
     * @param position replaced (or inserted) structural position
     * @param pureInsertion the position does not exist yet
     */
    record StructuralBlockAmendment(StructuralReference position, boolean pureInsertion) implements SpecialPhrase {
        public StructuralBlockAmendment {
            Objects.requireNonNull(position, "Amended structural position is required");
        }
    }

    /**
     * Repeals a structural range (headers, subtitles and the articles below them).
     *
     * @param position repealed structural position
     */
    record StructuralRepeal(StructuralReference position) implements SpecialPhrase {
        public StructuralRepeal {
            Objects.requireNonNull(position, "Repealed structural position is required");
        }
    }

    /**
     * One or more whole-word text replacements.
     *
     * @param amendments individual replacements in the order they are stated
     */
    record TextAmendment(List<TextAmendmentInstruction> amendments) implements SpecialPhrase {
        public TextAmendment {
            amendments = amendments == null ? List.of() : List.copyOf(amendments);
            if (amendments.isEmpty()) {
                throw new IllegalArgumentException("Text amendment needs at least one replacement");
            }
        }
    }
}
