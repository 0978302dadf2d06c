package com.williamcallahan.actdb.amender;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.williamcallahan.actdb.domain.identifier.ActIdentifier;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.reference.StructuralReference;
import com.williamcallahan.actdb.domain.semantic.TextAmendmentInstruction;
import com.williamcallahan.actdb.domain.semantic.TextAmendmentReference;
import com.williamcallahan.actdb.domain.structure.ActChild;
import com.williamcallahan.actdb.domain.structure.SubArticleElement;

import java.util.List;
import java.util.Objects;

/**
 * Change to be applied to an act. Every variant names the act it modifies.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = Modification.ArticleTitleAmendment.class, name = "ArticleTitleAmendment"),
    @JsonSubTypes.Type(value = Modification.Repeal.class, name = "Repeal"),
    @JsonSubTypes.Type(value = Modification.TextAmendment.class, name = "TextAmendment"),
    @JsonSubTypes.Type(value = Modification.BlockAmendment.class, name = "BlockAmendment"),
    @JsonSubTypes.Type(value = Modification.StructuralBlockAmendment.class, name = "StructuralBlockAmendment"),
    @JsonSubTypes.Type(value = Modification.StructuralRepeal.class, name = "StructuralRepeal")
})
public sealed interface Modification permits Modification.ArticleTitleAmendment, Modification.Repeal,
        Modification.TextAmendment, Modification.BlockAmendment, Modification.StructuralBlockAmendment,
        Modification.StructuralRepeal {

    /**
     * Returns the act this modification changes.
     *
     * @return affected act
     * @throws ModificationExtractionException if the modification carries no act
     */
    ActIdentifier affectedAct();

    private static ActIdentifier requireAct(ActIdentifier act, String kind) {
        if (act == null) {
            throw new ModificationExtractionException("No act in reference of " + kind);
        }
        return act;
    }

    /**
     * Whole-word replacement in article titles.
     *
     * @param position amended article(s)
     * @param from replaced text
     * @param to replacement text
     */
    record ArticleTitleAmendment(Reference position, String from, String to) implements Modification {
        public ArticleTitleAmendment {
            Objects.requireNonNull(position, "Amended position is required");
            Objects.requireNonNull(from, "Replaced text is required");
            Objects.requireNonNull(to, "Replacement text is required");
        }

        @Override
        public ActIdentifier affectedAct() {
            return requireAct(position.act(), "ArticleTitleAmendment");
        }
    }

    /**
     * Empties every sub-article element contained by any of the positions.
     *
     * @param positions repealed positions, all in the same act
     */
    record Repeal(List<Reference> positions) implements Modification {
        public Repeal {
            positions = positions == null ? List.of() : List.copyOf(positions);
            if (positions.isEmpty()) {
                throw new IllegalArgumentException("Repeal needs at least one position");
            }
        }

        public static Repeal of(Reference position) {
            return new Repeal(List.of(position));
        }

        @Override
        public ActIdentifier affectedAct() {
            ActIdentifier act = requireAct(positions.get(0).act(), "Repeal");
            for (Reference position : positions) {
                if (!act.equals(position.act())) {
                    throw new ModificationExtractionException("Repeal positions span multiple acts: " + positions);
                }
            }
            return act;
        }
    }

    /**
     * Whole-word replacement in element text, a structural title or article titles.
     *
     * @param reference target of the replacement
     * @param from replaced text
     * @param to replacement text
     */
    record TextAmendment(TextAmendmentReference reference, String from, String to) implements Modification {
        public TextAmendment {
            Objects.requireNonNull(reference, "Text amendment target is required");
            Objects.requireNonNull(from, "Replaced text is required");
            Objects.requireNonNull(to, "Replacement text is required");
        }

        public static TextAmendment of(TextAmendmentInstruction instruction) {
            return new TextAmendment(instruction.reference(), instruction.from(), instruction.to());
        }

        @Override
        public ActIdentifier affectedAct() {
            return requireAct(reference.act(), "TextAmendment");
        }
    }

    /**
     * Replaces (or inserts) sub-article elements.
     *
     * @param position replaced position; its last part is the replaced id range
     * @param pureInsertion the position must not exist yet
     * @param content replacement elements, all of one kind
     */
    record BlockAmendment(Reference position, boolean pureInsertion, List<SubArticleElement> content)
            implements Modification {
        public BlockAmendment {
            Objects.requireNonNull(position, "Amended position is required");
            content = content == null ? List.of() : List.copyOf(content);
        }

        @Override
        public ActIdentifier affectedAct() {
            return requireAct(position.act(), "BlockAmendment");
        }
    }

    /**
     * Replaces (or inserts) top-level act children.
     *
     * @param position replaced structural position
     * @param pureInsertion find an insertion point instead of an existing range
     * @param content replacement children
     */
    record StructuralBlockAmendment(StructuralReference position, boolean pureInsertion, List<ActChild> content)
            implements Modification {
        public StructuralBlockAmendment {
            Objects.requireNonNull(position, "Amended structural position is required");
            content = content == null ? List.of() : List.copyOf(content);
        }

        @Override
        public ActIdentifier affectedAct() {
            return requireAct(position.act(), "StructuralBlockAmendment");
        }
    }

    /**
     * Removes a structural range. Headers and subtitles disappear; articles stay as empty shells so
     * their identifiers remain addressable.
     *
     * @param position repealed structural position
     */
    record StructuralRepeal(StructuralReference position) implements Modification {
        public StructuralRepeal {
            Objects.requireNonNull(position, "Repealed structural position is required");
        }

        @Override
        public ActIdentifier affectedAct() {
            return requireAct(position.act(), "StructuralRepeal");
        }
    }
}
