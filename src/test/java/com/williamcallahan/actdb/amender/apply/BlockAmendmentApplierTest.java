package com.williamcallahan.actdb.amender.apply;

import static com.williamcallahan.actdb.TestActs.AMENDED_ID;
import static com.williamcallahan.actdb.TestActs.AMENDING_IN_FORCE;
import static com.williamcallahan.actdb.TestActs.amendedAct;
import static com.williamcallahan.actdb.TestActs.amendedParagraph;
import static com.williamcallahan.actdb.TestActs.article;
import static com.williamcallahan.actdb.TestActs.childrenOf;
import static com.williamcallahan.actdb.TestActs.container;
import static com.williamcallahan.actdb.TestActs.paragraph;
import static com.williamcallahan.actdb.TestActs.text;
import static com.williamcallahan.actdb.TestActs.textOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.actdb.amender.AmendmentApplicationException;
import com.williamcallahan.actdb.amender.AmendmentResult;
import com.williamcallahan.actdb.amender.NeedsFullReparse;
import com.williamcallahan.actdb.domain.identifier.Identifier;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.ChangeCause;
import com.williamcallahan.actdb.domain.structure.LastChange;
import com.williamcallahan.actdb.domain.structure.SaeKind;
import com.williamcallahan.actdb.domain.structure.SubArticleElement;
import com.williamcallahan.actdb.parser.RetainingSemanticInfoProvider;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies splicing of quoted sub-article elements in {@link BlockAmendmentApplier}.
 */
class BlockAmendmentApplierTest {

    private static final LastChange CHANGE = new LastChange(AMENDING_IN_FORCE,
            new ChangeCause.Amendment(Reference.toArticle("1")));

    private final BlockAmendmentApplier applier = new BlockAmendmentApplier(new RetainingSemanticInfoProvider());

    private static SubArticleElement point(String id, String text) {
        return text(SaeKind.ALPHABETIC_POINT, id, text);
    }

    @Test
    void apply_replacesExistingPoint() {
        AmendmentResult result = applier.apply(amendedAct(), amendedParagraph("2").withPoint("b"), false,
                List.of(point("b", "vehicle: anything with an engine.")), CHANGE);

        List<SubArticleElement> points = childrenOf(paragraph(result.act(), 0, 1));
        assertEquals(2, points.size());
        assertEquals("road: a paved surface,", textOf(points.get(0)));
        assertNull(points.get(0).lastChange());
        assertEquals("vehicle: anything with an engine.", textOf(points.get(1)));
        assertEquals(CHANGE, points.get(1).lastChange());
        assertEquals(NeedsFullReparse.NO, result.needsFullReparse());
    }

    @Test
    void apply_insertsPointAndFixesPrecedingPunctuation() {
        Act result = applier.apply(amendedAct(), amendedParagraph("2").withPoint("c"), true,
                List.of(point("c", "trailer: anything towed.")), CHANGE).act();

        List<SubArticleElement> points = childrenOf(paragraph(result, 0, 1));
        assertEquals(List.of(Identifier.of("a"), Identifier.of("b"), Identifier.of("c")),
                points.stream().map(SubArticleElement::identifier).toList());
        assertEquals("vehicle: anything with wheels,", textOf(points.get(1)));
        assertEquals("trailer: anything towed.", textOf(points.get(2)));
    }

    @Test
    void apply_keepsConjunctionEndings() {
        Act act = amendedAct().withChildren(List.of(article("1", null,
                container(SaeKind.PARAGRAPH, "1", "Vehicles are",
                        point("a", "cars,"),
                        point("b", "trucks, valamint")))));
        Act result = applier.apply(act, Reference.toAct(AMENDED_ID).withArticle("1").withParagraph("1")
                .withPoint("c"), true, List.of(point("c", "buses.")), CHANGE).act();

        assertEquals("trucks, valamint", textOf(childrenOf(paragraph(result, 0, 0)).get(1)));
    }

    @Test
    void apply_insertsParagraphInOrder() {
        Act result = applier.apply(amendedAct(), amendedParagraph("3"), true,
                List.of(text(SaeKind.PARAGRAPH, "3", "New paragraph.")), CHANGE).act();

        List<SubArticleElement> paragraphs = result.articles().get(0).paragraphs();
        assertEquals(3, paragraphs.size());
        assertEquals("New paragraph.", textOf(paragraphs.get(2)));
        assertEquals("This act applies to public roads.", textOf(paragraphs.get(0)));
    }

    @Test
    void apply_rejectsInsertionOfExistingElement() {
        assertThrows(AmendmentApplicationException.class, () -> applier.apply(amendedAct(),
                amendedParagraph("2").withPoint("b"), true, List.of(point("b", "duplicate.")), CHANGE));
    }

    @Test
    void apply_rejectsMismatchedContent() {
        assertThrows(AmendmentApplicationException.class, () -> applier.apply(amendedAct(),
                amendedParagraph("2").withPoint("b"), false, List.of(text(SaeKind.PARAGRAPH, "2", "x")), CHANGE));
        assertThrows(AmendmentApplicationException.class, () -> applier.apply(amendedAct(),
                amendedParagraph("2").withPoint("b"), false, List.of(), CHANGE));
        assertThrows(AmendmentApplicationException.class, () -> applier.apply(amendedAct(),
                amendedParagraph("1").withPoint("a"), true, List.of(point("a", "no points here.")), CHANGE));
    }

    @Test
    void apply_rejectsOutOfOrderResult() {
        assertThrows(AmendmentApplicationException.class, () -> applier.apply(amendedAct(),
                amendedParagraph("2").withPointRange("a", "b"), false,
                List.of(point("b", "second,"), point("a", "first.")), CHANGE));
    }

    @Test
    void apply_failsForMissingArticle() {
        assertThrows(AmendmentApplicationException.class, () -> applier.apply(amendedAct(),
                Reference.toAct(AMENDED_ID).withArticle("9").withParagraph("1"), true,
                List.of(text(SaeKind.PARAGRAPH, "1", "x")), CHANGE));
    }
}
