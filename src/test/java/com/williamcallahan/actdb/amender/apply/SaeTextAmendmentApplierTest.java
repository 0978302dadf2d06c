package com.williamcallahan.actdb.amender.apply;

import static com.williamcallahan.actdb.TestActs.AMENDED_ID;
import static com.williamcallahan.actdb.TestActs.AMENDING_IN_FORCE;
import static com.williamcallahan.actdb.TestActs.amendedAct;
import static com.williamcallahan.actdb.TestActs.amendedParagraph;
import static com.williamcallahan.actdb.TestActs.childrenOf;
import static com.williamcallahan.actdb.TestActs.paragraph;
import static com.williamcallahan.actdb.TestActs.textOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.actdb.amender.AmendmentNoEffectException;
import com.williamcallahan.actdb.amender.AmendmentResult;
import com.williamcallahan.actdb.amender.NeedsFullReparse;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.semantic.AmendedPart;
import com.williamcallahan.actdb.domain.semantic.TextAmendmentReference;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.ChangeCause;
import com.williamcallahan.actdb.domain.structure.LastChange;
import com.williamcallahan.actdb.domain.structure.SaeBody;
import com.williamcallahan.actdb.parser.RetainingSemanticInfoProvider;
import org.junit.jupiter.api.Test;

/**
 * Verifies text replacement inside sub-article elements in {@link SaeTextAmendmentApplier}.
 */
class SaeTextAmendmentApplierTest {

    private static final LastChange CHANGE = new LastChange(AMENDING_IN_FORCE,
            new ChangeCause.Amendment(Reference.toArticle("1")));

    private final SaeTextAmendmentApplier applier = new SaeTextAmendmentApplier(new RetainingSemanticInfoProvider());

    private static TextAmendmentReference.Sae target(Reference reference, AmendedPart part) {
        return new TextAmendmentReference.Sae(reference, part);
    }

    @Test
    void apply_replacesTextOfAddressedParagraph() {
        AmendmentResult result = applier.apply(amendedAct(), target(amendedParagraph("1"), AmendedPart.ALL),
                "public roads", "streets", CHANGE);

        assertEquals("This act applies to streets.", textOf(paragraph(result.act(), 0, 0)));
        assertEquals(CHANGE, paragraph(result.act(), 0, 0).lastChange());
        assertNull(paragraph(result.act(), 0, 1).lastChange());
        assertEquals(NeedsFullReparse.NO, result.needsFullReparse());
    }

    @Test
    void apply_failsWhenAppliedTwice() {
        TextAmendmentReference.Sae target = target(amendedParagraph("1"), AmendedPart.ALL);
        Act once = applier.apply(amendedAct(), target, "public roads", "streets", CHANGE).act();

        assertThrows(AmendmentNoEffectException.class,
                () -> applier.apply(once, target, "public roads", "streets", CHANGE));
    }

    @Test
    void apply_introOnlyLeavesNestedPointsAlone() {
        assertThrows(AmendmentNoEffectException.class, () -> applier.apply(amendedAct(),
                target(amendedParagraph("2"), AmendedPart.INTRO_ONLY), "paved", "asphalt", CHANGE));

        AmendmentResult intro = applier.apply(amendedAct(),
                target(amendedParagraph("2"), AmendedPart.INTRO_ONLY), "this act", "this law", CHANGE);
        SaeBody.Children body = (SaeBody.Children) paragraph(intro.act(), 0, 1).body();
        assertEquals("For the purposes of this law", body.intro());
    }

    @Test
    void apply_allPartsReachesNestedPoints() {
        AmendmentResult result = applier.apply(amendedAct(), target(amendedParagraph("2"), AmendedPart.ALL),
                "paved", "asphalt", CHANGE);

        assertEquals("road: a asphalt surface,", textOf(childrenOf(paragraph(result.act(), 0, 1)).get(0)));
    }

    @Test
    void apply_wholeActAmendmentRequestsFullReparse() {
        AmendmentResult result = applier.apply(amendedAct(), target(Reference.toAct(AMENDED_ID), AmendedPart.ALL),
                "vehicle", "motor vehicle", CHANGE);

        assertEquals("motor vehicle: anything with wheels.",
                textOf(childrenOf(paragraph(result.act(), 0, 1)).get(1)));
        assertEquals("Bicycles are vehicles.", textOf(paragraph(result.act(), 1, 0)));
        assertEquals(NeedsFullReparse.YES, result.needsFullReparse());
    }
}
