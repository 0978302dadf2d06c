package com.williamcallahan.actdb.amender;

import static com.williamcallahan.actdb.TestActs.AMENDED_ID;
import static com.williamcallahan.actdb.TestActs.amendedParagraph;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.reference.StructuralReference;
import com.williamcallahan.actdb.domain.reference.StructuralReferenceElement;
import com.williamcallahan.actdb.domain.semantic.AmendedPart;
import com.williamcallahan.actdb.domain.semantic.TextAmendmentReference;
import com.williamcallahan.actdb.domain.structure.ChangeCause;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies the reordering rules of {@link AmendmentOrderFixer}.
 */
class AmendmentOrderFixerTest {

    private static AppliableModification text(Reference position, String from, String to) {
        return appliable(new Modification.TextAmendment(
                new TextAmendmentReference.Sae(position, AmendedPart.ALL), from, to));
    }

    private static AppliableModification appliable(Modification modification) {
        return new AppliableModification(new ChangeCause.Amendment(Reference.toArticle("1")), modification);
    }

    @Test
    void fixOrder_movesReplacementOfIntroducedTextFirst() {
        AppliableModification introducesC = text(amendedParagraph("1"), "a", "b c d");
        AppliableModification replacesC = text(amendedParagraph("1"), "c", "x");
        List<AppliableModification> modifications = new ArrayList<>(List.of(introducesC, replacesC));

        AmendmentOrderFixer.fixOrder(modifications);
        assertEquals(List.of(replacesC, introducesC), modifications);

        AmendmentOrderFixer.fixOrder(modifications);
        assertEquals(List.of(replacesC, introducesC), modifications, "Fixed order should be stable");
    }

    @Test
    void fixOrder_movesLongerNeedleFirst() {
        AppliableModification shortNeedle = text(amendedParagraph("1"), "road", "street");
        AppliableModification longNeedle = text(amendedParagraph("1"), "public road", "avenue");
        List<AppliableModification> modifications = new ArrayList<>(List.of(shortNeedle, longNeedle));

        AmendmentOrderFixer.fixOrder(modifications);

        assertEquals(List.of(longNeedle, shortNeedle), modifications);
    }

    @Test
    void isOrderWrong_ignoresDisjointPositions() {
        Modification first = text(amendedParagraph("1"), "road", "street").modification();
        Modification second = text(amendedParagraph("2"), "public road", "avenue").modification();

        assertFalse(AmendmentOrderFixer.isOrderWrong(first, second));
    }

    @Test
    void isOrderWrong_appliesInnerBlockAmendmentsFirst() {
        Reference point = amendedParagraph("2").withPoint("a");
        Modification inner = new Modification.BlockAmendment(point, false, List.of());
        Modification outer = new Modification.BlockAmendment(amendedParagraph("2"), false, List.of());
        Modification wholeArticle = new Modification.StructuralBlockAmendment(
                StructuralReference.of(AMENDED_ID, StructuralReferenceElement.article("1")), false, List.of());

        assertTrue(AmendmentOrderFixer.isOrderWrong(inner, outer));
        assertFalse(AmendmentOrderFixer.isOrderWrong(outer, inner));
        assertTrue(AmendmentOrderFixer.isOrderWrong(inner, wholeArticle));
    }

    @Test
    void fixOrder_keepsBlockAmendmentBeforeStructuralRepeal() {
        AppliableModification point = appliable(
                new Modification.BlockAmendment(amendedParagraph("2").withPoint("a"), false, List.of()));
        AppliableModification repeal = appliable(new Modification.StructuralRepeal(
                StructuralReference.of(AMENDED_ID, StructuralReferenceElement.article("1"))));
        List<AppliableModification> modifications = new ArrayList<>(List.of(point, repeal));

        AmendmentOrderFixer.fixOrder(modifications);

        assertEquals(List.of(point, repeal), modifications);
        assertFalse(AmendmentOrderFixer.isOrderWrong(point.modification(), repeal.modification()));
    }
}
