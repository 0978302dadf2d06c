package com.williamcallahan.actdb.amender.apply;

import static com.williamcallahan.actdb.TestActs.AMENDED_ID;
import static com.williamcallahan.actdb.TestActs.AMENDING_IN_FORCE;
import static com.williamcallahan.actdb.TestActs.amendedAct;
import static com.williamcallahan.actdb.TestActs.article;
import static com.williamcallahan.actdb.TestActs.child;
import static com.williamcallahan.actdb.TestActs.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.actdb.amender.AmendmentResult;
import com.williamcallahan.actdb.amender.NeedsFullReparse;
import com.williamcallahan.actdb.domain.identifier.Identifier;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.reference.StructuralReference;
import com.williamcallahan.actdb.domain.reference.StructuralReferenceElement;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.Article;
import com.williamcallahan.actdb.domain.structure.ChangeCause;
import com.williamcallahan.actdb.domain.structure.LastChange;
import com.williamcallahan.actdb.domain.structure.SaeKind;
import com.williamcallahan.actdb.domain.structure.StructuralElement;
import com.williamcallahan.actdb.parser.RetainingSemanticInfoProvider;
import com.williamcallahan.actdb.structure.ReferenceResolutionException;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies replacement, insertion and repeal of whole structural blocks in
 * {@link StructuralBlockAmendmentApplier}.
 */
class StructuralBlockAmendmentApplierTest {

    private static final LastChange CHANGE = new LastChange(AMENDING_IN_FORCE,
            new ChangeCause.Amendment(Reference.toArticle("1")));

    private final StructuralBlockAmendmentApplier applier =
            new StructuralBlockAmendmentApplier(new RetainingSemanticInfoProvider());

    private static StructuralReference reference(StructuralReferenceElement element) {
        return StructuralReference.of(AMENDED_ID, element);
    }

    @Test
    void apply_replacesSingleArticle() {
        Article replacement = article("2", "Bicycles", text(SaeKind.PARAGRAPH, null, "Bicycles are not vehicles."));

        AmendmentResult result = applier.apply(amendedAct(), reference(StructuralReferenceElement.article("2")),
                false, List.of(replacement), CHANGE);

        assertEquals(replacement.withLastChange(CHANGE), child(result.act(), 3));
        assertEquals(6, result.act().children().size());
        assertEquals(NeedsFullReparse.NO, result.needsFullReparse());
    }

    @Test
    void apply_insertsNewArticleAfterItsPredecessor() {
        Article inserted = article("2a", null, text(SaeKind.PARAGRAPH, null, "Trailers are vehicles."));

        Act result = applier.apply(amendedAct(), reference(StructuralReferenceElement.article("2a")), true,
                List.of(inserted), CHANGE).act();

        assertEquals(7, result.children().size());
        assertEquals(Identifier.of("2a"), ((Article) child(result, 4)).identifier());
        assertInstanceOf(StructuralElement.class, child(result, 5));
    }

    @Test
    void repeal_keepsEmptyArticleShells() {
        AmendmentResult result = applier.repeal(amendedAct(), reference(StructuralReferenceElement.part("2")),
                CHANGE);

        Act act = result.act();
        assertEquals(5, act.children().size());
        Article shell = (Article) child(act, 4);
        assertEquals(Identifier.of("3"), shell.identifier());
        assertTrue(shell.paragraphs().isEmpty());
        assertEquals(CHANGE, shell.lastChange());
        assertEquals(NeedsFullReparse.YES, result.needsFullReparse());
    }

    @Test
    void apply_propagatesResolutionFailures() {
        assertThrows(ReferenceResolutionException.class, () -> applier.apply(amendedAct(),
                reference(StructuralReferenceElement.chapter("9")), false, List.of(), CHANGE));
    }
}
