package com.williamcallahan.actdb.amender.apply;

import static com.williamcallahan.actdb.TestActs.AMENDED_ID;
import static com.williamcallahan.actdb.TestActs.AMENDING_ID;
import static com.williamcallahan.actdb.TestActs.AMENDING_IN_FORCE;
import static com.williamcallahan.actdb.TestActs.amendedAct;
import static com.williamcallahan.actdb.TestActs.amendedParagraph;
import static com.williamcallahan.actdb.TestActs.child;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.actdb.amender.AmendmentApplicationException;
import com.williamcallahan.actdb.amender.AppliableModification;
import com.williamcallahan.actdb.amender.Modification;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.reference.StructuralReference;
import com.williamcallahan.actdb.domain.reference.StructuralReferenceElement;
import com.williamcallahan.actdb.domain.semantic.TextAmendmentReference;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.Article;
import com.williamcallahan.actdb.domain.structure.ChangeCause;
import com.williamcallahan.actdb.domain.structure.LastChange;
import com.williamcallahan.actdb.parser.RetainingSemanticInfoProvider;
import com.williamcallahan.actdb.parser.SemanticInfoProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies dispatch of each modification kind in {@link ModificationApplier}.
 */
class ModificationApplierTest {

    private static final ChangeCause CAUSE =
            new ChangeCause.Amendment(Reference.toAct(AMENDING_ID).withArticle("1").withParagraph("1"));

    private ModificationApplier applier;

    @BeforeEach
    void setUp() {
        SemanticInfoProvider provider = new RetainingSemanticInfoProvider();
        applier = new ModificationApplier(new ArticleTitleAmendmentApplier(), new SaeTextAmendmentApplier(provider),
                new StructuralTitleAmendmentApplier(), new RepealApplier(), new BlockAmendmentApplier(provider),
                new StructuralBlockAmendmentApplier(provider));
    }

    @Test
    void apply_stampsChangeWithDateAndCause() {
        Act result = applier.apply(amendedAct(), new AppliableModification(CAUSE,
                Modification.Repeal.of(amendedParagraph("1"))), AMENDING_IN_FORCE).act();

        assertEquals(new LastChange(AMENDING_IN_FORCE, CAUSE),
                result.articles().get(0).paragraphs().get(0).lastChange());
    }

    @Test
    void apply_routesArticleTitleTextAmendments() {
        Modification titleText = new Modification.TextAmendment(
                new TextAmendmentReference.ArticleTitle(Reference.toAct(AMENDED_ID).withArticle("1")),
                "Scope", "Application");

        Act result = applier.apply(amendedAct(), new AppliableModification(CAUSE, titleText), AMENDING_IN_FORCE)
                .act();

        assertEquals("Application", result.articles().get(0).title());
    }

    @Test
    void apply_routesStructuralRepeals() {
        Modification repeal = new Modification.StructuralRepeal(
                StructuralReference.of(AMENDED_ID, StructuralReferenceElement.article("2")));

        Act result = applier.apply(amendedAct(), new AppliableModification(CAUSE, repeal), AMENDING_IN_FORCE).act();

        assertTrue(((Article) child(result, 3)).paragraphs().isEmpty());
    }

    @Test
    void apply_rejectsModificationOfAnotherAct() {
        Modification foreign = Modification.Repeal.of(Reference.toAct(AMENDING_ID).withArticle("1"));

        assertThrows(AmendmentApplicationException.class, () -> applier.apply(amendedAct(),
                new AppliableModification(CAUSE, foreign), AMENDING_IN_FORCE));
    }
}
