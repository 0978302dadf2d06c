package com.williamcallahan.actdb.amender.apply;

import static com.williamcallahan.actdb.TestActs.AMENDED_ID;
import static com.williamcallahan.actdb.TestActs.AMENDING_IN_FORCE;
import static com.williamcallahan.actdb.TestActs.amendedAct;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.actdb.amender.AmendmentNoEffectException;
import com.williamcallahan.actdb.amender.AmendmentResult;
import com.williamcallahan.actdb.amender.NeedsFullReparse;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.Article;
import com.williamcallahan.actdb.domain.structure.ChangeCause;
import com.williamcallahan.actdb.domain.structure.LastChange;
import org.junit.jupiter.api.Test;

/**
 * Verifies article title replacement in {@link ArticleTitleAmendmentApplier}.
 */
class ArticleTitleAmendmentApplierTest {

    private static final LastChange CHANGE = new LastChange(AMENDING_IN_FORCE,
            new ChangeCause.Amendment(Reference.toArticle("1")));

    private final ArticleTitleAmendmentApplier applier = new ArticleTitleAmendmentApplier();

    @Test
    void apply_replacesTitleAndStampsArticle() {
        AmendmentResult result = applier.apply(amendedAct(), Reference.toAct(AMENDED_ID).withArticle("1"),
                "Scope", "Application", CHANGE);

        Article article = result.act().articles().get(0);
        assertEquals("Application", article.title());
        assertEquals(CHANGE, article.lastChange());
        assertEquals(NeedsFullReparse.NO, result.needsFullReparse());
    }

    @Test
    void apply_onlyTouchesArticlesWithMatchingTitle() {
        Act original = amendedAct();
        AmendmentResult result = applier.apply(original,
                Reference.toAct(AMENDED_ID).withArticleRange("1", "3"), "into force", "into effect", CHANGE);

        assertSame(original.articles().get(0), result.act().articles().get(0));
        assertEquals("Entry into effect", result.act().articles().get(2).title());
    }

    @Test
    void apply_failsWhenAppliedTwice() {
        Reference position = Reference.toAct(AMENDED_ID).withArticle("1");
        Act once = applier.apply(amendedAct(), position, "Scope", "Application", CHANGE).act();

        assertThrows(AmendmentNoEffectException.class,
                () -> applier.apply(once, position, "Scope", "Application", CHANGE));
    }
}
