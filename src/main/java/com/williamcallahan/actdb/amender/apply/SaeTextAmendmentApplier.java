package com.williamcallahan.actdb.amender.apply;

import com.williamcallahan.actdb.amender.AmendmentNoEffectException;
import com.williamcallahan.actdb.amender.AmendmentResult;
import com.williamcallahan.actdb.amender.NeedsFullReparse;
import com.williamcallahan.actdb.amender.text.TextReplacer;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.semantic.AmendedPart;
import com.williamcallahan.actdb.domain.semantic.TextAmendmentReference;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.LastChange;
import com.williamcallahan.actdb.domain.structure.SaeBody;
import com.williamcallahan.actdb.domain.structure.SubArticleElement;
import com.williamcallahan.actdb.parser.SemanticInfoProvider;
import com.williamcallahan.actdb.util.SaeWalker;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Whole-word replacement in the text of paragraphs, points and subpoints.
 *
 * <p>{@link AmendedPart#ALL} edits leaf text, intros and wrap-ups of every contained element.
 * Intro-only and wrap-up-only amendments edit exactly the referenced container.</p>
 */
@Component
public class SaeTextAmendmentApplier {

    private final SemanticInfoProvider semanticInfoProvider;

    public SaeTextAmendmentApplier(SemanticInfoProvider semanticInfoProvider) {
        this.semanticInfoProvider = semanticInfoProvider;
    }

    /**
     * Applies the replacement.
     *
     * @param act act to amend
     * @param target amended elements and part
     * @param from replaced text
     * @param to replacement text
     * @param change stamp for the changed elements
     * @return amended act; a reparse is requested for article ranges or changed abbreviations
     * @throws AmendmentNoEffectException if no element text contained {@code from}
     */
    public AmendmentResult apply(Act act, TextAmendmentReference.Sae target, String from, String to,
            LastChange change) {
        Reference reference = target.reference();
        AmendedPart part = target.amendedPart();
        AtomicBoolean applied = new AtomicBoolean(false);
        Act amended = SaeWalker.transform(act, (position, element) -> {
            if (!reference.contains(position)) {
                return element;
            }
            SubArticleElement updated = replaceIn(element, reference.equals(position), part, from, to);
            if (updated == element) {
                return element;
            }
            applied.set(true);
            return updated.withLastChange(change);
        });
        if (!applied.get()) {
            throw new AmendmentNoEffectException("Text amendment '" + from + "' -> '" + to + "' had no effect on "
                    + reference + " (" + part + ")");
        }
        if (reference.isSingleArticle()) {
            SemanticInfoProvider.ArticleUpdate update =
                    semanticInfoProvider.addSemanticInfoToArticle(amended, reference.singleArticleId());
            return new AmendmentResult(update.act(), NeedsFullReparse.of(update.abbreviationsChanged()));
        }
        return new AmendmentResult(amended, NeedsFullReparse.YES);
    }

    private static SubArticleElement replaceIn(SubArticleElement element, boolean exactTarget, AmendedPart part,
            String from, String to) {
        if (element.body() instanceof SaeBody.Text text) {
            if (part != AmendedPart.ALL) {
                return element;
            }
            return TextReplacer.normalizedReplace(text.text(), from, to)
                    .map(replaced -> element.withBody(new SaeBody.Text(replaced)))
                    .orElse(element);
        }
        SaeBody.Children body = (SaeBody.Children) element.body();
        SaeBody.Children updated = body;
        if (part == AmendedPart.ALL || (part == AmendedPart.INTRO_ONLY && exactTarget)) {
            Optional<String> intro = TextReplacer.normalizedReplace(body.intro(), from, to);
            if (intro.isPresent()) {
                updated = updated.withIntro(intro.get());
            }
        }
        if (body.wrapUp() != null
                && (part == AmendedPart.ALL || (part == AmendedPart.WRAP_UP_ONLY && exactTarget))) {
            Optional<String> wrapUp = TextReplacer.normalizedReplace(body.wrapUp(), from, to);
            if (wrapUp.isPresent()) {
                updated = updated.withWrapUp(wrapUp.get());
            }
        }
        return updated == body ? element : element.withBody(updated);
    }
}
