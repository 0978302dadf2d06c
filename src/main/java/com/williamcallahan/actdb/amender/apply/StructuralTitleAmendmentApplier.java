package com.williamcallahan.actdb.amender.apply;

import com.williamcallahan.actdb.amender.AmendmentApplicationException;
import com.williamcallahan.actdb.amender.AmendmentNoEffectException;
import com.williamcallahan.actdb.amender.AmendmentResult;
import com.williamcallahan.actdb.amender.NeedsFullReparse;
import com.williamcallahan.actdb.amender.text.TextReplacer;
import com.williamcallahan.actdb.domain.reference.StructuralReference;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.ActChild;
import com.williamcallahan.actdb.domain.structure.Article;
import com.williamcallahan.actdb.domain.structure.LastChange;
import com.williamcallahan.actdb.domain.structure.StructuralElement;
import com.williamcallahan.actdb.domain.structure.Subtitle;
import com.williamcallahan.actdb.structure.CutPointResolver;
import com.williamcallahan.actdb.structure.CutPoints;
import com.williamcallahan.actdb.structure.ReferenceResolutionException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Whole-word replacement in the title of a structural header or subtitle.
 */
@Component
public class StructuralTitleAmendmentApplier {

    /**
     * Applies the replacement to the first child of the resolved range.
     *
     * @param act act to amend
     * @param reference amended header or subtitle
     * @param from replaced text
     * @param to replacement text
     * @param change stamp for the changed child
     * @return amended act; titles never require a reparse
     * @throws AmendmentApplicationException if the reference resolves to an article
     * @throws AmendmentNoEffectException if the title did not contain {@code from}
     */
    public AmendmentResult apply(Act act, StructuralReference reference, String from, String to, LastChange change) {
        CutPoints cut = CutPointResolver.resolve(act, reference, false);
        if (cut.start() >= act.children().size()) {
            throw new ReferenceResolutionException("Structural title reference " + reference + " points past the act");
        }
        ActChild target = act.children().get(cut.start());
        ActChild replaced;
        if (target instanceof StructuralElement element) {
            replaced = replaceTitle(element.title(), from, to).map(element::withTitle).orElse(null);
        } else if (target instanceof Subtitle subtitle) {
            replaced = replaceTitle(subtitle.title(), from, to).map(subtitle::withTitle).orElse(null);
        } else {
            Article article = (Article) target;
            throw new AmendmentApplicationException("Computed target of a structural title amendment ("
                    + reference + ") was an article: " + article.identifier());
        }
        if (replaced == null) {
            throw new AmendmentNoEffectException("Structural title amendment '" + from + "' -> '" + to
                    + "' had no effect on " + reference);
        }
        List<ActChild> children = new ArrayList<>(act.children());
        children.set(cut.start(), replaced.withLastChange(change));
        return new AmendmentResult(act.withChildren(children), NeedsFullReparse.NO);
    }

    private static Optional<String> replaceTitle(String title, String from, String to) {
        return TextReplacer.normalizedReplace(title, from, to);
    }
}
