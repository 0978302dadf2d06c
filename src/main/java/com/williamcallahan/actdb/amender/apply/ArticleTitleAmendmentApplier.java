package com.williamcallahan.actdb.amender.apply;

import com.williamcallahan.actdb.amender.AmendmentNoEffectException;
import com.williamcallahan.actdb.amender.AmendmentResult;
import com.williamcallahan.actdb.amender.NeedsFullReparse;
import com.williamcallahan.actdb.amender.text.TextReplacer;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.ActChild;
import com.williamcallahan.actdb.domain.structure.Article;
import com.williamcallahan.actdb.domain.structure.LastChange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Whole-word replacement in the titles of the referenced articles.
 */
@Component
public class ArticleTitleAmendmentApplier {

    /**
     * Applies the replacement to every article contained by the position.
     *
     * @param act act to amend
     * @param position amended article(s)
     * @param from replaced text
     * @param to replacement text
     * @param change stamp for the changed articles
     * @return amended act; article titles never require a reparse
     * @throws AmendmentNoEffectException if no title contained {@code from}
     */
    public AmendmentResult apply(Act act, Reference position, String from, String to, LastChange change) {
        Reference actRef = act.reference();
        List<ActChild> children = new ArrayList<>(act.children().size());
        boolean applied = false;
        for (ActChild child : act.children()) {
            if (child instanceof Article article
                    && article.title() != null
                    && position.contains(article.reference().relativeTo(actRef))) {
                Optional<String> replaced = TextReplacer.normalizedReplace(article.title(), from, to);
                if (replaced.isPresent()) {
                    children.add(article.withTitle(replaced.get()).withLastChange(change));
                    applied = true;
                    continue;
                }
            }
            children.add(child);
        }
        if (!applied) {
            throw new AmendmentNoEffectException("Article title amendment '" + from + "' -> '" + to
                    + "' had no effect on " + position);
        }
        return new AmendmentResult(act.withChildren(children), NeedsFullReparse.NO);
    }
}
