package com.williamcallahan.actdb.amender.apply;

import com.williamcallahan.actdb.amender.AmendmentNoEffectException;
import com.williamcallahan.actdb.amender.AmendmentResult;
import com.williamcallahan.actdb.amender.NeedsFullReparse;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.ActChild;
import com.williamcallahan.actdb.domain.structure.Article;
import com.williamcallahan.actdb.domain.structure.LastChange;
import com.williamcallahan.actdb.domain.structure.SaeBody;
import com.williamcallahan.actdb.domain.structure.SubArticleElement;
import com.williamcallahan.actdb.util.SaeWalker;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Empties repealed sub-article elements.
 *
 * <p>Repealed elements keep their identifier so later references still resolve. Articles whose
 * paragraphs are all empty afterwards lose their title and paragraphs.</p>
 */
@Component
public class RepealApplier {

    /**
     * Repeals every sub-article element contained by any of the positions.
     *
     * @param act act to amend
     * @param positions repealed positions
     * @param change stamp for the emptied elements
     * @return amended act; repeals never require a reparse
     * @throws AmendmentNoEffectException if a position matched nothing in the act
     */
    public AmendmentResult apply(Act act, List<Reference> positions, LastChange change) {
        Set<Reference> matched = new LinkedHashSet<>();
        Reference actRef = act.reference();
        for (Article article : act.articles()) {
            Reference articleRef = article.reference().relativeTo(actRef);
            positions.stream().filter(position -> position.contains(articleRef)).forEach(matched::add);
        }
        Act repealed = SaeWalker.transform(act, (position, element) -> {
            boolean contained = false;
            for (Reference repealedPosition : positions) {
                if (repealedPosition.contains(position)) {
                    matched.add(repealedPosition);
                    contained = true;
                }
            }
            if (!contained) {
                return element;
            }
            return new SubArticleElement(element.kind(), element.identifier(), new SaeBody.Text(""),
                    null, change);
        });
        for (Reference position : positions) {
            if (!matched.contains(position)) {
                throw new AmendmentNoEffectException("Repeal of " + position + " did not match any element of "
                        + act);
            }
        }
        return new AmendmentResult(collateRepealedParagraphs(repealed, change), NeedsFullReparse.NO);
    }

    private static Act collateRepealedParagraphs(Act act, LastChange change) {
        List<ActChild> children = new ArrayList<>(act.children().size());
        for (ActChild child : act.children()) {
            if (child instanceof Article article
                    && !article.paragraphs().isEmpty()
                    && article.paragraphs().stream().allMatch(SubArticleElement::isEmpty)) {
                children.add(new Article(article.identifier(), null, List.of(), change));
            } else {
                children.add(child);
            }
        }
        return act.withChildren(children);
    }
}
