package com.williamcallahan.actdb.amender.apply;

import com.williamcallahan.actdb.amender.AmendmentResult;
import com.williamcallahan.actdb.amender.NeedsFullReparse;
import com.williamcallahan.actdb.domain.reference.StructuralReference;
import com.williamcallahan.actdb.domain.reference.StructuralReferenceElement;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.ActChild;
import com.williamcallahan.actdb.domain.structure.Article;
import com.williamcallahan.actdb.domain.structure.LastChange;
import com.williamcallahan.actdb.parser.SemanticInfoProvider;
import com.williamcallahan.actdb.structure.CutPointResolver;
import com.williamcallahan.actdb.structure.CutPoints;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splices top-level children of an act at the cut points of a structural reference.
 *
 * <p>Empty content is a structural repeal: headers and subtitles in the range disappear and the
 * articles stay behind as untitled, empty shells.</p>
 */
@Component
public class StructuralBlockAmendmentApplier {

    private final SemanticInfoProvider semanticInfoProvider;

    public StructuralBlockAmendmentApplier(SemanticInfoProvider semanticInfoProvider) {
        this.semanticInfoProvider = semanticInfoProvider;
    }

    /**
     * Replaces the resolved range with the content.
     *
     * @param act act to amend
     * @param position replaced structural position
     * @param pureInsertion resolve an insertion point instead of an existing range
     * @param content replacement children; empty to repeal the range
     * @param change stamp for the inserted children and the repealed article shells
     * @return amended act; anything but a single article amendment needs a full reparse
     */
    public AmendmentResult apply(Act act, StructuralReference position, boolean pureInsertion,
            List<ActChild> content, LastChange change) {
        CutPoints cut = CutPointResolver.resolve(act, position, pureInsertion);
        List<ActChild> children = new ArrayList<>(act.children().subList(0, cut.start()));
        if (content.isEmpty()) {
            for (ActChild removed : act.children().subList(cut.start(), cut.end())) {
                if (removed instanceof Article article) {
                    children.add(new Article(article.identifier(), null, List.of(), change));
                }
            }
        } else {
            for (ActChild child : content) {
                children.add(child.withLastChange(change));
            }
        }
        children.addAll(act.children().subList(cut.end(), act.children().size()));
        Act amended = act.withChildren(children);

        StructuralReferenceElement element = position.element();
        if (element.kind() == StructuralReferenceElement.Kind.ARTICLE && !element.ids().isRange()) {
            SemanticInfoProvider.ArticleUpdate update =
                    semanticInfoProvider.addSemanticInfoToArticle(amended, element.ids().first());
            return new AmendmentResult(update.act(), NeedsFullReparse.of(update.abbreviationsChanged()));
        }
        return new AmendmentResult(amended, NeedsFullReparse.YES);
    }

    /**
     * Repeals the resolved range.
     *
     * @param act act to amend
     * @param position repealed structural position
     * @param change stamp for the remaining article shells
     * @return amended act
     */
    public AmendmentResult repeal(Act act, StructuralReference position, LastChange change) {
        return apply(act, position, false, List.of(), change);
    }
}
