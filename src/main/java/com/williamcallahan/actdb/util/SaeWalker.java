package com.williamcallahan.actdb.util;

import com.williamcallahan.actdb.domain.identifier.IdentifierRange;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.ActChild;
import com.williamcallahan.actdb.domain.structure.Article;
import com.williamcallahan.actdb.domain.structure.SaeBody;
import com.williamcallahan.actdb.domain.structure.SaeContent;
import com.williamcallahan.actdb.domain.structure.SubArticleElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pre-order traversal of the sub-article elements of an act, with absolute positions.
 *
 * The walk descends into regular nested elements only; quoted block-amendment content belongs
 * to another act and is never visited.
 */
public final class SaeWalker {

    private SaeWalker() {
        // Utility class - no instantiation
    }

    /**
     * Sub-article element together with its absolute position.
     *
     * @param position position of the element, including the act
     * @param element the element
     */
    public record PositionedSae(Reference position, SubArticleElement element) {
        public PositionedSae {
            Objects.requireNonNull(position, "Position is required");
            Objects.requireNonNull(element, "Element is required");
        }
    }

    /**
     * Rewrites one element during {@link #transform}. Called before the element's children are
     * visited; the children of the returned element are visited next.
     */
    @FunctionalInterface
    public interface SaeTransformer {
        SubArticleElement apply(Reference position, SubArticleElement element);
    }

    /**
     * Lists every sub-article element of the act in document order.
     *
     * @param act act to walk
     * @return positioned elements
     */
    public static List<PositionedSae> walk(Act act) {
        List<PositionedSae> result = new ArrayList<>();
        for (Article article : act.articles()) {
            Reference articleRef = article.reference().relativeTo(act.reference());
            for (SubArticleElement paragraph : article.paragraphs()) {
                collect(paragraph, articleRef, result);
            }
        }
        return result;
    }

    /**
     * Lists an element and its nested elements in document order.
     *
     * @param element element to walk
     * @param parentPosition absolute position of the element's parent
     * @return positioned elements
     */
    public static List<PositionedSae> walk(SubArticleElement element, Reference parentPosition) {
        List<PositionedSae> result = new ArrayList<>();
        collect(element, parentPosition, result);
        return result;
    }

    /**
     * Computes the absolute position of an element from its parent's position. Unnumbered
     * paragraphs share the position of their article.
     *
     * @param element element
     * @param parentPosition absolute position of the parent
     * @return absolute position of the element
     */
    public static Reference positionOf(SubArticleElement element, Reference parentPosition) {
        if (element.identifier() == null) {
            return parentPosition;
        }
        return parentPosition.withPart(element.kind().level(), IdentifierRange.single(element.identifier()));
    }

    /**
     * Rebuilds the act with every sub-article element passed through the transformer.
     *
     * @param act act to rewrite
     * @param transformer element rewrite
     * @return rewritten act
     */
    public static Act transform(Act act, SaeTransformer transformer) {
        List<ActChild> children = new ArrayList<>(act.children().size());
        for (ActChild child : act.children()) {
            if (child instanceof Article article) {
                children.add(transform(article, act.reference(), transformer));
            } else {
                children.add(child);
            }
        }
        return act.withChildren(children);
    }

    /**
     * Rebuilds an article with every sub-article element passed through the transformer.
     *
     * @param article article to rewrite
     * @param actReference reference of the containing act
     * @param transformer element rewrite
     * @return rewritten article
     */
    public static Article transform(Article article, Reference actReference, SaeTransformer transformer) {
        Reference articleRef = article.reference().relativeTo(actReference);
        List<SubArticleElement> paragraphs = new ArrayList<>(article.paragraphs().size());
        for (SubArticleElement paragraph : article.paragraphs()) {
            paragraphs.add(transform(paragraph, articleRef, transformer));
        }
        return article.withParagraphs(paragraphs);
    }

    private static SubArticleElement transform(
            SubArticleElement element, Reference parentPosition, SaeTransformer transformer) {
        Reference position = positionOf(element, parentPosition);
        SubArticleElement updated = transformer.apply(position, element);
        if (updated.body() instanceof SaeBody.Children body
                && body.content() instanceof SaeContent.Elements elements) {
            List<SubArticleElement> children = new ArrayList<>(elements.children().size());
            for (SubArticleElement child : elements.children()) {
                children.add(transform(child, position, transformer));
            }
            updated = updated.withBody(body.withContent(new SaeContent.Elements(children)));
        }
        return updated;
    }

    private static void collect(SubArticleElement element, Reference parentPosition, List<PositionedSae> result) {
        Reference position = positionOf(element, parentPosition);
        result.add(new PositionedSae(position, element));
        if (element.body() instanceof SaeBody.Children body
                && body.content() instanceof SaeContent.Elements elements) {
            for (SubArticleElement child : elements.children()) {
                collect(child, position, result);
            }
        }
    }
}
