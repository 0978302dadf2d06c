package com.williamcallahan.actdb.amender.apply;

import com.williamcallahan.actdb.amender.AmendmentApplicationException;
import com.williamcallahan.actdb.amender.AmendmentResult;
import com.williamcallahan.actdb.amender.NeedsFullReparse;
import com.williamcallahan.actdb.domain.identifier.Identifier;
import com.williamcallahan.actdb.domain.identifier.IdentifierRange;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.reference.ReferenceLevel;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.ActChild;
import com.williamcallahan.actdb.domain.structure.Article;
import com.williamcallahan.actdb.domain.structure.LastChange;
import com.williamcallahan.actdb.domain.structure.SaeBody;
import com.williamcallahan.actdb.domain.structure.SaeContent;
import com.williamcallahan.actdb.domain.structure.SubArticleElement;
import com.williamcallahan.actdb.parser.SemanticInfoProvider;
import com.williamcallahan.actdb.util.SaeWalker;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Replaces or inserts paragraphs, points or subpoints inside one article.
 *
 * <p>The last part of the amended position is the replaced identifier range; every element in
 * that range is removed and the replacement is inserted at its sorted place. Replacing points or
 * subpoints also fixes the punctuation of the preceding sibling so the enumeration still reads
 * correctly.</p>
 */
@Component
public class BlockAmendmentApplier {

    private static final Comparator<Identifier> IDENTIFIER_ORDER =
            Comparator.nullsFirst(Comparator.naturalOrder());
    private static final Set<Character> ENDING_PUNCTUATION = Set.of('.', ';', ',');
    private static final List<String> CONJUNCTION_ENDINGS = List.of("és", "valamint", "illetve", "vagy", "továbbá");

    private final SemanticInfoProvider semanticInfoProvider;

    public BlockAmendmentApplier(SemanticInfoProvider semanticInfoProvider) {
        this.semanticInfoProvider = semanticInfoProvider;
    }

    /**
     * Applies the block amendment.
     *
     * @param act act to amend
     * @param position amended position
     * @param pureInsertion whether the amended identifiers must not exist yet
     * @param content replacement elements
     * @param change stamp for the inserted elements
     * @return amended act, with the semantic info of the article recomputed
     * @throws AmendmentApplicationException if the position cannot be located or the result is inconsistent
     */
    public AmendmentResult apply(Act act, Reference position, boolean pureInsertion,
            List<SubArticleElement> content, LastChange change) {
        if (content.isEmpty()) {
            throw new AmendmentApplicationException("Empty block amendment");
        }
        ReferenceLevel level = position.lastLevel();
        if (level != ReferenceLevel.PARAGRAPH && level != ReferenceLevel.POINT && level != ReferenceLevel.SUBPOINT) {
            throw new AmendmentApplicationException("Block amendment position must end in a paragraph, point or "
                    + "subpoint: " + position);
        }
        for (SubArticleElement element : content) {
            if (element.kind().level() != level) {
                throw new AmendmentApplicationException("Wrong amendment content for " + level + " reference: "
                        + element.kind());
            }
        }
        Reference actRef = act.reference();
        Reference parentPosition = position.parent();
        int articleIndex = findArticleIndex(act, parentPosition);
        Article article = (Article) act.children().get(articleIndex);
        Reference articleRef = article.reference().relativeTo(actRef);
        Splice splice = new Splice(level, position.lastPart(), pureInsertion, content, change);

        Article amended;
        try {
            amended = level == ReferenceLevel.PARAGRAPH
                    ? article.withParagraphs(splice.apply(article.paragraphs(), false))
                    : article.withParagraphs(applyInParagraphs(article.paragraphs(), articleRef, parentPosition,
                            splice));
        } catch (AmendmentApplicationException e) {
            throw new AmendmentApplicationException("Could not apply block amendment to article "
                    + article.identifier() + " of " + act + ": " + e.getMessage(), e);
        }

        List<ActChild> children = new ArrayList<>(act.children());
        children.set(articleIndex, amended);
        SemanticInfoProvider.ArticleUpdate update =
                semanticInfoProvider.addSemanticInfoToArticle(act.withChildren(children), article.identifier());
        return new AmendmentResult(update.act(), NeedsFullReparse.of(update.abbreviationsChanged()));
    }

    private static int findArticleIndex(Act act, Reference parentPosition) {
        Reference actRef = act.reference();
        for (int i = 0; i < act.children().size(); i++) {
            if (act.children().get(i) instanceof Article article
                    && article.reference().relativeTo(actRef).contains(parentPosition)) {
                return i;
            }
        }
        throw new AmendmentApplicationException("Could not find article that contains " + parentPosition
                + " in " + act);
    }

    private static List<SubArticleElement> applyInParagraphs(List<SubArticleElement> paragraphs,
            Reference articleRef, Reference parentPosition, Splice splice) {
        List<SubArticleElement> result = new ArrayList<>(paragraphs);
        for (int i = 0; i < result.size(); i++) {
            SubArticleElement paragraph = result.get(i);
            Reference paragraphRef = SaeWalker.positionOf(paragraph, articleRef);
            if (!paragraphRef.contains(parentPosition)) {
                continue;
            }
            if (splice.level() == ReferenceLevel.POINT) {
                result.set(i, spliceChildren(paragraph, splice));
            } else {
                result.set(i, applyInPoints(paragraph, paragraphRef, parentPosition, splice));
            }
            return result;
        }
        throw new AmendmentApplicationException("Could not find paragraph that contains " + parentPosition);
    }

    private static SubArticleElement applyInPoints(SubArticleElement paragraph, Reference paragraphRef,
            Reference parentPosition, Splice splice) {
        List<SubArticleElement> points = elementsOf(paragraph);
        List<SubArticleElement> result = new ArrayList<>(points);
        for (int i = 0; i < result.size(); i++) {
            SubArticleElement point = result.get(i);
            if (SaeWalker.positionOf(point, paragraphRef).contains(parentPosition)) {
                result.set(i, spliceChildren(point, splice));
                SaeBody.Children body = (SaeBody.Children) paragraph.body();
                return paragraph.withBody(body.withContent(new SaeContent.Elements(result)));
            }
        }
        throw new AmendmentApplicationException("Could not find point that contains " + parentPosition);
    }

    private static SubArticleElement spliceChildren(SubArticleElement container, Splice splice) {
        List<SubArticleElement> children = elementsOf(container);
        SaeBody.Children body = (SaeBody.Children) container.body();
        return container.withBody(body.withContent(new SaeContent.Elements(splice.apply(children, true))));
    }

    private static List<SubArticleElement> elementsOf(SubArticleElement container) {
        if (container.body() instanceof SaeBody.Children body
                && body.content() instanceof SaeContent.Elements elements) {
            return elements.children();
        }
        throw new AmendmentApplicationException("Wrong original content for " + container.kind() + " "
                + container.identifier() + ": it has no nested elements");
    }

    /**
     * Removal of an identifier range from a sibling list followed by sorted insertion of the
     * replacement.
     */
    private record Splice(ReferenceLevel level, IdentifierRange range, boolean pureInsertion,
            List<SubArticleElement> replacement, LastChange change) {

        List<SubArticleElement> apply(List<SubArticleElement> original, boolean fixPunctuation) {
            if (!original.isEmpty()
                    && original.get(0).kind() != replacement.get(0).kind()) {
                throw new AmendmentApplicationException("Wrong original content: cannot replace "
                        + original.get(0).kind() + " elements with " + replacement.get(0).kind());
            }
            List<SubArticleElement> elements = new ArrayList<>(original);
            if (pureInsertion && elements.stream().anyMatch(e -> range.contains(e.identifier()))) {
                throw new AmendmentApplicationException("Inserted element " + range + " already exists");
            }
            if (fixPunctuation) {
                fixPunctuation(elements);
            }
            elements.removeIf(e -> range.contains(e.identifier()));
            Identifier firstReplacementId = replacement.get(0).identifier();
            int insertionIndex = elements.size();
            for (int i = 0; i < elements.size(); i++) {
                if (IDENTIFIER_ORDER.compare(elements.get(i).identifier(), firstReplacementId) > 0) {
                    insertionIndex = i;
                    break;
                }
            }
            List<SubArticleElement> stamped = replacement.stream().map(e -> e.withLastChange(change)).toList();
            elements.addAll(insertionIndex, stamped);
            for (int i = 1; i < elements.size(); i++) {
                Identifier previous = elements.get(i - 1).identifier();
                Identifier current = elements.get(i).identifier();
                if (IDENTIFIER_ORDER.compare(previous, current) >= 0) {
                    throw new AmendmentApplicationException("Wrong identifier after " + previous + ": " + current);
                }
            }
            return elements;
        }

        private void fixPunctuation(List<SubArticleElement> elements) {
            if (elements.isEmpty()) {
                return;
            }
            Character ending = endingPunctuation(elements.get(0));
            if (ending == null) {
                return;
            }
            int toFix = -1;
            for (int i = 0; i < elements.size() && !range.contains(elements.get(i).identifier()); i++) {
                toFix = i;
            }
            if (toFix >= 0) {
                elements.set(toFix, withEndingPunctuation(elements.get(toFix), ending));
            }
        }
    }

    private static Character endingPunctuation(SubArticleElement element) {
        String text = trailingText(element);
        if (text == null || text.isEmpty()) {
            return null;
        }
        char last = text.charAt(text.length() - 1);
        return ENDING_PUNCTUATION.contains(last) ? last : null;
    }

    private static SubArticleElement withEndingPunctuation(SubArticleElement element, char ending) {
        String text = trailingText(element);
        if (text == null || text.endsWith(String.valueOf(ending))
                || CONJUNCTION_ENDINGS.stream().anyMatch(text::endsWith)) {
            return element;
        }
        int end = text.length();
        while (end > 0 && ENDING_PUNCTUATION.contains(text.charAt(end - 1))) {
            end--;
        }
        String fixed = text.substring(0, end) + ending;
        if (element.body() instanceof SaeBody.Children body) {
            return element.withBody(body.withWrapUp(fixed));
        }
        return element.withBody(new SaeBody.Text(fixed));
    }

    private static String trailingText(SubArticleElement element) {
        if (element.body() instanceof SaeBody.Text text) {
            return text.text();
        }
        return ((SaeBody.Children) element.body()).wrapUp();
    }
}
