package com.williamcallahan.actdb.structure;

import com.williamcallahan.actdb.domain.identifier.Identifier;
import com.williamcallahan.actdb.domain.identifier.IdentifierRange;
import com.williamcallahan.actdb.domain.reference.StructuralReference;
import com.williamcallahan.actdb.domain.reference.StructuralReferenceElement;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.ActChild;
import com.williamcallahan.actdb.domain.structure.Article;
import com.williamcallahan.actdb.domain.structure.StructuralElement;
import com.williamcallahan.actdb.domain.structure.StructuralElementType;
import com.williamcallahan.actdb.domain.structure.Subtitle;

import java.util.List;
import java.util.function.Predicate;

/**
 * Maps a {@link StructuralReference} onto a half-open range of an act's top-level children.
 *
 * <p>Resolution narrows step by step: the book (if any), then the parent element (if any), then
 * the addressed element inside the parent. Every step must succeed on its own; a failing step
 * raises {@link ReferenceResolutionException} naming that step.</p>
 *
 * <p>With {@code pureInsertion} the resolver looks for the place where a not-yet-existing
 * element would go and returns a degenerate range.</p>
 */
public final class CutPointResolver {

    private CutPointResolver() {
        // Utility class - no instantiation
    }

    /**
     * Resolves a structural reference against an act.
     *
     * @param act act whose children are indexed
     * @param reference structural reference to resolve
     * @param pureInsertion find an insertion point instead of an existing range
     * @return cut points into {@code act.children()}
     * @throws ReferenceResolutionException if any level of the reference cannot be found
     */
    public static CutPoints resolve(Act act, StructuralReference reference, boolean pureInsertion) {
        List<ActChild> children = act.children();
        CutPoints book = reference.book() == null
                ? new CutPoints(0, children.size())
                : wrap("book " + reference.book(),
                        () -> structuralElementOffsets(children, reference.book(), StructuralElementType.BOOK));
        List<ActChild> bookChildren = children.subList(book.start(), book.end());

        StructuralReferenceElement parent = reference.parent();
        CutPoints parentCut = parent == null
                ? new CutPoints(0, bookChildren.size())
                : wrap("parent element " + parent, () -> resolveParent(bookChildren, parent));
        int childrenStart = book.start() + parentCut.start() + (parent == null ? 0 : 1);
        int childrenEnd = book.start() + parentCut.end();
        List<ActChild> relevantChildren = children.subList(childrenStart, childrenEnd);

        CutPoints cut = resolveElement(relevantChildren, reference.element(), pureInsertion);
        if (reference.titleOnly()) {
            if (pureInsertion) {
                throw new ReferenceResolutionException(
                        "Pure insertion and title only are not supported at the same time: " + reference);
            }
            cut = new CutPoints(cut.start(), cut.start() + 1);
        }
        return cut.offset(childrenStart);
    }

    private static CutPoints resolveParent(List<ActChild> children, StructuralReferenceElement parent) {
        return switch (parent.kind()) {
            case PART, TITLE, CHAPTER ->
                    structuralElementOffsets(children, parent.id(), parent.structuralElementType());
            case SUBTITLE_ID -> subtitleOffsetsById(children, parent.ids());
            case SUBTITLE_TITLE -> subtitleOffsetsByTitle(children, parent.title());
            default -> throw new ReferenceResolutionException("Not a valid structural parent: " + parent);
        };
    }

    private static CutPoints resolveElement(
            List<ActChild> children, StructuralReferenceElement element, boolean pureInsertion) {
        return switch (element.kind()) {
            case PART, TITLE, CHAPTER ->
                    structuralElement(children, element.id(), element.structuralElementType(), pureInsertion);
            case SUBTITLE_ID -> subtitleById(children, element.ids(), pureInsertion);
            case SUBTITLE_TITLE -> subtitleByTitle(children, element.title(), pureInsertion);
            case SUBTITLE_AFTER_ARTICLE ->
                    articleRelative(children, element.id(), SubtitlePosition.AFTER_ARTICLE, pureInsertion);
            case SUBTITLE_BEFORE_ARTICLE ->
                    articleRelative(children, element.id(), SubtitlePosition.BEFORE_ARTICLE, pureInsertion);
            case SUBTITLE_BEFORE_ARTICLE_INCLUSIVE -> articleRelative(
                    children, element.id(), SubtitlePosition.BEFORE_ARTICLE_INCLUSIVE, pureInsertion);
            case SUBTITLE_UNKNOWN -> {
                if (!pureInsertion) {
                    throw new ReferenceResolutionException("Unknown subtitles can only be inserted");
                }
                yield new CutPoints(children.size(), children.size());
            }
            case ARTICLE -> articleRange(children, element.ids(), pureInsertion);
        };
    }

    /**
     * Finds the first child matching {@code startMatcher}, then the first later child matching
     * {@code endMatcher}; the end defaults to the size of the list.
     */
    static CutPoints cutPoints(List<ActChild> children, Predicate<ActChild> startMatcher,
            Predicate<ActChild> endMatcher) {
        int start = firstIndex(children, 0, startMatcher);
        if (start < 0) {
            throw new ReferenceResolutionException("Could not find starting cut point");
        }
        int end = firstIndex(children, start + 1, endMatcher);
        return new CutPoints(start, end < 0 ? children.size() : end);
    }

    /**
     * Finds the last child matching {@code afterMatcher}, then the first later child matching
     * {@code insertBeforeMatcher}. Without an {@code afterMatcher} hit the search starts at the
     * beginning. The insertion point defaults to the size of the list.
     */
    static CutPoints insertionPoint(List<ActChild> children, Predicate<ActChild> afterMatcher,
            Predicate<ActChild> insertBeforeMatcher) {
        int lastSmaller = lastIndex(children, afterMatcher);
        int found = firstIndex(children, lastSmaller + 1, insertBeforeMatcher);
        int point = found < 0 ? children.size() : found;
        return new CutPoints(point, point);
    }

    private static CutPoints structuralElementOffsets(
            List<ActChild> children, Identifier expectedId, StructuralElementType expectedType) {
        return cutPoints(children,
                child -> child instanceof StructuralElement se
                        && se.elementType() == expectedType
                        && se.identifier().sameSlotAs(expectedId),
                child -> child instanceof StructuralElement se
                        && se.elementType().compareTo(expectedType) <= 0);
    }

    private static CutPoints structuralElement(List<ActChild> children, Identifier expectedId,
            StructuralElementType expectedType, boolean pureInsertion) {
        String description = expectedType + " " + expectedId;
        if (pureInsertion) {
            return wrap("insertion point for " + description, () -> insertionPoint(children,
                    child -> child instanceof StructuralElement se
                            && se.elementType() == expectedType
                            && se.identifier().compareTo(expectedId) < 0,
                    child -> child instanceof StructuralElement se
                            && se.elementType().compareTo(expectedType) <= 0));
        }
        return wrap(description, () -> structuralElementOffsets(children, expectedId, expectedType));
    }

    private static CutPoints subtitleOffsetsById(List<ActChild> children, IdentifierRange expectedIds) {
        return cutPoints(children,
                child -> child instanceof Subtitle subtitle && expectedIds.contains(subtitle.identifier()),
                child -> {
                    if (child instanceof StructuralElement) {
                        return true;
                    }
                    if (child instanceof Subtitle subtitle) {
                        return subtitle.identifier() == null || !expectedIds.contains(subtitle.identifier());
                    }
                    return false;
                });
    }

    private static CutPoints subtitleById(List<ActChild> children, IdentifierRange expectedIds,
            boolean pureInsertion) {
        if (pureInsertion) {
            return wrap("insertion point for subtitle " + expectedIds, () -> insertionPoint(children,
                    child -> child instanceof Subtitle subtitle
                            && subtitle.identifier() != null
                            && subtitle.identifier().compareTo(expectedIds.first()) <= 0,
                    child -> child instanceof Subtitle || child instanceof StructuralElement));
        }
        return wrap("subtitle " + expectedIds, () -> subtitleOffsetsById(children, expectedIds));
    }

    private static CutPoints subtitleOffsetsByTitle(List<ActChild> children, String expectedTitle) {
        return cutPoints(children,
                child -> child instanceof Subtitle subtitle && subtitle.title().equals(expectedTitle),
                child -> child instanceof Subtitle || child instanceof StructuralElement);
    }

    private static CutPoints subtitleByTitle(List<ActChild> children, String expectedTitle,
            boolean pureInsertion) {
        if (pureInsertion) {
            throw new ReferenceResolutionException(
                    "Pure insertion of a subtitle addressed by title is not supported: '" + expectedTitle + "'");
        }
        return wrap("subtitle with title '" + expectedTitle + "'",
                () -> subtitleOffsetsByTitle(children, expectedTitle));
    }

    private static CutPoints articleRange(List<ActChild> children, IdentifierRange range, boolean pureInsertion) {
        if (pureInsertion) {
            return wrap("insertion point for article range " + range, () -> insertionPoint(children,
                    child -> child instanceof Article article && article.identifier().compareTo(range.first()) < 0,
                    child -> true));
        }
        return wrap("article range " + range, () -> cutPoints(children,
                child -> child instanceof Article article && range.contains(article.identifier()),
                child -> !(child instanceof Article article) || !range.contains(article.identifier())));
    }

    private static CutPoints articleRelative(List<ActChild> children, Identifier articleId,
            SubtitlePosition position, boolean pureInsertion) {
        String description = "subtitle " + position.description + " article " + articleId;
        int articleIndex = firstIndex(children, 0,
                child -> child instanceof Article article && article.identifier().sameSlotAs(articleId));
        if (pureInsertion) {
            int point;
            if (articleIndex >= 0) {
                point = switch (position) {
                    case AFTER_ARTICLE -> articleIndex + 1;
                    case BEFORE_ARTICLE -> articleIndex;
                    case BEFORE_ARTICLE_INCLUSIVE -> throw new ReferenceResolutionException(
                            "Cannot insert " + description + " inclusively, the article already exists");
                };
            } else {
                int lastSmaller = lastIndex(children,
                        child -> child instanceof Article article && article.identifier().compareTo(articleId) < 0);
                if (lastSmaller < 0) {
                    throw new ReferenceResolutionException(
                            "Could not find insertion point for " + description + ": no preceding article");
                }
                point = lastSmaller + 1;
            }
            return new CutPoints(point, point);
        }
        if (articleIndex < 0) {
            throw new ReferenceResolutionException("Could not find article " + articleId + " for " + description);
        }
        CutPoints cut = switch (position) {
            case AFTER_ARTICLE -> new CutPoints(articleIndex + 1, articleIndex + 2);
            case BEFORE_ARTICLE -> new CutPoints(Math.max(articleIndex - 1, 0), articleIndex);
            case BEFORE_ARTICLE_INCLUSIVE -> new CutPoints(Math.max(articleIndex - 1, 0), articleIndex + 1);
        };
        if (cut.start() >= children.size() || !(children.get(cut.start()) instanceof Subtitle)) {
            throw new ReferenceResolutionException("Element at " + description + " was not a subtitle");
        }
        return cut;
    }

    private static int firstIndex(List<ActChild> children, int from, Predicate<ActChild> matcher) {
        for (int index = Math.max(from, 0); index < children.size(); index++) {
            if (matcher.test(children.get(index))) {
                return index;
            }
        }
        return -1;
    }

    private static int lastIndex(List<ActChild> children, Predicate<ActChild> matcher) {
        for (int index = children.size() - 1; index >= 0; index--) {
            if (matcher.test(children.get(index))) {
                return index;
            }
        }
        return -1;
    }

    private static CutPoints wrap(String description, CutPointLookup lookup) {
        try {
            return lookup.find();
        } catch (ReferenceResolutionException e) {
            throw new ReferenceResolutionException("Could not find cut points for " + description, e);
        }
    }

    @FunctionalInterface
    private interface CutPointLookup {
        CutPoints find();
    }

    private enum SubtitlePosition {
        AFTER_ARTICLE("after"),
        BEFORE_ARTICLE("before"),
        BEFORE_ARTICLE_INCLUSIVE("inclusively before");

        private final String description;

        SubtitlePosition(String description) {
            this.description = description;
        }
    }
}
