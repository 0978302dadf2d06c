package com.williamcallahan.actdb.domain.reference;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.actdb.domain.identifier.Identifier;
import com.williamcallahan.actdb.domain.identifier.IdentifierRange;
import com.williamcallahan.actdb.domain.structure.StructuralElementType;

import java.util.Objects;

/**
 * One addressed level of a {@link StructuralReference}: a part, title, chapter, subtitle or
 * article range.
 *
 * @param kind how the element is addressed
 * @param ids identifier (range) for id-addressed kinds, the anchor article for article-relative subtitles
 * @param title literal title for {@link Kind#SUBTITLE_TITLE}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StructuralReferenceElement(Kind kind, IdentifierRange ids, String title) {

    /**
     * Addressing modes of structural reference elements.
     */
    public enum Kind {
        PART(true),
        TITLE(true),
        CHAPTER(true),
        SUBTITLE_ID(true),
        SUBTITLE_TITLE(true),
        SUBTITLE_AFTER_ARTICLE(false),
        SUBTITLE_BEFORE_ARTICLE(false),
        SUBTITLE_BEFORE_ARTICLE_INCLUSIVE(false),
        SUBTITLE_UNKNOWN(false),
        ARTICLE(false);

        private final boolean allowedAsParent;

        Kind(boolean allowedAsParent) {
            this.allowedAsParent = allowedAsParent;
        }

        public boolean allowedAsParent() {
            return allowedAsParent;
        }
    }

    public StructuralReferenceElement {
        Objects.requireNonNull(kind, "Structural reference kind is required");
        switch (kind) {
            case SUBTITLE_TITLE -> {
                if (title == null || title.isBlank()) {
                    throw new IllegalArgumentException("Subtitle title is required for " + kind);
                }
            }
            case SUBTITLE_UNKNOWN -> {
                if (ids != null || title != null) {
                    throw new IllegalArgumentException("Unknown subtitle references carry no id or title");
                }
            }
            case PART, TITLE, CHAPTER, SUBTITLE_AFTER_ARTICLE, SUBTITLE_BEFORE_ARTICLE,
                    SUBTITLE_BEFORE_ARTICLE_INCLUSIVE -> {
                if (ids == null || ids.isRange()) {
                    throw new IllegalArgumentException("A single identifier is required for " + kind);
                }
            }
            case SUBTITLE_ID, ARTICLE -> Objects.requireNonNull(ids, "Identifier range is required for " + kind);
        }
    }

    public static StructuralReferenceElement part(String id) {
        return new StructuralReferenceElement(Kind.PART, IdentifierRange.single(id), null);
    }

    public static StructuralReferenceElement title(String id) {
        return new StructuralReferenceElement(Kind.TITLE, IdentifierRange.single(id), null);
    }

    public static StructuralReferenceElement chapter(String id) {
        return new StructuralReferenceElement(Kind.CHAPTER, IdentifierRange.single(id), null);
    }

    public static StructuralReferenceElement subtitle(String id) {
        return new StructuralReferenceElement(Kind.SUBTITLE_ID, IdentifierRange.single(id), null);
    }

    public static StructuralReferenceElement subtitleRange(String first, String last) {
        return new StructuralReferenceElement(Kind.SUBTITLE_ID, IdentifierRange.of(first, last), null);
    }

    public static StructuralReferenceElement subtitleTitled(String title) {
        return new StructuralReferenceElement(Kind.SUBTITLE_TITLE, null, title);
    }

    public static StructuralReferenceElement subtitleAfterArticle(String articleId) {
        return new StructuralReferenceElement(Kind.SUBTITLE_AFTER_ARTICLE, IdentifierRange.single(articleId), null);
    }

    public static StructuralReferenceElement subtitleBeforeArticle(String articleId) {
        return new StructuralReferenceElement(Kind.SUBTITLE_BEFORE_ARTICLE, IdentifierRange.single(articleId), null);
    }

    public static StructuralReferenceElement subtitleBeforeArticleInclusive(String articleId) {
        return new StructuralReferenceElement(
                Kind.SUBTITLE_BEFORE_ARTICLE_INCLUSIVE, IdentifierRange.single(articleId), null);
    }

    public static StructuralReferenceElement subtitleUnknown() {
        return new StructuralReferenceElement(Kind.SUBTITLE_UNKNOWN, null, null);
    }

    public static StructuralReferenceElement article(String id) {
        return new StructuralReferenceElement(Kind.ARTICLE, IdentifierRange.single(id), null);
    }

    public static StructuralReferenceElement articleRange(String first, String last) {
        return new StructuralReferenceElement(Kind.ARTICLE, IdentifierRange.of(first, last), null);
    }

    /**
     * Returns the structural element type for part, title and chapter references.
     *
     * @return element type, or null for subtitle and article references
     */
    public StructuralElementType structuralElementType() {
        return switch (kind) {
            case PART -> StructuralElementType.PART;
            case TITLE -> StructuralElementType.TITLE;
            case CHAPTER -> StructuralElementType.CHAPTER;
            default -> null;
        };
    }

    /**
     * The single identifier of this element; for ranges the first one.
     *
     * @return identifier
     */
    public Identifier id() {
        return ids == null ? null : ids.first();
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SUBTITLE_TITLE -> kind + " '" + title + "'";
            case SUBTITLE_UNKNOWN -> kind.toString();
            default -> kind + " " + ids;
        };
    }
}
