package com.williamcallahan.actdb.domain.structure;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.actdb.domain.identifier.Identifier;
import com.williamcallahan.actdb.domain.identifier.IdentifierRange;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.reference.ReferenceLevel;

import java.util.List;
import java.util.Objects;

/**
 * Article of an act, holding an ordered list of paragraphs.
 *
 * @param identifier article identifier such as {@code 12/A} or {@code 3:12}
 * @param title article title, or null
 * @param paragraphs paragraphs in document order; empty for repealed articles
 * @param lastChange last modification stamp, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Article(Identifier identifier, String title, List<SubArticleElement> paragraphs, LastChange lastChange)
        implements ActChild {

    public Article {
        Objects.requireNonNull(identifier, "Article identifier is required");
        paragraphs = paragraphs == null ? List.of() : List.copyOf(paragraphs);
        for (SubArticleElement paragraph : paragraphs) {
            if (paragraph.kind() != SaeKind.PARAGRAPH) {
                throw new IllegalArgumentException(
                        "Article " + identifier + " may only hold paragraphs, found " + paragraph.kind());
            }
        }
    }

    /**
     * Reference to this article relative to its act.
     *
     * @return article reference without an act part
     */
    public Reference reference() {
        return Reference.empty().withPart(ReferenceLevel.ARTICLE, IdentifierRange.single(identifier));
    }

    public Article withTitle(String newTitle) {
        return new Article(identifier, newTitle, paragraphs, lastChange);
    }

    public Article withParagraphs(List<SubArticleElement> newParagraphs) {
        return new Article(identifier, title, newParagraphs, lastChange);
    }

    @Override
    public Article withLastChange(LastChange change) {
        return new Article(identifier, title, paragraphs, change);
    }
}
