package com.williamcallahan.actdb.domain.structure;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.actdb.domain.identifier.Identifier;
import com.williamcallahan.actdb.domain.semantic.SemanticInfo;

import java.util.Objects;

/**
 * Paragraph, point or subpoint of an article.
 *
 * @param kind level of the element
 * @param identifier element identifier; null only for the single unnumbered paragraph of an article
 * @param body text or nested content
 * @param semanticInfo special phrase and outgoing references computed by the parser
 * @param lastChange last modification stamp, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubArticleElement(
        SaeKind kind, Identifier identifier, SaeBody body, SemanticInfo semanticInfo, LastChange lastChange) {

    public SubArticleElement {
        Objects.requireNonNull(kind, "Sub-article element kind is required");
        Objects.requireNonNull(body, "Sub-article element body is required");
        semanticInfo = semanticInfo == null ? SemanticInfo.empty() : semanticInfo;
        if (identifier == null && kind != SaeKind.PARAGRAPH) {
            throw new IllegalArgumentException("Only paragraphs may be unnumbered, found " + kind);
        }
        if (body instanceof SaeBody.Children children) {
            validateContent(kind, children.content());
        }
    }

    private static void validateContent(SaeKind kind, SaeContent content) {
        if (content instanceof SaeContent.Elements elements) {
            for (SubArticleElement child : elements.children()) {
                if (!kind.allowedChildren().contains(child.kind())) {
                    throw new IllegalArgumentException(kind + " cannot contain " + child.kind());
                }
            }
        } else if (kind != SaeKind.PARAGRAPH) {
            throw new IllegalArgumentException("Only paragraphs may hold block amendment content, found " + kind);
        }
    }

    public static SubArticleElement text(SaeKind kind, String identifier, String text) {
        return new SubArticleElement(kind, identifier == null ? null : Identifier.of(identifier),
                new SaeBody.Text(text), null, null);
    }

    public SubArticleElement withBody(SaeBody newBody) {
        return new SubArticleElement(kind, identifier, newBody, semanticInfo, lastChange);
    }

    public SubArticleElement withSemanticInfo(SemanticInfo newSemanticInfo) {
        return new SubArticleElement(kind, identifier, body, newSemanticInfo, lastChange);
    }

    public SubArticleElement withLastChange(LastChange change) {
        return new SubArticleElement(kind, identifier, body, semanticInfo, change);
    }

    /**
     * Reports whether the element has been emptied (its body is blank text).
     *
     * @return true for repealed elements
     */
    @JsonIgnore
    public boolean isEmpty() {
        return body instanceof SaeBody.Text text && text.text().isBlank();
    }
}
