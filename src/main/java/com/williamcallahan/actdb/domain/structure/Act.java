package com.williamcallahan.actdb.domain.structure;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.actdb.domain.identifier.ActIdentifier;
import com.williamcallahan.actdb.domain.identifier.Identifier;
import com.williamcallahan.actdb.domain.reference.Reference;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One version of a legal act. Instances are immutable; applying an amendment yields a new value.
 *
 * @param identifier act identifier
 * @param subject subject line of the act
 * @param preamble preamble text, may be empty
 * @param publicationDate date the act was published
 * @param children headers, subtitles and articles in document order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Act(
        ActIdentifier identifier,
        String subject,
        String preamble,
        LocalDate publicationDate,
        List<ActChild> children) {

    public Act {
        Objects.requireNonNull(identifier, "Act identifier is required");
        Objects.requireNonNull(publicationDate, "Publication date is required");
        subject = subject == null ? "" : subject;
        preamble = preamble == null ? "" : preamble;
        children = children == null ? List.of() : List.copyOf(children);
    }

    public Act withChildren(List<ActChild> newChildren) {
        return new Act(identifier, subject, preamble, publicationDate, newChildren);
    }

    /**
     * Reference to the whole act.
     *
     * @return act reference
     */
    public Reference reference() {
        return Reference.toAct(identifier);
    }

    /**
     * Returns the articles of the act in document order.
     *
     * @return articles
     */
    public List<Article> articles() {
        return children.stream()
                .filter(Article.class::isInstance)
                .map(Article.class::cast)
                .toList();
    }

    public Optional<Article> article(Identifier id) {
        return articles().stream().filter(article -> article.identifier().sameSlotAs(id)).findFirst();
    }

    @Override
    public String toString() {
        return "Act " + identifier;
    }
}
