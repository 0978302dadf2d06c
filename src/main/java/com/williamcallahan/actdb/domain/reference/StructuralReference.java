package com.williamcallahan.actdb.domain.reference;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.actdb.domain.identifier.ActIdentifier;
import com.williamcallahan.actdb.domain.identifier.Identifier;

import java.util.Objects;

/**
 * Path expression into the book / part / title / chapter / subtitle / article hierarchy of an act.
 *
 * <p>Resolved against a concrete act by
 * {@link com.williamcallahan.actdb.structure.CutPointResolver} into a half-open index range of
 * the act's top-level children.</p>
 *
 * @param act act the reference points into, or null if relative
 * @param book book identifier, or null if the act has no books or the book is implied
 * @param parent enclosing part, title, chapter or subtitle, or null
 * @param element the addressed element
 * @param titleOnly narrow the resolved range to its first (header) element
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StructuralReference(
        ActIdentifier act,
        Identifier book,
        StructuralReferenceElement parent,
        StructuralReferenceElement element,
        boolean titleOnly) {

    public StructuralReference {
        Objects.requireNonNull(element, "Structural reference element is required");
        if (parent != null && !parent.kind().allowedAsParent()) {
            throw new IllegalArgumentException("Not a valid structural parent: " + parent);
        }
    }

    public static StructuralReference of(ActIdentifier act, StructuralReferenceElement element) {
        return new StructuralReference(act, null, null, element, false);
    }

    public static StructuralReference of(StructuralReferenceElement element) {
        return new StructuralReference(null, null, null, element, false);
    }

    public StructuralReference inBook(String bookId) {
        return new StructuralReference(act, Identifier.of(bookId), parent, element, titleOnly);
    }

    public StructuralReference withParent(StructuralReferenceElement newParent) {
        return new StructuralReference(act, book, newParent, element, titleOnly);
    }

    public StructuralReference withAct(ActIdentifier newAct) {
        return new StructuralReference(newAct, book, parent, element, titleOnly);
    }

    public StructuralReference asTitleOnly() {
        return new StructuralReference(act, book, parent, element, true);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (act != null) {
            sb.append(act).append(' ');
        }
        if (book != null) {
            sb.append("BOOK ").append(book).append(' ');
        }
        if (parent != null) {
            sb.append(parent).append(" > ");
        }
        sb.append(element);
        if (titleOnly) {
            sb.append(" (title)");
        }
        return sb.toString();
    }
}
