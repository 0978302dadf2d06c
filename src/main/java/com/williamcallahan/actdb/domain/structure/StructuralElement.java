package com.williamcallahan.actdb.domain.structure;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.actdb.domain.identifier.Identifier;

import java.util.Objects;

/**
 * Book, part, title or chapter header.
 *
 * @param identifier numeric identifier of the header
 * @param title header text
 * @param elementType header kind
 * @param lastChange last modification stamp, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StructuralElement(
        Identifier identifier, String title, StructuralElementType elementType, LastChange lastChange)
        implements ActChild {

    public StructuralElement {
        Objects.requireNonNull(identifier, "Structural element identifier is required");
        Objects.requireNonNull(elementType, "Structural element type is required");
        title = title == null ? "" : title;
    }

    public StructuralElement withTitle(String newTitle) {
        return new StructuralElement(identifier, newTitle, elementType, lastChange);
    }

    @Override
    public StructuralElement withLastChange(LastChange change) {
        return new StructuralElement(identifier, title, elementType, change);
    }
}
