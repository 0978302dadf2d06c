package com.williamcallahan.actdb.domain.structure;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.actdb.domain.identifier.Identifier;

/**
 * Subtitle grouping articles below the chapter level.
 *
 * @param identifier subtitle number, or null for unnumbered subtitles
 * @param title subtitle text
 * @param lastChange last modification stamp, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Subtitle(Identifier identifier, String title, LastChange lastChange) implements ActChild {

    public Subtitle {
        title = title == null ? "" : title;
    }

    public Subtitle withTitle(String newTitle) {
        return new Subtitle(identifier, newTitle, lastChange);
    }

    @Override
    public Subtitle withLastChange(LastChange change) {
        return new Subtitle(identifier, title, change);
    }
}
