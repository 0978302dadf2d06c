package com.williamcallahan.actdb.domain.structure;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * Body of a sub-article element: either literal text or an intro, nested content and an
 * optional wrap-up.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = SaeBody.Text.class, name = "Text"),
    @JsonSubTypes.Type(value = SaeBody.Children.class, name = "Children")
})
public sealed interface SaeBody permits SaeBody.Text, SaeBody.Children {

    /**
     * Leaf body.
     *
     * @param text literal text; empty for repealed elements
     */
    record Text(String text) implements SaeBody {
        public Text {
            text = text == null ? "" : text;
        }
    }

    /**
     * Container body.
     *
     * @param intro text before the nested content
     * @param content nested content
     * @param wrapUp text after the nested content, or null
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Children(String intro, SaeContent content, String wrapUp) implements SaeBody {
        public Children {
            intro = intro == null ? "" : intro;
            Objects.requireNonNull(content, "Container content is required");
        }

        public Children withIntro(String newIntro) {
            return new Children(newIntro, content, wrapUp);
        }

        public Children withContent(SaeContent newContent) {
            return new Children(intro, newContent, wrapUp);
        }

        public Children withWrapUp(String newWrapUp) {
            return new Children(intro, content, newWrapUp);
        }
    }
}
