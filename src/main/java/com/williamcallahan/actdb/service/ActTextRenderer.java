package com.williamcallahan.actdb.service;

import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.ActChild;
import com.williamcallahan.actdb.domain.structure.Article;
import com.williamcallahan.actdb.domain.structure.SaeBody;
import com.williamcallahan.actdb.domain.structure.SaeContent;
import com.williamcallahan.actdb.domain.structure.StructuralElement;
import com.williamcallahan.actdb.domain.structure.SubArticleElement;
import com.williamcallahan.actdb.domain.structure.Subtitle;
import com.williamcallahan.actdb.enforcement.EnforcementDateResolver;
import com.williamcallahan.actdb.util.SaeWalker;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.stream.Collectors;

/**
 * Plain-text rendering of an act version, one element per line, indented by depth.
 *
 * <p>Elements that are named by a later enforcement date are marked with that date.
 * Quoted block-amendment content is shown indented under its paragraph.</p>
 */
@Component
public class ActTextRenderer {

    private static final String INDENT = "  ";

    public String render(ActView view) {
        Act act = view.act();
        StringBuilder out = new StringBuilder();
        out.append(act.identifier()).append(' ').append(act.subject()).append('\n');
        out.append("State at ").append(view.date()).append(", published ").append(act.publicationDate()).append('\n');
        if (!view.metadata().modificationDates().isEmpty()) {
            out.append("Modified on: ")
                    .append(view.metadata().modificationDates().stream()
                            .map(LocalDate::toString)
                            .collect(Collectors.joining(", ")))
                    .append('\n');
        }
        if (!act.preamble().isEmpty()) {
            out.append('\n').append(act.preamble()).append('\n');
        }
        for (ActChild child : act.children()) {
            out.append('\n');
            renderChild(child, act.reference(), view, out);
        }
        return out.toString();
    }

    private void renderChild(ActChild child, Reference actRef, ActView view, StringBuilder out) {
        if (child instanceof StructuralElement element) {
            out.append(element.elementType()).append(' ').append(element.identifier());
            if (!element.title().isEmpty()) {
                out.append(": ").append(element.title());
            }
            out.append('\n');
        } else if (child instanceof Subtitle subtitle) {
            if (subtitle.identifier() != null) {
                out.append(subtitle.identifier()).append(". ");
            }
            out.append(subtitle.title()).append('\n');
        } else {
            Article article = (Article) child;
            Reference articleRef = article.reference().relativeTo(actRef);
            out.append(article.identifier()).append(". §");
            if (article.title() != null) {
                out.append(' ').append(article.title());
            }
            out.append(marker(articleRef, view));
            if (article.paragraphs().isEmpty()) {
                out.append(" (repealed)");
            }
            out.append('\n');
            for (SubArticleElement paragraph : article.paragraphs()) {
                renderSae(paragraph, articleRef, 1, view, out);
            }
        }
    }

    private void renderSae(SubArticleElement element, Reference parentPosition, int depth, ActView view,
            StringBuilder out) {
        Reference position = SaeWalker.positionOf(element, parentPosition);
        out.append(INDENT.repeat(depth)).append(label(element));
        if (element.body() instanceof SaeBody.Text text) {
            out.append(text.text().isEmpty() ? "(repealed)" : text.text());
            out.append(marker(position, view)).append('\n');
            return;
        }
        SaeBody.Children body = (SaeBody.Children) element.body();
        out.append(body.intro()).append(marker(position, view)).append('\n');
        SaeContent content = body.content();
        if (content instanceof SaeContent.Elements elements) {
            for (SubArticleElement child : elements.children()) {
                renderSae(child, position, depth + 1, view, out);
            }
        } else if (content instanceof SaeContent.BlockAmendmentContent block) {
            for (SubArticleElement quoted : block.children()) {
                renderSae(quoted, Reference.empty(), depth + 1, view.withoutEnforcementDates(), out);
            }
        } else {
            SaeContent.StructuralBlockAmendmentContent block = (SaeContent.StructuralBlockAmendmentContent) content;
            out.append(INDENT.repeat(depth + 1)).append("[")
                    .append(block.children().size()).append(" quoted structural elements]\n");
        }
        if (body.wrapUp() != null) {
            out.append(INDENT.repeat(depth)).append(body.wrapUp()).append('\n');
        }
    }

    private static String label(SubArticleElement element) {
        if (element.identifier() == null) {
            return "";
        }
        return switch (element.kind()) {
            case PARAGRAPH -> "(" + element.identifier() + ") ";
            case ALPHABETIC_POINT, NUMERIC_POINT, ALPHABETIC_SUBPOINT, NUMERIC_SUBPOINT ->
                    element.identifier() + ") ";
        };
    }

    private static String marker(Reference position, ActView view) {
        if (view.enforcementDates().isEmpty()) {
            return "";
        }
        EnforcementDateResolver resolver = view.enforcementDates().get();
        return resolver.specificElementNotInForce(position, view.date())
                .map(date -> " [in force from " + date + "]")
                .orElse("");
    }
}
