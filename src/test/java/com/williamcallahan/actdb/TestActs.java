package com.williamcallahan.actdb;

import com.williamcallahan.actdb.domain.identifier.ActIdentifier;
import com.williamcallahan.actdb.domain.identifier.Identifier;
import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.semantic.AmendedPart;
import com.williamcallahan.actdb.domain.semantic.EnforcementDateType;
import com.williamcallahan.actdb.domain.semantic.SemanticInfo;
import com.williamcallahan.actdb.domain.semantic.SpecialPhrase;
import com.williamcallahan.actdb.domain.semantic.TextAmendmentInstruction;
import com.williamcallahan.actdb.domain.semantic.TextAmendmentReference;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.ActChild;
import com.williamcallahan.actdb.domain.structure.Article;
import com.williamcallahan.actdb.domain.structure.SaeBody;
import com.williamcallahan.actdb.domain.structure.SaeContent;
import com.williamcallahan.actdb.domain.structure.SaeKind;
import com.williamcallahan.actdb.domain.structure.StructuralElement;
import com.williamcallahan.actdb.domain.structure.StructuralElementType;
import com.williamcallahan.actdb.domain.structure.SubArticleElement;
import com.williamcallahan.actdb.domain.structure.Subtitle;
import java.time.LocalDate;
import java.util.List;

/**
 * Small acts shared by the tests.
 *
 * <p>{@link #amendedAct()} is the act being changed; {@link #amendingAct()} replaces
 * "public roads" with "streets" in its first paragraph one day after publication.</p>
 */
public final class TestActs {

    public static final ActIdentifier AMENDED_ID = new ActIdentifier(2013, 2);
    public static final ActIdentifier AMENDING_ID = new ActIdentifier(2013, 7);
    public static final LocalDate AMENDED_PUBLICATION = LocalDate.of(2013, 6, 1);
    public static final LocalDate AMENDING_PUBLICATION = LocalDate.of(2013, 7, 1);
    public static final LocalDate AMENDING_IN_FORCE = LocalDate.of(2013, 7, 2);

    private TestActs() {
    }

    /**
     * Builds the act under amendment. Children by index:
     * 0 part 1, 1 article 1, 2 subtitle 1, 3 article 2, 4 part 2, 5 article 3.
     */
    public static Act amendedAct() {
        return new Act(AMENDED_ID, "Roads and vehicles", "", AMENDED_PUBLICATION, List.of(
                part("1", "General provisions"),
                article("1", "Scope",
                        text(SaeKind.PARAGRAPH, "1", "This act applies to public roads."),
                        container(SaeKind.PARAGRAPH, "2", "For the purposes of this act",
                                text(SaeKind.ALPHABETIC_POINT, "a", "road: a paved surface,"),
                                text(SaeKind.ALPHABETIC_POINT, "b", "vehicle: anything with wheels."))),
                new Subtitle(Identifier.of("1"), "Vehicles", null),
                article("2", null, text(SaeKind.PARAGRAPH, null, "Bicycles are vehicles.")),
                part("2", "Final provisions"),
                article("3", "Entry into force",
                        withPhrase(text(SaeKind.PARAGRAPH, "1",
                                        "This act enters into force on the day after its publication."),
                                defaultEnforcement(new EnforcementDateType.DaysAfterPublication(1))))));
    }

    /** Builds an act that amends {@link #amendedAct()} in force on {@link #AMENDING_IN_FORCE}. */
    public static Act amendingAct() {
        return amendingAct(AMENDING_ID, textAmendment(
                amendedParagraph("1"), "public roads", "streets"));
    }

    /**
     * Builds an amending act whose first article carries the given phrases, one paragraph each.
     *
     * @param id identifier of the amending act
     * @param phrases amending phrases for the paragraphs of article 1
     * @return amending act published on {@link #AMENDING_PUBLICATION}
     */
    public static Act amendingAct(ActIdentifier id, SpecialPhrase... phrases) {
        SubArticleElement[] paragraphs = new SubArticleElement[phrases.length];
        for (int i = 0; i < phrases.length; i++) {
            paragraphs[i] = withPhrase(text(SaeKind.PARAGRAPH, String.valueOf(i + 1),
                    "Amending provision " + (i + 1) + "."), phrases[i]);
        }
        return new Act(id, "Amendments", "", AMENDING_PUBLICATION, List.of(
                article("1", null, paragraphs),
                article("2", null,
                        withPhrase(text(SaeKind.PARAGRAPH, null, "This act enters into force on the day after"
                                        + " its publication."),
                                defaultEnforcement(new EnforcementDateType.DaysAfterPublication(1))))));
    }

    public static Reference amendedParagraph(String paragraph) {
        return Reference.toAct(AMENDED_ID).withArticle("1").withParagraph(paragraph);
    }

    public static SpecialPhrase.TextAmendment textAmendment(Reference position, String from, String to) {
        return new SpecialPhrase.TextAmendment(List.of(new TextAmendmentInstruction(
                new TextAmendmentReference.Sae(position, AmendedPart.ALL), from, to)));
    }

    public static SpecialPhrase.EnforcementDate defaultEnforcement(EnforcementDateType date) {
        return new SpecialPhrase.EnforcementDate(List.of(), List.of(), date, null);
    }

    public static StructuralElement part(String id, String title) {
        return new StructuralElement(Identifier.of(id), title, StructuralElementType.PART, null);
    }

    public static StructuralElement chapter(String id, String title) {
        return new StructuralElement(Identifier.of(id), title, StructuralElementType.CHAPTER, null);
    }

    public static Article article(String id, String title, SubArticleElement... paragraphs) {
        return new Article(Identifier.of(id), title, List.of(paragraphs), null);
    }

    public static SubArticleElement text(SaeKind kind, String id, String text) {
        return SubArticleElement.text(kind, id, text);
    }

    public static SubArticleElement container(SaeKind kind, String id, String intro, SubArticleElement... children) {
        return new SubArticleElement(kind, id == null ? null : Identifier.of(id),
                new SaeBody.Children(intro, new SaeContent.Elements(List.of(children)), null), null, null);
    }

    public static SubArticleElement withPhrase(SubArticleElement element, SpecialPhrase phrase) {
        return element.withSemanticInfo(SemanticInfo.of(phrase));
    }

    /** Returns paragraph {@code index} of article {@code articleIndex} in {@code act.articles()}. */
    public static SubArticleElement paragraph(Act act, int articleIndex, int index) {
        return act.articles().get(articleIndex).paragraphs().get(index);
    }

    public static String textOf(SubArticleElement element) {
        return ((SaeBody.Text) element.body()).text();
    }

    public static List<SubArticleElement> childrenOf(SubArticleElement element) {
        return ((SaeContent.Elements) ((SaeBody.Children) element.body()).content()).children();
    }

    public static ActChild child(Act act, int index) {
        return act.children().get(index);
    }
}
