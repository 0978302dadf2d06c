package com.williamcallahan.actdb.amender;

import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.semantic.SpecialPhrase;
import com.williamcallahan.actdb.domain.semantic.TextAmendmentInstruction;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.Article;
import com.williamcallahan.actdb.domain.structure.ChangeCause;
import com.williamcallahan.actdb.domain.structure.SaeBody;
import com.williamcallahan.actdb.domain.structure.SaeContent;
import com.williamcallahan.actdb.domain.structure.SubArticleElement;
import com.williamcallahan.actdb.enforcement.EnforcementDateResolver;
import com.williamcallahan.actdb.fixups.ActFixups;
import com.williamcallahan.actdb.fixups.FixupStore;
import com.williamcallahan.actdb.util.SaeWalker;
import com.williamcallahan.actdb.util.SaeWalker.PositionedSae;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the modifications an act states for a given date.
 *
 * <p>A provision is actionable on the day it comes into force. Block-amendment containers are
 * handled at paragraph level, since their quoted content is carried by the paragraph body rather
 * than by the phrase. Provisions that came into force yesterday are auto-repealed; that repeal is
 * appended last.</p>
 */
@Component
public class ModificationExtractor {

    private final FixupStore fixupStore;

    public ModificationExtractor(FixupStore fixupStore) {
        this.fixupStore = fixupStore;
    }

    /**
     * Extracts the modifications of the act that take effect on the date, using the act's fixups.
     *
     * @param act act stating the modifications
     * @param date date being calculated
     * @return modifications in document order, auto-repeal last
     * @throws ModificationExtractionException if a provision is inconsistent
     * @throws com.williamcallahan.actdb.enforcement.EnforcementDateException if the act's
     *         enforcement dates cannot be determined
     */
    public List<AppliableModification> extract(Act act, LocalDate date) {
        return extract(act, date, fixupStore.forAct(act.identifier()));
    }

    /**
     * Extracts the modifications of the act that take effect on the date.
     *
     * @param act act stating the modifications
     * @param date date being calculated
     * @param fixups manual corrections for the act
     * @return modifications in document order, auto-repeal last
     */
    public static List<AppliableModification> extract(Act act, LocalDate date, ActFixups fixups) {
        EnforcementDateResolver enforcementDates = EnforcementDateResolver.fromAct(act, fixups.enforcementDates());
        List<AppliableModification> result = new ArrayList<>();
        AutoRepealAccumulator autoRepeals = AutoRepealAccumulator.start(enforcementDates, date, fixups.modifications());
        for (Article article : act.articles()) {
            Reference articleRef = article.reference().relativeTo(act.reference());
            for (SubArticleElement paragraph : article.paragraphs()) {
                Reference paragraphRef = SaeWalker.positionOf(paragraph, articleRef);
                try {
                    if (enforcementDates.cameIntoForceToday(paragraphRef, date)) {
                        extractBlockAmendment(paragraph, paragraphRef, result);
                    }
                    for (PositionedSae positioned : SaeWalker.walk(paragraph, articleRef)) {
                        extractFromElement(positioned, act, date, enforcementDates, fixups, result);
                        autoRepeals = autoRepeals.accept(positioned);
                    }
                } catch (ModificationExtractionException e) {
                    throw new ModificationExtractionException(
                            "Could not get modifications of " + paragraphRef + " on " + date, e);
                }
            }
        }
        autoRepeals.result().ifPresent(result::add);
        return result;
    }

    private static void extractBlockAmendment(SubArticleElement paragraph, Reference paragraphRef,
            List<AppliableModification> result) {
        if (!(paragraph.body() instanceof SaeBody.Children body)) {
            return;
        }
        SpecialPhrase phrase = paragraph.semanticInfo().specialPhrase();
        ChangeCause cause = new ChangeCause.Amendment(paragraphRef);
        if (body.content() instanceof SaeContent.BlockAmendmentContent content) {
            if (!(phrase instanceof SpecialPhrase.BlockAmendment blockAmendment)) {
                throw new ModificationExtractionException(
                        "Invalid special phrase for BlockAmendment container: " + phrase);
            }
            result.add(new AppliableModification(cause, new Modification.BlockAmendment(
                    blockAmendment.position(), blockAmendment.pureInsertion(), content.children())));
        } else if (body.content() instanceof SaeContent.StructuralBlockAmendmentContent content) {
            if (!(phrase instanceof SpecialPhrase.StructuralBlockAmendment blockAmendment)) {
                throw new ModificationExtractionException(
                        "Invalid special phrase for StructuralBlockAmendment container: " + phrase);
            }
            result.add(new AppliableModification(cause, new Modification.StructuralBlockAmendment(
                    blockAmendment.position(), blockAmendment.pureInsertion(), content.children())));
        }
    }

    private static void extractFromElement(PositionedSae positioned, Act act, LocalDate date,
            EnforcementDateResolver enforcementDates, ActFixups fixups, List<AppliableModification> result) {
        Reference position = positioned.position();
        SpecialPhrase phrase = positioned.element().semanticInfo().specialPhrase();
        ChangeCause cause = new ChangeCause.Amendment(position);
        if (enforcementDates.cameIntoForceToday(position, date)) {
            if (phrase instanceof SpecialPhrase.ArticleTitleAmendment amendment) {
                result.add(new AppliableModification(cause,
                        new Modification.ArticleTitleAmendment(amendment.position(), amendment.from(), amendment.to())));
            } else if (phrase instanceof SpecialPhrase.Repeal repeal) {
                for (Reference repealed : repeal.positions()) {
                    result.add(new AppliableModification(cause, Modification.Repeal.of(repealed)));
                }
            } else if (phrase instanceof SpecialPhrase.TextAmendment textAmendment) {
                for (TextAmendmentInstruction instruction : textAmendment.amendments()) {
                    result.add(new AppliableModification(cause, Modification.TextAmendment.of(instruction)));
                }
            } else if (phrase instanceof SpecialPhrase.StructuralRepeal repeal) {
                result.add(new AppliableModification(cause, new Modification.StructuralRepeal(repeal.position())));
            }
            // Block amendment phrases are handled with their container, enforcement dates are not modifications.
            for (AppliableModification fixup : fixups.modifications()) {
                if (fixup.cause().equals(cause)) {
                    result.add(fixup);
                }
            }
        }
        if (phrase instanceof SpecialPhrase.EnforcementDate enforcementDate
                && date.equals(enforcementDate.inlineRepeal())) {
            result.add(new AppliableModification(cause, Modification.Repeal.of(act.reference())));
        }
    }
}
