package com.williamcallahan.actdb.amender.apply;

import com.williamcallahan.actdb.amender.AmendmentApplicationException;
import com.williamcallahan.actdb.amender.AmendmentResult;
import com.williamcallahan.actdb.amender.AppliableModification;
import com.williamcallahan.actdb.amender.Modification;
import com.williamcallahan.actdb.domain.semantic.TextAmendmentReference;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.domain.structure.LastChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Applies one modification to an act, stamping every changed element with the date and cause.
 */
@Service
public class ModificationApplier {

    private static final Logger log = LoggerFactory.getLogger(ModificationApplier.class);

    private final ArticleTitleAmendmentApplier articleTitleApplier;
    private final SaeTextAmendmentApplier saeTextApplier;
    private final StructuralTitleAmendmentApplier structuralTitleApplier;
    private final RepealApplier repealApplier;
    private final BlockAmendmentApplier blockAmendmentApplier;
    private final StructuralBlockAmendmentApplier structuralBlockAmendmentApplier;

    public ModificationApplier(
            ArticleTitleAmendmentApplier articleTitleApplier,
            SaeTextAmendmentApplier saeTextApplier,
            StructuralTitleAmendmentApplier structuralTitleApplier,
            RepealApplier repealApplier,
            BlockAmendmentApplier blockAmendmentApplier,
            StructuralBlockAmendmentApplier structuralBlockAmendmentApplier) {
        this.articleTitleApplier = articleTitleApplier;
        this.saeTextApplier = saeTextApplier;
        this.structuralTitleApplier = structuralTitleApplier;
        this.repealApplier = repealApplier;
        this.blockAmendmentApplier = blockAmendmentApplier;
        this.structuralBlockAmendmentApplier = structuralBlockAmendmentApplier;
    }

    /**
     * Applies the modification.
     *
     * @param act act to amend; must be the modification's affected act
     * @param modification modification and its cause
     * @param date date the modification takes effect
     * @return amended act and whether the whole act must be reparsed
     * @throws AmendmentApplicationException if the modification targets another act or cannot be applied
     * @throws com.williamcallahan.actdb.amender.AmendmentNoEffectException if the modification changed nothing
     */
    public AmendmentResult apply(Act act, AppliableModification modification, LocalDate date) {
        if (!act.identifier().equals(modification.affectedAct())) {
            throw new AmendmentApplicationException("Modification for " + modification.affectedAct()
                    + " cannot be applied to " + act);
        }
        LastChange change = new LastChange(date, modification.cause());
        Modification m = modification.modification();
        log.debug("Applying {} to {}", m.getClass().getSimpleName(), act);

        if (m instanceof Modification.ArticleTitleAmendment title) {
            return articleTitleApplier.apply(act, title.position(), title.from(), title.to(), change);
        }
        if (m instanceof Modification.Repeal repeal) {
            return repealApplier.apply(act, repeal.positions(), change);
        }
        if (m instanceof Modification.TextAmendment text) {
            return applyText(act, text, change);
        }
        if (m instanceof Modification.BlockAmendment block) {
            return blockAmendmentApplier.apply(act, block.position(), block.pureInsertion(), block.content(), change);
        }
        if (m instanceof Modification.StructuralBlockAmendment block) {
            return structuralBlockAmendmentApplier.apply(
                    act, block.position(), block.pureInsertion(), block.content(), change);
        }
        Modification.StructuralRepeal repeal = (Modification.StructuralRepeal) m;
        return structuralBlockAmendmentApplier.repeal(act, repeal.position(), change);
    }

    private AmendmentResult applyText(Act act, Modification.TextAmendment text, LastChange change) {
        TextAmendmentReference reference = text.reference();
        if (reference instanceof TextAmendmentReference.Sae sae) {
            return saeTextApplier.apply(act, sae, text.from(), text.to(), change);
        }
        if (reference instanceof TextAmendmentReference.StructuralTitle structural) {
            return structuralTitleApplier.apply(act, structural.reference(), text.from(), text.to(), change);
        }
        TextAmendmentReference.ArticleTitle articleTitle = (TextAmendmentReference.ArticleTitle) reference;
        return articleTitleApplier.apply(act, articleTitle.reference(), text.from(), text.to(), change);
    }
}
