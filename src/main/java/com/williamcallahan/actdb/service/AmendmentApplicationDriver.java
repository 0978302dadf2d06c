package com.williamcallahan.actdb.service;

import com.williamcallahan.actdb.amender.AmendmentOrderFixer;
import com.williamcallahan.actdb.amender.AmendmentResult;
import com.williamcallahan.actdb.amender.AppliableModification;
import com.williamcallahan.actdb.amender.ModificationExtractor;
import com.williamcallahan.actdb.amender.NeedsFullReparse;
import com.williamcallahan.actdb.amender.apply.ModificationApplier;
import com.williamcallahan.actdb.database.ActDatabase;
import com.williamcallahan.actdb.database.ActEntry;
import com.williamcallahan.actdb.database.ActSet;
import com.williamcallahan.actdb.domain.identifier.ActIdentifier;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.fixups.FixupStore;
import com.williamcallahan.actdb.parser.SemanticInfoProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the amendments taking effect on one date to the state of that date.
 *
 * <p>Every act whose enforcement dates make the date interesting is scanned for modifications;
 * the modifications, together with the date's global fixups, are grouped by the act they amend.
 * Each amended act then goes through {@link AmendmentStage} in isolation: a failure discards that
 * act's changes and is reported, and the other acts continue.</p>
 */
@Service
public class AmendmentApplicationDriver {

    private static final Logger log = LoggerFactory.getLogger(AmendmentApplicationDriver.class);

    private final ActDatabase database;
    private final ModificationExtractor extractor;
    private final ModificationApplier applier;
    private final SemanticInfoProvider semanticInfoProvider;
    private final FixupStore fixupStore;

    public AmendmentApplicationDriver(ActDatabase database, ModificationExtractor extractor,
            ModificationApplier applier, SemanticInfoProvider semanticInfoProvider, FixupStore fixupStore) {
        this.database = database;
        this.extractor = extractor;
        this.applier = applier;
        this.semanticInfoProvider = semanticInfoProvider;
        this.fixupStore = fixupStore;
    }

    /**
     * Applies the date's amendments to the stored state of that date and saves it.
     *
     * @param date date whose amendments take effect
     * @return amended acts and per-act failures
     */
    public AmendmentOutcome applyDate(LocalDate date) {
        ActSet state = database.actSet(date);
        List<AmendmentFailure> failures = new ArrayList<>();
        Map<ActIdentifier, List<AppliableModification>> byAffectedAct = collectModifications(state, date, failures);

        List<ActIdentifier> amended = new ArrayList<>();
        for (Map.Entry<ActIdentifier, List<AppliableModification>> entry : byAffectedAct.entrySet()) {
            ActIdentifier actId = entry.getKey();
            if (!state.hasAct(actId)) {
                log.debug("Act not in database for amending: {}", actId);
                continue;
            }
            AmendmentStage stage = AmendmentStage.EXTRACTED;
            try {
                Act act = database.loadAct(state.entry(actId).orElseThrow());
                List<AppliableModification> modifications = new ArrayList<>(entry.getValue());
                AmendmentOrderFixer.fixOrder(modifications);
                stage = AmendmentStage.ORDERED;
                Act result = applyInOrder(act, date, modifications);
                stage = AmendmentStage.APPLIED;
                ActSet next = database.storeAct(state, result);
                database.saveActMetadata(actId, database.actMetadata(actId).withModificationDate(date));
                state = next;
                amended.add(actId);
                log.info("Applied {} amendments to {}", modifications.size(), actId);
            } catch (RuntimeException e) {
                log.warn("Amending {} on {} failed at stage {}: {}", actId, date, stage, e.getMessage());
                log.debug("Stack trace:", e);
                failures.add(AmendmentFailure.of(actId, date, stage, e));
            }
        }
        if (!amended.isEmpty()) {
            database.saveActSet(date, state);
        }
        return AmendmentOutcome.success(date, amended, failures);
    }

    /**
     * Applies already ordered modifications to one act, then refreshes its semantic info.
     *
     * @param act act to amend
     * @param date date the modifications take effect
     * @param modifications modifications in application order
     * @return the amended act
     */
    public Act applyInOrder(Act act, LocalDate date, List<AppliableModification> modifications) {
        NeedsFullReparse reparse = NeedsFullReparse.NO;
        for (AppliableModification modification : modifications) {
            AmendmentResult result = applier.apply(act, modification, date);
            act = result.act();
            reparse = reparse.or(result.needsFullReparse());
        }
        if (reparse == NeedsFullReparse.YES) {
            act = semanticInfoProvider.addSemanticInfo(act);
        }
        return semanticInfoProvider.convertBlockAmendments(act);
    }

    private Map<ActIdentifier, List<AppliableModification>> collectModifications(ActSet state, LocalDate date,
            List<AmendmentFailure> failures) {
        Map<ActIdentifier, List<AppliableModification>> result = new LinkedHashMap<>();
        for (Map.Entry<ActIdentifier, ActEntry> entry : state.entries().entrySet()) {
            if (!entry.getValue().isDateInteresting(date)) {
                continue;
            }
            try {
                Act act = database.loadAct(entry.getValue());
                Map<ActIdentifier, List<AppliableModification>> extracted = new LinkedHashMap<>();
                for (AppliableModification modification : extractor.extract(act, date)) {
                    extracted.computeIfAbsent(modification.affectedAct(), k -> new ArrayList<>()).add(modification);
                }
                extracted.forEach((affected, modifications) ->
                        result.computeIfAbsent(affected, k -> new ArrayList<>()).addAll(modifications));
            } catch (RuntimeException e) {
                log.warn("Extracting modifications from {} on {} failed: {}", entry.getKey(), date, e.getMessage());
                failures.add(AmendmentFailure.of(entry.getKey(), date, AmendmentStage.UNTOUCHED, e));
            }
        }
        List<AppliableModification> fixups = fixupStore.forDate(date);
        if (!fixups.isEmpty()) {
            log.info("Fixup: using {} additional date-specific modifications", fixups.size());
        }
        for (AppliableModification fixup : fixups) {
            result.computeIfAbsent(fixup.affectedAct(), k -> new ArrayList<>()).add(fixup);
        }
        return result;
    }
}
