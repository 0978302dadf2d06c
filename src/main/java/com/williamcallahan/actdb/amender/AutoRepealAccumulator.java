package com.williamcallahan.actdb.amender;

import com.williamcallahan.actdb.domain.reference.Reference;
import com.williamcallahan.actdb.domain.semantic.SpecialPhrase;
import com.williamcallahan.actdb.domain.structure.ChangeCause;
import com.williamcallahan.actdb.enforcement.EnforcementDateResolver;
import com.williamcallahan.actdb.util.SaeWalker.PositionedSae;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Statutory auto-repeal of amending provisions: a provision that amended another act yesterday is
 * repealed today. Enforcement-date provisions are never auto-repealed.
 *
 * <p>Immutable: {@link #accept} returns the accumulator to continue the fold with.</p>
 */
public final class AutoRepealAccumulator {

    private final EnforcementDateResolver enforcementDates;
    private final LocalDate date;
    private final List<AppliableModification> fixupModifications;
    private final List<Reference> positions;

    private AutoRepealAccumulator(EnforcementDateResolver enforcementDates, LocalDate date,
            List<AppliableModification> fixupModifications, List<Reference> positions) {
        this.enforcementDates = enforcementDates;
        this.date = date;
        this.fixupModifications = fixupModifications;
        this.positions = positions;
    }

    /**
     * Starts an empty accumulation.
     *
     * @param enforcementDates enforcement dates of the act being walked
     * @param date date being calculated
     * @param fixupModifications additional modifications of the act; their causes are auto-repealed too
     * @return empty accumulator
     */
    public static AutoRepealAccumulator start(EnforcementDateResolver enforcementDates, LocalDate date,
            List<AppliableModification> fixupModifications) {
        Objects.requireNonNull(enforcementDates, "Enforcement dates are required");
        Objects.requireNonNull(date, "Date is required");
        return new AutoRepealAccumulator(enforcementDates, date,
                fixupModifications == null ? List.of() : List.copyOf(fixupModifications), List.of());
    }

    /**
     * Visits one sub-article element.
     *
     * @param positioned element with its absolute position
     * @return accumulator including the element's position if it must be auto-repealed
     */
    public AutoRepealAccumulator accept(PositionedSae positioned) {
        Reference position = positioned.position();
        if (!enforcementDates.cameIntoForceYesterday(position, date)) {
            return this;
        }
        SpecialPhrase phrase = positioned.element().semanticInfo().specialPhrase();
        boolean repeal = phrase != null && phrase.isAmending();
        ChangeCause asCause = new ChangeCause.Amendment(position);
        for (AppliableModification fixup : fixupModifications) {
            if (fixup.cause().equals(asCause)) {
                repeal = true;
            }
        }
        if (!repeal) {
            return this;
        }
        List<Reference> extended = new ArrayList<>(positions);
        extended.add(position);
        return new AutoRepealAccumulator(enforcementDates, date, fixupModifications, List.copyOf(extended));
    }

    /**
     * Returns the single synthetic repeal covering every recorded position.
     *
     * @return the auto-repeal modification, or empty if nothing must be repealed
     */
    public Optional<AppliableModification> result() {
        if (positions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new AppliableModification(ChangeCause.AUTO_REPEAL, new Modification.Repeal(positions)));
    }

    public List<Reference> positions() {
        return positions;
    }
}
