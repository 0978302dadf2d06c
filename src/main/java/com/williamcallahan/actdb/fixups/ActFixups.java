package com.williamcallahan.actdb.fixups;

import com.williamcallahan.actdb.amender.AppliableModification;
import com.williamcallahan.actdb.domain.semantic.SpecialPhrase;

import java.util.List;

/**
 * Manual corrections for one act: modifications and enforcement dates the parser failed to
 * recognise.
 *
 * <p>Additional modifications should carry the amending provision as their cause so they are
 * extracted, and auto-repealed, together with that provision.</p>
 *
 * @param modifications additional modifications stated by the act
 * @param enforcementDates additional enforcement dates of the act
 */
public record ActFixups(List<AppliableModification> modifications, List<SpecialPhrase.EnforcementDate> enforcementDates) {

    private static final ActFixups EMPTY = new ActFixups(List.of(), List.of());

    public ActFixups {
        modifications = modifications == null ? List.of() : List.copyOf(modifications);
        enforcementDates = enforcementDates == null ? List.of() : List.copyOf(enforcementDates);
    }

    public static ActFixups empty() {
        return EMPTY;
    }
}
