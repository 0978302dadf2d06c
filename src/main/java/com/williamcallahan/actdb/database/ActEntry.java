package com.williamcallahan.actdb.database;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Database entry of one act in a daily state. Cheap to read; the act body itself is loaded
 * separately through its storage key.
 *
 * @param actKey storage key of the act body, usually content-derived
 * @param enforcementDates every enforcement date of the act, cached so that recalculation can skip
 *                         acts without loading them
 */
public record ActEntry(String actKey, List<LocalDate> enforcementDates) {

    public ActEntry {
        Objects.requireNonNull(actKey, "Act storage key is required");
        enforcementDates = enforcementDates == null ? List.of() : List.copyOf(enforcementDates);
    }

    /**
     * Reports whether anything in the act comes into force on the date or on the day before it.
     * Provisions that came into force yesterday are auto-repealed today.
     *
     * @param date date being recalculated
     * @return true if the act has to be visited on that date
     */
    public boolean isDateInteresting(LocalDate date) {
        return enforcementDates.contains(date) || enforcementDates.contains(date.minusDays(1));
    }
}
