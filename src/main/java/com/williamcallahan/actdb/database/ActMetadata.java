package com.williamcallahan.actdb.database;

import java.time.LocalDate;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Per-act data that is independent of the daily states.
 *
 * @param modificationDates dates on which the act changed, by amendment or by coming into force
 */
public record ActMetadata(SortedSet<LocalDate> modificationDates) {

    private static final ActMetadata EMPTY = new ActMetadata(null);

    public ActMetadata {
        modificationDates = modificationDates == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(modificationDates));
    }

    public static ActMetadata empty() {
        return EMPTY;
    }

    public ActMetadata withModificationDate(LocalDate date) {
        if (modificationDates.contains(date)) {
            return this;
        }
        SortedSet<LocalDate> updated = new TreeSet<>(modificationDates);
        updated.add(date);
        return new ActMetadata(updated);
    }
}
