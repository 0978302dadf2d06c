package com.williamcallahan.actdb.database;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.williamcallahan.actdb.domain.identifier.ActIdentifier;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * State of the database on one day: every known act, keyed by {@code year/number}.
 *
 * <p>Immutable; the {@code with...} methods return modified copies that have to be saved through
 * {@link ActDatabase#saveActSet}.</p>
 *
 * @param acts act entries by act identifier
 */
public record ActSet(SortedMap<String, ActEntry> acts) {

    private static final ActSet EMPTY = new ActSet(null);

    public ActSet {
        acts = acts == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(acts));
    }

    public static ActSet empty() {
        return EMPTY;
    }

    public boolean hasAct(ActIdentifier id) {
        return acts.containsKey(id.toString());
    }

    public Optional<ActEntry> entry(ActIdentifier id) {
        return Optional.ofNullable(acts.get(id.toString()));
    }

    /**
     * Returns every act identifier with its entry, in identifier order of the keys.
     *
     * @return entries by parsed identifier
     */
    @JsonIgnore
    public Map<ActIdentifier, ActEntry> entries() {
        Map<ActIdentifier, ActEntry> result = new TreeMap<>();
        acts.forEach((key, entry) -> result.put(ActIdentifier.parse(key), entry));
        return result;
    }

    public ActSet withEntry(ActIdentifier id, ActEntry entry) {
        SortedMap<String, ActEntry> updated = new TreeMap<>(acts);
        updated.put(id.toString(), entry);
        return new ActSet(updated);
    }

    /**
     * Merges an older state into this one. Entries of {@code older} replace entries of the same
     * act here; acts only present here are kept.
     *
     * @param older state to copy entries from
     * @return merged state
     */
    public ActSet mergedWith(ActSet older) {
        SortedMap<String, ActEntry> updated = new TreeMap<>(acts);
        updated.putAll(older.acts);
        return new ActSet(updated);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return acts.isEmpty();
    }
}
