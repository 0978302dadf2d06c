package com.williamcallahan.actdb.database;

import com.williamcallahan.actdb.domain.identifier.ActIdentifier;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.enforcement.EnforcementDateResolver;
import com.williamcallahan.actdb.fixups.FixupStore;
import com.williamcallahan.actdb.persistence.KeyType;
import com.williamcallahan.actdb.persistence.Persistence;
import com.williamcallahan.actdb.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Daily act states, act bodies and per-act metadata on top of {@link Persistence}.
 *
 * <p>Daily states live at {@code state/YYYY/MM/DD}, act bodies under content-derived keys with
 * the {@code act} prefix, and metadata at {@code act_metadata/<year>/<number>}.</p>
 */
@Service
public class ActDatabase {

    private static final Logger log = LoggerFactory.getLogger(ActDatabase.class);
    private static final DateTimeFormatter STATE_KEY_FORMAT = DateTimeFormatter.ofPattern("'state/'yyyy/MM/dd");
    private static final String ACT_KEY_PREFIX = "act";

    private final Persistence persistence;
    private final FixupStore fixupStore;

    public ActDatabase(Persistence persistence, FixupStore fixupStore) {
        this.persistence = persistence;
        this.fixupStore = fixupStore;
    }

    static String stateKey(LocalDate date) {
        return STATE_KEY_FORMAT.format(date);
    }

    static String metadataKey(ActIdentifier id) {
        return "act_metadata/" + id.year() + "/" + id.number();
    }

    /**
     * Loads the state of a day. Days never saved are empty.
     *
     * @param date day to load
     * @return the state
     */
    public ActSet actSet(LocalDate date) {
        String key = stateKey(date);
        if (!persistence.exists(key)) {
            return ActSet.empty();
        }
        try {
            return persistence.load(key, ActSet.class);
        } catch (PersistenceException e) {
            throw new PersistenceException("Could not load act set with key " + key, e);
        }
    }

    /**
     * Cached, asynchronous variant of {@link #actSet(LocalDate)}.
     *
     * @param date day to load
     * @return future state
     */
    public CompletableFuture<ActSet> actSetAsync(LocalDate date) {
        String key = stateKey(date);
        if (!persistence.exists(key)) {
            return CompletableFuture.completedFuture(ActSet.empty());
        }
        return persistence.loadAsync(key, ActSet.class);
    }

    public void saveActSet(LocalDate date, ActSet actSet) {
        persistence.store(KeyType.forced(stateKey(date)), actSet);
    }

    /**
     * Copies the state of {@code from} to {@code to}. If {@code to} was never written (or is itself
     * a copy), it becomes a link to {@code from}; otherwise the entries of {@code from} are merged
     * into it, replacing entries of the same acts.
     *
     * @param from source day
     * @param to target day
     */
    public void copyActSet(LocalDate from, LocalDate to) {
        String fromKey = stateKey(from);
        String toKey = stateKey(to);
        if (persistence.exists(fromKey) && (!persistence.exists(toKey) || persistence.isLink(toKey))) {
            log.debug("Linking state {} to {}", from, to);
            persistence.link(fromKey, toKey);
            return;
        }
        ActSet merged = actSet(to).mergedWith(actSet(from));
        saveActSet(to, merged);
    }

    /**
     * Stores an act body and computes its database entry. The returned state still has to be
     * saved, or the stored body dangles.
     *
     * @param actSet state to add the act to
     * @param act act body
     * @return state with the new entry
     */
    public ActSet storeAct(ActSet actSet, Act act) {
        String actKey = persistence.store(KeyType.calculated(ACT_KEY_PREFIX), act);
        List<LocalDate> enforcementDates = act.children().isEmpty()
                ? List.of()
                : EnforcementDateResolver.fromAct(act, fixupStore.forAct(act.identifier()).enforcementDates())
                        .allDates();
        return actSet.withEntry(act.identifier(), new ActEntry(actKey, enforcementDates));
    }

    public Act loadAct(ActEntry entry) {
        return persistence.load(entry.actKey(), Act.class);
    }

    public CompletableFuture<Act> loadActAsync(ActEntry entry) {
        return persistence.loadAsync(entry.actKey(), Act.class);
    }

    public ActMetadata actMetadata(ActIdentifier id) {
        String key = metadataKey(id);
        return persistence.exists(key) ? persistence.load(key, ActMetadata.class) : ActMetadata.empty();
    }

    public void saveActMetadata(ActIdentifier id, ActMetadata metadata) {
        persistence.store(KeyType.forced(metadataKey(id)), metadata);
    }
}
