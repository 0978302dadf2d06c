package com.williamcallahan.actdb.service;

import com.williamcallahan.actdb.database.ActDatabase;
import com.williamcallahan.actdb.domain.identifier.ActIdentifier;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.enforcement.EnforcementDateException;
import com.williamcallahan.actdb.enforcement.EnforcementDateResolver;
import com.williamcallahan.actdb.fixups.FixupStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Read side of the database: acts as they stood on a given date.
 */
@Service
public class ActQueryService {

    private static final Logger log = LoggerFactory.getLogger(ActQueryService.class);

    private final ActDatabase database;
    private final FixupStore fixupStore;

    public ActQueryService(ActDatabase database, FixupStore fixupStore) {
        this.database = database;
        this.fixupStore = fixupStore;
    }

    /**
     * Looks up an act through the cache.
     *
     * @param id act identifier
     * @param date viewed date
     * @return future act version, empty if the act is not in the state of that date
     */
    public CompletableFuture<Optional<Act>> actOn(ActIdentifier id, LocalDate date) {
        return database.actSetAsync(date).thenCompose(state -> state.entry(id)
                .map(entry -> database.loadActAsync(entry).thenApply(Optional::of))
                .orElseGet(() -> CompletableFuture.completedFuture(Optional.empty())));
    }

    /**
     * Looks up an act together with its metadata and enforcement dates.
     *
     * @param id act identifier
     * @param date viewed date
     * @return the view, empty if the act is not in the state of that date
     */
    public Optional<ActView> view(ActIdentifier id, LocalDate date) {
        return actOn(id, date).join()
                .map(act -> new ActView(act, date, database.actMetadata(id), enforcementDates(act)));
    }

    private Optional<EnforcementDateResolver> enforcementDates(Act act) {
        if (act.children().isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(EnforcementDateResolver.fromAct(act,
                    fixupStore.forAct(act.identifier()).enforcementDates()));
        } catch (EnforcementDateException e) {
            log.warn("Enforcement dates of {} are unavailable, showing it without markers: {}", act, e.getMessage());
            return Optional.empty();
        }
    }
}
