package com.williamcallahan.actdb.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.actdb.database.ActDatabase;
import com.williamcallahan.actdb.database.ActEntry;
import com.williamcallahan.actdb.database.ActMetadata;
import com.williamcallahan.actdb.database.ActSet;
import com.williamcallahan.actdb.domain.structure.Act;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Adds parsed acts to the state of their publication date.
 *
 * <p>Input files hold one JSON-encoded {@link Act}, optionally gzipped ({@code .gz}).</p>
 */
@Service
public class ActIngestionService {

    private static final Logger log = LoggerFactory.getLogger(ActIngestionService.class);

    private final ActDatabase database;
    private final ObjectMapper objectMapper;

    public ActIngestionService(ActDatabase database, ObjectMapper objectMapper) {
        this.database = database;
        this.objectMapper = objectMapper;
    }

    /**
     * Adds every file; a failing file does not stop the others.
     *
     * @param paths act files
     * @return number of stored acts and per-file failures
     */
    public ActIngestionOutcome addAll(List<Path> paths) {
        int processed = 0;
        List<ActIngestionFailure> failures = new ArrayList<>();
        for (Path path : paths) {
            Act act;
            try {
                act = read(path);
            } catch (IOException | RuntimeException e) {
                log.error("Error reading {}: {}", path, e.getMessage());
                failures.add(new ActIngestionFailure(path.toString(), "read", String.valueOf(e.getMessage())));
                continue;
            }
            try {
                add(act);
                processed++;
            } catch (RuntimeException e) {
                log.error("Error storing {} from {}: {}", act, path, e.getMessage());
                log.debug("Stack trace:", e);
                failures.add(new ActIngestionFailure(path.toString(), "store", String.valueOf(e.getMessage())));
            }
        }
        return ActIngestionOutcome.success(processed, failures);
    }

    /**
     * Stores the act in the state of its publication date and records its enforcement dates as
     * modification dates.
     *
     * @param act act to add
     * @return the act's new database entry
     */
    public ActEntry add(Act act) {
        log.info("Adding {} to state at {}", act.identifier(), act.publicationDate());
        ActSet state = database.storeAct(database.actSet(act.publicationDate()), act);
        database.saveActSet(act.publicationDate(), state);
        ActEntry entry = state.entry(act.identifier()).orElseThrow();

        ActMetadata metadata = database.actMetadata(act.identifier())
                .withModificationDate(act.publicationDate());
        for (var date : entry.enforcementDates()) {
            metadata = metadata.withModificationDate(date);
        }
        database.saveActMetadata(act.identifier(), metadata);
        return entry;
    }

    private Act read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            if (path.getFileName().toString().endsWith(".gz")) {
                try (InputStream gzip = new GZIPInputStream(in)) {
                    return objectMapper.readValue(gzip, Act.class);
                }
            }
            return objectMapper.readValue(in, Act.class);
        }
    }
}
