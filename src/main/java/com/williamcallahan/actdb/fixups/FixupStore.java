package com.williamcallahan.actdb.fixups;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.actdb.amender.AppliableModification;
import com.williamcallahan.actdb.config.AppProperties;
import com.williamcallahan.actdb.domain.identifier.ActIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * Loads fixup files from the configured fixups directory.
 *
 * <ul>
 *   <li>{@code act/<year>/<year>-<number>.json}: {@link ActFixups} of one act</li>
 *   <li>{@code date/<yyyy-MM-dd>.json}: list of {@link AppliableModification} applied on that date
 *       regardless of which act states them</li>
 * </ul>
 * Missing files mean "no fixups".
 */
@Component
public class FixupStore {
    private static final Logger log = LoggerFactory.getLogger(FixupStore.class);

    private final Path fixupsDir;
    private final ObjectMapper objectMapper;

    @Autowired
    public FixupStore(AppProperties appProperties, ObjectMapper objectMapper) {
        this(Path.of(appProperties.getFixups().getDir()), objectMapper);
    }

    public FixupStore(Path fixupsDir, ObjectMapper objectMapper) {
        this.fixupsDir = fixupsDir;
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the fixups of one act.
     *
     * @param act act identifier
     * @return fixups of the act, empty if there is no fixup file
     * @throws FixupLoadException if the file exists but cannot be parsed
     */
    public ActFixups forAct(ActIdentifier act) {
        Path file = fixupsDir.resolve("act")
                .resolve(String.valueOf(act.year()))
                .resolve(act.year() + "-" + act.number() + ".json");
        if (!Files.exists(file)) {
            return ActFixups.empty();
        }
        try {
            ActFixups fixups = objectMapper.readValue(file.toFile(), ActFixups.class);
            log.info("Fixup: using {} additional modifications and {} additional enforcement dates for {}",
                    fixups.modifications().size(), fixups.enforcementDates().size(), act);
            return fixups;
        } catch (IOException e) {
            throw new FixupLoadException("Could not load fixups of " + act + " from " + file, e);
        }
    }

    /**
     * Loads the date-specific modifications.
     *
     * @param date date of the recalculation step
     * @return modifications to apply on that date, empty if there is no fixup file
     * @throws FixupLoadException if the file exists but cannot be parsed
     */
    public List<AppliableModification> forDate(LocalDate date) {
        Path file = fixupsDir.resolve("date").resolve(date + ".json");
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<AppliableModification> modifications =
                    objectMapper.readValue(file.toFile(), new TypeReference<List<AppliableModification>>() {});
            log.info("Fixup: using {} additional date-specific modifications for {}", modifications.size(), date);
            return List.copyOf(modifications);
        } catch (IOException e) {
            throw new FixupLoadException("Could not load date fixups for " + date + " from " + file, e);
        }
    }
}
