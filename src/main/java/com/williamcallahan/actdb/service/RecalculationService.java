package com.williamcallahan.actdb.service;

import com.williamcallahan.actdb.database.ActDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Rolls the database forward day by day.
 */
@Service
public class RecalculationService {

    private static final Logger log = LoggerFactory.getLogger(RecalculationService.class);

    private final ActDatabase database;
    private final AmendmentApplicationDriver driver;

    public RecalculationService(ActDatabase database, AmendmentApplicationDriver driver) {
        this.database = database;
        this.driver = driver;
    }

    /**
     * Recalculates every date after {@code from} and before {@code to}. Each date starts from a copy
     * of the previous day's state.
     *
     * @param from last date whose state is taken as given
     * @param to first date not recalculated
     * @return one outcome per recalculated date
     * @throws IllegalArgumentException if {@code to} is not after {@code from}
     */
    public List<AmendmentOutcome> recalculate(LocalDate from, LocalDate to) {
        if (!to.isAfter(from)) {
            throw new IllegalArgumentException("Recalculation end " + to + " must be after start " + from);
        }
        List<AmendmentOutcome> outcomes = new ArrayList<>();
        for (LocalDate date = from.plusDays(1); date.isBefore(to); date = date.plusDays(1)) {
            log.info("Recalculating {}", date);
            database.copyActSet(date.minusDays(1), date);
            outcomes.add(driver.applyDate(date));
        }
        return outcomes;
    }
}
