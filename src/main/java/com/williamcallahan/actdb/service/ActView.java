package com.williamcallahan.actdb.service;

import com.williamcallahan.actdb.database.ActMetadata;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.enforcement.EnforcementDateResolver;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * One act as it stood on a date, with what is needed to present it.
 *
 * @param act act version in force on the date
 * @param date viewed date
 * @param metadata modification dates of the act
 * @param enforcementDates enforcement dates of the act, absent if they cannot be computed
 */
public record ActView(Act act, LocalDate date, ActMetadata metadata,
        Optional<EnforcementDateResolver> enforcementDates) {

    public ActView {
        Objects.requireNonNull(act, "Act is required");
        Objects.requireNonNull(date, "Date is required");
        metadata = metadata == null ? ActMetadata.empty() : metadata;
        enforcementDates = enforcementDates == null ? Optional.empty() : enforcementDates;
    }

    /**
     * Same view without enforcement-date markers, for quoted text that belongs to another act.
     *
     * @return view without markers
     */
    public ActView withoutEnforcementDates() {
        return new ActView(act, date, metadata, Optional.empty());
    }
}
