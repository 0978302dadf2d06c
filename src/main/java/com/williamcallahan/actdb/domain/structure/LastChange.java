package com.williamcallahan.actdb.domain.structure;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Stamp recording when and why an element was last modified.
 *
 * @param date date the modification took effect
 * @param cause the amending provision or an opaque label
 */
public record LastChange(LocalDate date, ChangeCause cause) {

    public LastChange {
        Objects.requireNonNull(date, "Change date is required");
        Objects.requireNonNull(cause, "Change cause is required");
    }
}
