package com.williamcallahan.actdb.domain.semantic;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.LocalDate;
import java.util.Objects;

/**
 * How an enforcement-date phrase expresses its date.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = EnforcementDateType.Date.class, name = "Date"),
    @JsonSubTypes.Type(value = EnforcementDateType.DaysAfterPublication.class, name = "DaysAfterPublication"),
    @JsonSubTypes.Type(value = EnforcementDateType.DayInMonthAfterPublication.class,
            name = "DayInMonthAfterPublication"),
    @JsonSubTypes.Type(value = EnforcementDateType.Special.class, name = "Special")
})
public sealed interface EnforcementDateType permits EnforcementDateType.Date,
        EnforcementDateType.DaysAfterPublication, EnforcementDateType.DayInMonthAfterPublication,
        EnforcementDateType.Special {

    /**
     * Absolute calendar date.
     *
     * @param date the date
     */
    record Date(LocalDate date) implements EnforcementDateType {
        public Date {
            Objects.requireNonNull(date, "Date is required");
        }
    }

    /**
     * "On the N-th day after publication."
     *
     * @param days number of days after publication
     */
    record DaysAfterPublication(int days) implements EnforcementDateType {
        public DaysAfterPublication {
            if (days < 0) {
                throw new IllegalArgumentException("Days after publication must be non-negative");
            }
        }
    }

    /**
     * "On day D of the M-th month after publication."
     *
     * @param month months after publication; null means the month after publication
     * @param day day of month
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record DayInMonthAfterPublication(Integer month, int day) implements EnforcementDateType {
        public DayInMonthAfterPublication {
            if (month != null && month < 1) {
                throw new IllegalArgumentException("Month offset must be positive");
            }
            if (day < 1 || day > 31) {
                throw new IllegalArgumentException("Day of month out of range: " + day);
            }
        }

        public int monthOrDefault() {
            return month == null ? 1 : month;
        }
    }

    /**
     * Date given by a condition the parser could not express (e.g. "on the day the treaty enters
     * into force"). Resolving it is unsupported.
     *
     * @param description phrase text
     */
    record Special(String description) implements EnforcementDateType {
    }
}
