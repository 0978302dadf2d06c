package com.williamcallahan.actdb.domain.identifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identifies a single act by its publication year and its number within that year.
 *
 * <p>The canonical text form is {@code year/number}, which is also the JSON form and the
 * key used in the act-set state files.</p>
 *
 * @param year publication year
 * @param number number of the act within the year
 */
public record ActIdentifier(int year, int number) implements Comparable<ActIdentifier> {

    public ActIdentifier {
        if (year < 1000 || year > 9999) {
            throw new IllegalArgumentException("Act year must have four digits: " + year);
        }
        if (number <= 0) {
            throw new IllegalArgumentException("Act number must be positive: " + number);
        }
    }

    /**
     * Parses the {@code year/number} form.
     *
     * @param text identifier text such as {@code 2013/5}
     * @return parsed identifier
     * @throws IllegalArgumentException if the text is not in {@code year/number} form
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ActIdentifier parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Act identifier text is required");
        }
        String[] parts = text.trim().split("/");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Act identifier must look like 'year/number': " + text);
        }
        try {
            return new ActIdentifier(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Act identifier must be numeric: " + text, e);
        }
    }

    @Override
    public int compareTo(ActIdentifier other) {
        int byYear = Integer.compare(year, other.year);
        return byYear != 0 ? byYear : Integer.compare(number, other.number);
    }

    @JsonValue
    @Override
    public String toString() {
        return year + "/" + number;
    }
}
