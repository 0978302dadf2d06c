package com.williamcallahan.actdb.domain.identifier;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;

/**
 * Inclusive range of identifiers. A single identifier is a range whose bounds coincide.
 *
 * @param first first identifier in the range
 * @param last last identifier in the range
 */
public record IdentifierRange(Identifier first, Identifier last) {

    public IdentifierRange {
        Objects.requireNonNull(first, "First identifier is required");
        Objects.requireNonNull(last, "Last identifier is required");
        if (first.compareTo(last) > 0) {
            throw new IllegalArgumentException("Identifier range is reversed: " + first + "-" + last);
        }
    }

    public static IdentifierRange single(Identifier id) {
        return new IdentifierRange(id, id);
    }

    public static IdentifierRange single(String id) {
        return single(Identifier.of(id));
    }

    public static IdentifierRange of(String first, String last) {
        return new IdentifierRange(Identifier.of(first), Identifier.of(last));
    }

    @JsonIgnore
    public boolean isRange() {
        return !first.sameSlotAs(last);
    }

    public boolean contains(Identifier id) {
        return id != null && first.compareTo(id) <= 0 && id.compareTo(last) <= 0;
    }

    /**
     * Reports whether the other range lies completely inside this one.
     *
     * @param other range to check
     * @return true if both bounds of {@code other} are within this range
     */
    public boolean contains(IdentifierRange other) {
        return other != null && contains(other.first) && contains(other.last);
    }

    @Override
    public String toString() {
        return isRange() ? first + "-" + last : first.toString();
    }
}
