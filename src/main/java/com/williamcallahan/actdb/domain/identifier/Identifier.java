package com.williamcallahan.actdb.domain.identifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifier of an article, paragraph, point, subpoint, structural element or subtitle.
 *
 * <p>Numeric identifiers look like {@code 12}, {@code 12a}, {@code 12/A} or, for articles in
 * acts split into books, {@code 3:12/A}. They are ordered by book, number and then suffix,
 * where a missing suffix sorts first and suffixes compare case-insensitively (so {@code 1a}
 * and {@code 1/A} occupy the same slot). Alphabetic identifiers such as {@code a}, {@code ab}
 * or {@code sz} order lexicographically and sort after every numeric identifier.</p>
 *
 * @param value identifier text as it appears in the act
 */
public record Identifier(String value) implements Comparable<Identifier> {

    private static final Pattern NUMERIC = Pattern.compile("^(?:(\\d+):)?(\\d+)(?:/?([a-zA-Z]+))?$");

    public Identifier {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Identifier value is required");
        }
        value = value.trim();
    }

    /**
     * Creates an identifier from its textual form.
     *
     * @param value identifier text
     * @return identifier
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Identifier of(String value) {
        return new Identifier(value);
    }

    /**
     * Reports whether this identifier has the numeric form (optionally book-prefixed and suffixed).
     *
     * @return true for numeric identifiers
     */
    public boolean isNumeric() {
        return NUMERIC.matcher(value).matches();
    }

    @Override
    public int compareTo(Identifier other) {
        Matcher mine = NUMERIC.matcher(value);
        Matcher theirs = NUMERIC.matcher(other.value);
        boolean mineNumeric = mine.matches();
        boolean theirsNumeric = theirs.matches();
        if (!mineNumeric || !theirsNumeric) {
            if (mineNumeric != theirsNumeric) {
                return mineNumeric ? -1 : 1;
            }
            return value.toLowerCase(Locale.ROOT).compareTo(other.value.toLowerCase(Locale.ROOT));
        }
        int byBook = compareDigits(bookOf(mine), bookOf(theirs));
        if (byBook != 0) {
            return byBook;
        }
        int byNumber = compareDigits(mine.group(2), theirs.group(2));
        if (byNumber != 0) {
            return byNumber;
        }
        return suffixOf(mine).compareTo(suffixOf(theirs));
    }

    /**
     * Compares by ordering slot rather than by exact text.
     *
     * @param other identifier to compare with
     * @return true if both identifiers occupy the same ordering slot
     */
    public boolean sameSlotAs(Identifier other) {
        return other != null && compareTo(other) == 0;
    }

    private static String bookOf(Matcher matcher) {
        String book = matcher.group(1);
        return book == null ? "0" : book;
    }

    /** Compares two digit strings by numeric value, whatever their length. */
    private static int compareDigits(String left, String right) {
        String a = stripLeadingZeros(left);
        String b = stripLeadingZeros(right);
        if (a.length() != b.length()) {
            return Integer.compare(a.length(), b.length());
        }
        return a.compareTo(b);
    }

    private static String stripLeadingZeros(String digits) {
        int start = 0;
        while (start < digits.length() - 1 && digits.charAt(start) == '0') {
            start++;
        }
        return digits.substring(start);
    }

    private static String suffixOf(Matcher matcher) {
        String suffix = matcher.group(3);
        return suffix == null ? "" : suffix.toLowerCase(Locale.ROOT);
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }

    /**
     * Null-safe equality by ordering slot.
     *
     * @param left first identifier, may be null
     * @param right second identifier, may be null
     * @return true if both are null or both occupy the same slot
     */
    public static boolean sameSlot(Identifier left, Identifier right) {
        if (left == null || right == null) {
            return Objects.equals(left, right);
        }
        return left.sameSlotAs(right);
    }
}
