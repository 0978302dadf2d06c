package com.williamcallahan.actdb.amender.text;

import java.util.Optional;

/**
 * Whole-word, accent-aware text replacement used by text amendments.
 *
 * A match must start at a word boundary (the start of the text, the first character of an
 * alphanumeric run, or any non-alphanumeric character) and must not be followed by an
 * alphanumeric character. Alphanumeric means ASCII letters and digits plus the accented
 * letters of the Hungarian alphabet.
 */
public final class TextReplacer {

    private static final String HUNGARIAN_ACCENTED_LETTERS = "áéíóöőúüűÁÉÍÓÖŐÚÜŰ";

    private TextReplacer() {
        // Utility class - no instantiation
    }

    /**
     * Replaces every non-overlapping whole-word occurrence of {@code from} with {@code to}.
     *
     * <p>Both {@code from} and {@code to} are stripped first. The result is stripped and each
     * double space is replaced by a single one, once, left to right.</p>
     *
     * @param text text to edit
     * @param from text to look for
     * @param to replacement text
     * @return the edited text, or empty if {@code from} does not occur as a whole word
     */
    public static Optional<String> normalizedReplace(String text, String from, String to) {
        if (text == null || from == null || to == null) {
            return Optional.empty();
        }
        String needle = from.strip();
        String replacement = to.strip();
        if (needle.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder result = null;
        int copiedUpTo = 0;
        boolean previousAlphanumeric = false;
        for (int index = 0; index < text.length(); index++) {
            boolean currentAlphanumeric = isAlphanumeric(text.charAt(index));
            boolean boundary = !currentAlphanumeric || !previousAlphanumeric;
            previousAlphanumeric = currentAlphanumeric;
            if (!boundary || index < copiedUpTo || !text.startsWith(needle, index)) {
                continue;
            }
            int end = index + needle.length();
            if (end < text.length() && isAlphanumeric(text.charAt(end))) {
                continue;
            }
            if (result == null) {
                result = new StringBuilder(text.length());
            }
            result.append(text, copiedUpTo, index).append(replacement);
            copiedUpTo = end;
        }
        if (result == null) {
            return Optional.empty();
        }
        result.append(text, copiedUpTo, text.length());
        return Optional.of(result.toString().strip().replace("  ", " "));
    }

    /**
     * Reports whether the character counts as part of a word.
     *
     * @param character character to classify
     * @return true for ASCII letters and digits and accented Hungarian letters
     */
    public static boolean isAlphanumeric(char character) {
        return (character >= 'a' && character <= 'z')
                || (character >= 'A' && character <= 'Z')
                || (character >= '0' && character <= '9')
                || HUNGARIAN_ACCENTED_LETTERS.indexOf(character) >= 0;
    }
}
