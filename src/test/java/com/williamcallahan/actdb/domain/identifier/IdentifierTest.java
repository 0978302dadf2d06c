package com.williamcallahan.actdb.domain.identifier;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Verifies the ordering of {@link Identifier}.
 */
class IdentifierTest {

    private static boolean before(String left, String right) {
        return Identifier.of(left).compareTo(Identifier.of(right)) < 0;
    }

    @Test
    void compareTo_ordersNumbersNumerically() {
        assertTrue(before("2", "10"));
        assertTrue(before("9", "12345678901"));
        assertTrue(before("12345678901", "12345678902"));
        assertFalse(before("12345678901234567890", "99"));
    }

    @Test
    void compareTo_ordersByBookThenNumberThenSuffix() {
        assertTrue(before("2:99", "3:1"));
        assertTrue(before("12", "12a"));
        assertTrue(before("12a", "12b"));
        assertTrue(before("12b", "13"));
        assertTrue(before("99999999999:1", "100000000000:1"));
    }

    @Test
    void compareTo_sortsAlphabeticAfterNumeric() {
        assertTrue(before("100", "a"));
        assertTrue(before("a", "b"));
    }

    @Test
    void sameSlotAs_ignoresSuffixSeparatorCaseAndLeadingZeros() {
        assertTrue(Identifier.of("1a").sameSlotAs(Identifier.of("1/A")));
        assertTrue(Identifier.of("007").sameSlotAs(Identifier.of("7")));
        assertFalse(Identifier.of("1a").sameSlotAs(Identifier.of("1")));
    }
}
