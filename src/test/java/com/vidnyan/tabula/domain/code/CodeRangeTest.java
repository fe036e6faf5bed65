package com.vidnyan.tabula.domain.code;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CodeRangeTest {

    @Test
    void intRange_ShouldIncludeBothBounds() {
        IntRange range = new IntRange(1, 7);

        assertFalse(range.contains(0));
        assertTrue(range.contains(1));
        assertTrue(range.contains(4));
        assertTrue(range.contains(7));
        assertFalse(range.contains(8));
    }

    @Test
    void intRange_WithStartAfterEnd_ShouldContainNothing() {
        IntRange range = new IntRange(9, 3);

        assertFalse(range.contains(3));
        assertFalse(range.contains(6));
        assertFalse(range.contains(9));
    }

    @Test
    void strRange_ShouldCompareLexicographicallyWithinLengthBounds() {
        StrRange range = new StrRange("A01", "A98");

        assertFalse(range.contains("A00"));
        assertTrue(range.contains("A01"));
        assertFalse(range.contains("B01"));
        assertTrue(range.contains("A10"));
        assertTrue(range.contains("A98"));
        assertFalse(range.contains("A99"));
        assertFalse(range.contains("A100"));
    }

    @Test
    void strRange_ShouldRejectShorterCodesThatSortInside() {
        StrRange range = new StrRange("10", "99");

        assertTrue(range.contains("50"));
        assertFalse(range.contains("9"));
        assertFalse(range.contains("5"));
    }

    @Test
    void strRange_WithMixedBoundLengths_ShouldAcceptBothLengths() {
        StrRange range = new StrRange("9", "99");

        assertTrue(range.contains("9"));
        assertTrue(range.contains("90"));
        assertFalse(range.contains("999"));
    }

    @Test
    void ranges_ShouldNeverContainCodesOfTheOtherKind() {
        assertFalse(new IntRange(0, 99).contains(Code.of("50")));
        assertFalse(new StrRange("00", "99").contains(Code.of(50)));
        assertTrue(new IntRange(0, 99).contains(Code.of(50)));
        assertTrue(new StrRange("00", "99").contains(Code.of("50")));
    }

    @Test
    void codes_OfDifferentKinds_ShouldNotBeEqual() {
        assertNotEquals(Code.of("02"), Code.of(2));
        assertEquals(Code.of(2), new IntCode(2));
        assertEquals(Code.of("  "), new StrCode("  "));
    }

    @Test
    void parse_ShouldCoerceDigitsUnlessLetterCodes() {
        assertEquals(Code.of(35), Code.parse("35", false));
        assertEquals(Code.of(2), Code.parse("02", false));
        assertEquals(Code.of("35"), Code.parse("35", true));
        assertEquals(Code.of("SP"), Code.parse("SP", false));
        assertEquals(Code.of(" 1"), Code.parse(" 1", false));
        assertEquals(Code.of("99999999999"), Code.parse("99999999999", false));
    }
}
