package com.roundpilot.core.screen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReadingParserTest {

    @Nested
    @DisplayName("parseNumber")
    class NumberTests {

        @Test
        @DisplayName("strips the multiplier marker")
        void multiplier() {
            assertEquals(2.35, ReadingParser.parseNumber("2.35x"));
        }

        @Test
        @DisplayName("strips spaces and thousands separators")
        void separators() {
            assertEquals(12500.5, ReadingParser.parseNumber(" 12,500.50 RSD"));
        }

        @Test
        @DisplayName("text without digits is a read failure")
        void noDigits() {
            assertThrows(ReadException.class, () -> ReadingParser.parseNumber("FLEW AWAY"));
        }

        @Test
        @DisplayName("several dots is a read failure")
        void severalDots() {
            assertThrows(ReadException.class, () -> ReadingParser.parseNumber("1.2.3"));
        }

        @Test
        @DisplayName("null text is a read failure")
        void nullText() {
            assertThrows(ReadException.class, () -> ReadingParser.parseNumber(null));
        }
    }

    @Nested
    @DisplayName("player counts")
    class PlayerTests {

        @Test
        @DisplayName("current/total yields both parts")
        void currentAndTotal() {
            assertEquals(312, ReadingParser.parsePlayerCurrent("312/1,204"));
            assertEquals(1204, ReadingParser.parsePlayerTotal("312/1,204"));
        }

        @Test
        @DisplayName("a bare number is used for both")
        void bareNumber() {
            assertEquals(88, ReadingParser.parsePlayerTotal("88"));
            assertEquals(88, ReadingParser.parsePlayerCurrent("88"));
        }

        @Test
        @DisplayName("missing total is a read failure")
        void missingTotal() {
            assertThrows(ReadException.class, () -> ReadingParser.parsePlayerTotal("312/"));
        }
    }
}
