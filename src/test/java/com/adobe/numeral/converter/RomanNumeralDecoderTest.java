package com.adobe.numeral.converter;

import com.adobe.numeral.exception.FormatException;
import com.adobe.numeral.exception.InvalidInputException;
import com.adobe.numeral.exception.UnsupportedNumeralException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Roman numeral decoding through StandardRomanNumeralConverter.
 */
@DisplayName("Roman Numeral Decoding Tests")
class RomanNumeralDecoderTest {

    private StandardRomanNumeralConverter converter;

    @BeforeEach
    void setUp() {
        converter = new StandardRomanNumeralConverter();
    }

    @Nested
    @DisplayName("Lenient Decoding")
    class Lenient {

        @ParameterizedTest(name = "{0} should decode to {1}")
        @CsvSource({
            "I, 1",
            "IV, 4",
            "XIV, 14",
            "MCMXCIV, 1994",
            "MDCLXVI, 1666",
            "MMMDCDLXLIX, 3999",
            "IIII, 4",
            "IC, 99",
            "IIM, 998",
            "VL, 45",
            "MMMMMM, 6000"
        })
        void shouldDecodeAscii(String input, long expected) {
            assertEquals(expected, converter.decode(input));
        }

        @ParameterizedTest(name = "{0} should decode to {1}")
        @CsvSource({
            "ⅯⅮⅭⅬⅩⅥ, 1666",
            "ⅩⅬⅣ, 44",
            "ⅩⅫ, 22",
            "ⅿⅾⅽⅼⅹⅵ, 1666",
            "mdclxvi, 1666",
            "ↆↅ, 56",
            "ⅩⅩↅ, 26"
        })
        void shouldNormalizeGlyphsAndCase(String input, long expected) {
            assertEquals(expected, converter.decode(input));
        }

        @Test
        @DisplayName("Surrounding whitespace is ignored")
        void shouldStripWhitespace() {
            assertEquals(14, converter.decode("  XIV\t"));
        }

        @Test
        @DisplayName("Zero symbol")
        void shouldDecodeZero() {
            assertEquals(0, converter.decode("N"));
            assertEquals(0, converter.decode("n"));
            assertEquals(0, converter.decode("-N"));
        }

        @Test
        @DisplayName("Leading sign makes the result negative")
        void shouldDecodeNegative() {
            assertEquals(-42, converter.decode("-XLII"));
            assertEquals(-42, converter.decode("~XLII", false, RomanGrammar.STANDARD, "~"));
            assertEquals(-5, converter.decode("neg V", false, RomanGrammar.STANDARD, "neg "));
        }
    }

    @Nested
    @DisplayName("Strict Decoding")
    class Strict {

        @ParameterizedTest(name = "{0} is canonical")
        @CsvSource({
            "MCMXCIV, 1994",
            "MMMCMXCIX, 3999",
            "ⅩⅬⅣ, 44",
            "xiv, 14"
        })
        void shouldAcceptCanonical(String input, long expected) {
            assertEquals(expected, converter.decode(input, true));
        }

        @ParameterizedTest(name = "{0} is rejected")
        @ValueSource(strings = {"IIII", "IC", "IIM", "VL", "MMMMMM", "N", "MMMDCDLXLIX"})
        void shouldRejectNonCanonical(String input) {
            assertThrows(FormatException.class, () -> converter.decode(input, true));
        }

        @Test
        @DisplayName("Caller grammar replaces the canonical one")
        void shouldUseCustomGrammar() {
            assertEquals(4, converter.decode("IIII", true, numeral -> true, "-"));
            assertThrows(FormatException.class,
                () -> converter.decode("XIV", true, numeral -> false, "-"));
        }

        @Test
        @DisplayName("Grammar is ignored when not strict")
        void shouldIgnoreGrammarWhenLenient() {
            assertEquals(4, converter.decode("IIII", false, numeral -> false, "-"));
        }
    }

    @Nested
    @DisplayName("Invalid Input")
    class InvalidInput {

        @ParameterizedTest(name = "''{0}'' is invalid")
        @ValueSource(strings = {"", "   ", "-", "ABC", "XIZ", "X-LII", "XLII-", "--X", "NI", "XN"})
        void shouldRejectInvalid(String input) {
            assertThrows(InvalidInputException.class, () -> converter.decode(input));
        }

        @Test
        @DisplayName("Null input is invalid")
        void shouldRejectNull() {
            assertThrows(InvalidInputException.class, () -> converter.decode(null));
        }

        @Test
        @DisplayName("Empty sign is invalid")
        void shouldRejectEmptySign() {
            assertThrows(InvalidInputException.class,
                () -> converter.decode("X", false, RomanGrammar.STANDARD, ""));
        }

        @Test
        @DisplayName("Message names the offending character")
        void shouldNameOffendingCharacter() {
            InvalidInputException ex = assertThrows(InvalidInputException.class,
                () -> converter.decode("XIZ"));
            assertTrue(ex.getMessage().contains("'Z'"));
        }
    }

    @Nested
    @DisplayName("Large-number Notation")
    class LargeNumbers {

        @ParameterizedTest(name = "{0} is recognized but not decoded")
        @ValueSource(strings = {"ⅭↀↃ", "ⅯⅮↃ", "CCDO", "MDO", "ↂ", "ↁ", "ⅮↃ", "ↀ", "ↂↁⅯ", "-ↂ"})
        void shouldRejectLargeNotation(String input) {
            assertThrows(UnsupportedNumeralException.class, () -> converter.decode(input));
        }

        @Test
        @DisplayName("Checked before strict validation")
        void shouldReportUnsupportedBeforeFormat() {
            assertThrows(UnsupportedNumeralException.class, () -> converter.decode("ⅭↀↃ", true));
        }
    }

    @Nested
    @DisplayName("Round Trips")
    class RoundTrips {

        @Test
        @DisplayName("Default options over -3999..3999")
        void shouldRoundTripDefault() {
            assertRoundTrip(RomanOptions.defaults());
        }

        @Test
        @DisplayName("ASCII over -3999..3999")
        void shouldRoundTripAscii() {
            assertRoundTrip(RomanOptions.builder().onlyAscii(true).build());
        }

        @Test
        @DisplayName("Additive-only over -3999..3999")
        void shouldRoundTripAdditive() {
            assertRoundTrip(RomanOptions.builder().onlyAdditive(true).build());
        }

        @Test
        @DisplayName("Lowercase archaic over -3999..3999")
        void shouldRoundTripLowercaseArchaic() {
            assertRoundTrip(RomanOptions.builder().uppercase(false).archaic(true).build());
        }

        private void assertRoundTrip(RomanOptions options) {
            for (int i = -3999; i <= 3999; i++) {
                String numeral = converter.encode(i, options);
                assertEquals(i, converter.decode(numeral), () -> "Round trip failed for " + numeral);
            }
        }
    }
}
