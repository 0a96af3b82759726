package com.adobe.numeral.converter;

import com.adobe.numeral.converter.StringRewriter.Replacement;
import com.adobe.numeral.exception.FormatException;
import com.adobe.numeral.exception.InvalidInputException;
import com.adobe.numeral.exception.UnsupportedNumeralException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.adobe.numeral.converter.StringRewriter.rewrite;

/**
 * Roman numeral to integer decoder.
 * 
 * <p>Pipeline: trim, sign, uppercase, normalize every accepted glyph to the
 * ASCII symbols {@code IVXLCDMN}, validate, then scan.</p>
 * 
 * <p>The scan is a lookahead rule rather than a grammar: a symbol is
 * subtracted when any later symbol is strictly larger, otherwise added. This
 * accepts some malformed numerals on purpose ({@code IIM} = 998,
 * {@code VL} = 45); strict mode is the way to reject them.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
final class RomanNumeralDecoder {

    private static final char ENCLOSURE = RomanSymbols.ASCII_ENCLOSURE.charAt(0);

    /**
     * Archaic ligatures back to standard glyphs, then everything to ASCII.
     */
    private static final List<Replacement> NORMALIZATION;

    static {
        List<Replacement> normalization = new ArrayList<>(StringRewriter.inverse(RomanSymbols.ARCHAIC));
        normalization.addAll(RomanSymbols.UNICODE_TO_ASCII);
        NORMALIZATION = List.copyOf(normalization);
    }

    long decode(String text, boolean strict, RomanGrammar grammar, String negativeSign) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Roman numeral must not be empty");
        }
        if (negativeSign == null || negativeSign.isEmpty()) {
            throw new InvalidInputException("Negative sign must not be empty");
        }

        String body = text.strip();
        boolean negative = body.startsWith(negativeSign);
        if (negative) {
            body = body.substring(negativeSign.length());
        }
        if (body.contains(negativeSign)) {
            throw new InvalidInputException(String.format(
                "Sign '%s' is only allowed at the start, got: %s", negativeSign, text));
        }

        body = body.toUpperCase(Locale.ROOT);
        boolean largeNotation = containsAny(body, RomanSymbols.LARGE_NUMBER_GLYPHS);
        String numeral = rewrite(body, NORMALIZATION);

        if (numeral.isEmpty()) {
            throw new InvalidInputException("No symbols after sign in: " + text);
        }
        for (int i = 0; i < numeral.length(); i++) {
            char c = numeral.charAt(i);
            if (!RomanSymbols.ASCII_VALUES.containsKey(c) && c != ENCLOSURE) {
                throw new InvalidInputException(String.format(
                    "Invalid character '%c' in Roman numeral: %s", c, text));
            }
        }
        if (numeral.contains(RomanSymbols.ZERO) && numeral.length() > 1) {
            throw new InvalidInputException("Zero symbol cannot be combined with other symbols: " + text);
        }
        if (largeNotation || numeral.contains(RomanSymbols.ASCII_ENCLOSURE)) {
            throw new UnsupportedNumeralException("Decoding of large-number notation is not supported: " + text);
        }
        if (strict && !grammar.matches(numeral)) {
            throw new FormatException("Not a valid Roman numeral in strict mode: " + text);
        }

        long number = scan(numeral);
        return negative ? -number : number;
    }

    /**
     * Adds each symbol, or subtracts it when a strictly larger one follows anywhere.
     */
    private static long scan(String numeral) {
        long total = 0;
        long largestAfter = 0;
        for (int i = numeral.length() - 1; i >= 0; i--) {
            long value = RomanSymbols.ASCII_VALUES.get(numeral.charAt(i));
            if (value < largestAfter) {
                total -= value;
            } else {
                total += value;
                largestAfter = value;
            }
        }
        return total;
    }

    private static boolean containsAny(String text, String glyphs) {
        for (int i = 0; i < glyphs.length(); i++) {
            if (text.indexOf(glyphs.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }
}
