package com.adobe.numeral.converter;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Letter-based bijective numbering, as used for spreadsheet columns.
 * 
 * <p>Each character of the alphabet is one digit token, so with the default
 * alphabet 0 → "a", 25 → "z", 26 → "aa", 702 → "aaa" and 1983 → "bxh".</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
@Component
public class LetterConverter {

    /**
     * The 26 lowercase ASCII letters.
     */
    public static final String DEFAULT_ALPHABET = "abcdefghijklmnopqrstuvwxyz";

    private final TokenConverter tokenConverter;

    public LetterConverter(TokenConverter tokenConverter) {
        this.tokenConverter = tokenConverter;
    }

    public String encode(long number) {
        return encode(number, DEFAULT_ALPHABET, TokenConverter.DEFAULT_NEGATIVE_SIGN);
    }

    public String encode(long number, String alphabet, String negativeSign) {
        return tokenConverter.encode(number, toTokens(alphabet), negativeSign);
    }

    public long decode(String text) {
        return decode(text, DEFAULT_ALPHABET, TokenConverter.DEFAULT_NEGATIVE_SIGN);
    }

    public long decode(String text, String alphabet, String negativeSign) {
        return tokenConverter.decode(text, toTokens(alphabet), negativeSign);
    }

    /**
     * Splits the alphabet into one token per code point.
     */
    static List<String> toTokens(String alphabet) {
        if (alphabet == null) {
            return List.of();
        }
        return alphabet.codePoints()
            .mapToObj(cp -> new String(Character.toChars(cp)))
            .toList();
    }
}
