package com.adobe.numeral.converter;

import java.util.List;

/**
 * Conversion between integers and sequences of arbitrary string tokens.
 * 
 * <p>The tokens act as the digits of a bijective base-k system, where k is the
 * number of tokens. There is no zero digit, so every non-empty token sequence
 * denotes exactly one non-negative integer and there are no leading zeros.
 * Spreadsheet column names (a, b, ..., z, aa, ab, ...) are the familiar case.</p>
 * 
 * <h2>Examples:</h2>
 * <pre>
 * encode(0..7, ["po", "ta"]) → po, ta, popo, pota, tapo, tata, popopo, popota
 * decode("potapopopotata", ["po", "ta"]) → 161
 * encode(-3, ["a", "b"], "-") → "-ab"
 * </pre>
 * 
 * <h2>Constraints:</h2>
 * <ul>
 *   <li>At least one token, no duplicates, no empty token</li>
 *   <li>The negative sign must not be one of, or occur within, the tokens</li>
 * </ul>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 * @see <a href="https://en.wikipedia.org/wiki/Bijective_numeration">Bijective numeration - Wikipedia</a>
 */
public interface TokenConverter {

    /**
     * Sign prepended to the encoding of negative numbers unless told otherwise.
     */
    String DEFAULT_NEGATIVE_SIGN = "-";

    /**
     * Encodes {@code number} as a sequence of tokens.
     * 
     * @param number       the integer to encode
     * @param tokens       the ordered digit tokens
     * @param negativeSign marker prepended to negative numbers
     * @return the token sequence, prefixed with the sign when negative
     * @throws com.adobe.numeral.exception.ConfigurationException if the tokens or sign are unusable
     * @throws com.adobe.numeral.exception.InvalidInputException if the number has no absolute value
     */
    String encode(long number, List<String> tokens, String negativeSign);

    /**
     * Decodes a token sequence produced by {@link #encode}.
     * 
     * @param text         the token sequence, optionally prefixed with the sign
     * @param tokens       the ordered digit tokens
     * @param negativeSign marker for negative numbers
     * @return the decoded integer
     * @throws com.adobe.numeral.exception.ConfigurationException if the tokens or sign are unusable
     * @throws com.adobe.numeral.exception.InvalidInputException if the text cannot be decoded
     */
    long decode(String text, List<String> tokens, String negativeSign);

    default String encode(long number, List<String> tokens) {
        return encode(number, tokens, DEFAULT_NEGATIVE_SIGN);
    }

    default long decode(String text, List<String> tokens) {
        return decode(text, tokens, DEFAULT_NEGATIVE_SIGN);
    }
}
