package com.adobe.numeral.converter;

/**
 * Interface for converting integers to and from Roman numerals.
 * 
 * <p>This interface follows the Strategy pattern, allowing for different
 * implementations of the Roman numeral conversion algorithm.</p>
 * 
 * <h2>Supported Range:</h2>
 * <p>The standard notation covers 1 to 3999. With the {@code extended} option
 * the encoder also renders zero ({@code N}) and larger magnitudes using
 * Claudian or apostrophus notation; the decoder recognizes, but does not
 * decode, those large-number forms.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 * @see <a href="https://en.wikipedia.org/wiki/Roman_numerals">Roman Numerals - Wikipedia</a>
 */
public interface RomanNumeralConverter {

    /**
     * Minimum value of the standard notation.
     */
    int MIN_VALUE = 1;

    /**
     * Maximum value of the standard notation.
     * <p>3999 is the largest number representable in standard Roman numerals
     * (MMMCMXCIX) without large-number notation.</p>
     */
    int MAX_VALUE = 3999;

    /**
     * Converts an integer to its Roman numeral representation.
     * 
     * <h3>Examples (default options):</h3>
     * <pre>
     * encode(0)     → "N"
     * encode(8)     → "Ⅷ"
     * encode(44)    → "ⅩⅬⅣ"
     * encode(-5)    → "-Ⅴ"
     * encode(40000) → "ⅭↀↃⅮↃↃ"
     * </pre>
     * 
     * @param number  the integer to convert
     * @param options rendering options
     * @return the Roman numeral
     * @throws com.adobe.numeral.exception.ConfigurationException if the options cannot express the number
     */
    String encode(long number, RomanOptions options);

    /**
     * Converts a Roman numeral back to an integer.
     * 
     * @param text          the numeral, Unicode or ASCII, any case
     * @param strict        whether to validate against {@code grammar} first
     * @param grammar       grammar used in strict mode
     * @param negativeSign  marker for negative numbers
     * @return the decoded integer
     * @throws com.adobe.numeral.exception.InvalidInputException on unknown symbols or a misplaced sign
     * @throws com.adobe.numeral.exception.FormatException if strict validation fails
     * @throws com.adobe.numeral.exception.UnsupportedNumeralException for large-number notation
     */
    long decode(String text, boolean strict, RomanGrammar grammar, String negativeSign);

    default String encode(long number) {
        return encode(number, RomanOptions.defaults());
    }

    default long decode(String text) {
        return decode(text, false);
    }

    default long decode(String text, boolean strict) {
        return decode(text, strict, RomanGrammar.STANDARD, TokenConverter.DEFAULT_NEGATIVE_SIGN);
    }

    /**
     * Checks if a number is within the standard notation range.
     * 
     * @param number the number to validate
     * @return true if the number is between MIN_VALUE and MAX_VALUE (inclusive)
     */
    default boolean isStandardRange(long number) {
        return number >= MIN_VALUE && number <= MAX_VALUE;
    }
}
