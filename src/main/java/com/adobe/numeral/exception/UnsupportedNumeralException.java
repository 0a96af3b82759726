package com.adobe.numeral.exception;

/**
 * Thrown when the input is well formed but uses a notation the decoder cannot
 * resolve, namely Claudian or apostrophus large-number blocks.
 *
 * <p>Distinct from {@link InvalidInputException}: the text is a legitimate
 * numeral, it just cannot be turned back into an integer.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
public class UnsupportedNumeralException extends NumeralException {

    public UnsupportedNumeralException(String message) {
        super(message);
    }
}
