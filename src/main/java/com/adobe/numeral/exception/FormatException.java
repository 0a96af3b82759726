package com.adobe.numeral.exception;

/**
 * Thrown by strict Roman numeral decoding when the normalized text does not
 * match the grammar in use.
 *
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
public class FormatException extends NumeralException {

    public FormatException(String message) {
        super(message);
    }
}
