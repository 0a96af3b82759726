package com.adobe.numeral.exception;

/**
 * Base type for every failure raised by the numeral converters.
 *
 * <p>All conversions are atomic: when one of these exceptions is thrown no
 * partial output has been produced. Subclasses identify the failure class so
 * that callers (and the HTTP layer) can react to each one differently.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
public abstract class NumeralException extends RuntimeException {

    protected NumeralException(String message) {
        super(message);
    }

    protected NumeralException(String message, Throwable cause) {
        super(message, cause);
    }
}
