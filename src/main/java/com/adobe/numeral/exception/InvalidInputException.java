package com.adobe.numeral.exception;

/**
 * Exception thrown when the text or number handed to a converter is not acceptable.
 * 
 * <p>This exception is used to indicate invalid user input, such as:</p>
 * <ul>
 *   <li>Characters outside the accepted symbol or token set</li>
 *   <li>A sign marker that is present but not in leading position</li>
 *   <li>Empty text, or text whose value does not fit a {@code long}</li>
 *   <li>Missing or inconsistent request parameters</li>
 * </ul>
 * 
 * <p>This exception results in a 400 Bad Request HTTP response with a
 * plain text error message.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
public class InvalidInputException extends NumeralException {

    /**
     * Constructs an InvalidInputException with the specified message.
     * 
     * @param message the error message describing the validation failure
     */
    public InvalidInputException(String message) {
        super(message);
    }

    /**
     * Constructs an InvalidInputException with a message and cause.
     * 
     * @param message the error message
     * @param cause   the underlying cause of the exception
     */
    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
