package com.adobe.numeral.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler for the numeral API.
 * 
 * <p>Error responses are returned in <b>plain text format</b>, prefixed
 * with {@code "Error: "}. Success responses stay JSON.</p>
 * 
 * <h2>Status Mapping:</h2>
 * <ul>
 *   <li>{@link InvalidInputException}, {@link ConfigurationException},
 *       {@link FormatException}: 400</li>
 *   <li>{@link UnsupportedNumeralException}: 422, the numeral is well formed
 *       but cannot be decoded</li>
 *   <li>Missing or mistyped parameters: 400</li>
 *   <li>Unknown path: 404</li>
 *   <li>Anything else: 500 with a correlation reference</li>
 * </ul>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handles bad input text or numbers.
     * 
     * @param ex the InvalidInputException
     * @return ResponseEntity with plain text error message and 400 status
     */
    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<String> handleInvalidInputException(InvalidInputException ex) {
        logger.warn("Invalid input: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Handles option combinations that cannot express the input.
     * 
     * @param ex the ConfigurationException
     * @return ResponseEntity with plain text error message and 400 status
     */
    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<String> handleConfigurationException(ConfigurationException ex) {
        logger.warn("Unsupported option combination: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Handles strict-mode grammar failures.
     * 
     * @param ex the FormatException
     * @return ResponseEntity with plain text error message and 400 status
     */
    @ExceptionHandler(FormatException.class)
    public ResponseEntity<String> handleFormatException(FormatException ex) {
        logger.warn("Malformed numeral: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Handles well-formed numerals that cannot be decoded.
     * 
     * @param ex the UnsupportedNumeralException
     * @return ResponseEntity with plain text error message and 422 status
     */
    @ExceptionHandler(UnsupportedNumeralException.class)
    public ResponseEntity<String> handleUnsupportedNumeralException(UnsupportedNumeralException ex) {
        logger.warn("Unsupported numeral: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    }

    /**
     * Handles IllegalArgumentException from the service layer (range validation).
     * 
     * @param ex the IllegalArgumentException
     * @return ResponseEntity with plain text error message and 400 status
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleIllegalArgumentException(IllegalArgumentException ex) {
        logger.warn("Illegal argument: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Handles missing required request parameters.
     * 
     * @param ex the MissingServletRequestParameterException
     * @return ResponseEntity with plain text error message and 400 status
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<String> handleMissingParameter(MissingServletRequestParameterException ex) {
        String paramName = ex.getParameterName();
        logger.warn("Missing required parameter: {}", paramName);
        return buildErrorResponse(HttpStatus.BAD_REQUEST,
            "Missing required parameter '" + paramName + "'");
    }

    /**
     * Handles type mismatch exceptions (e.g., "abc" for an integer parameter).
     * 
     * @param ex the MethodArgumentTypeMismatchException
     * @return ResponseEntity with plain text error message and 400 status
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<String> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String paramName = ex.getName();
        Object value = ex.getValue();
        logger.warn("Type mismatch for parameter '{}': {}", paramName, value);
        
        String expected = ex.getRequiredType() != null
            ? ex.getRequiredType().getSimpleName().toLowerCase()
            : "value";
        return buildErrorResponse(HttpStatus.BAD_REQUEST,
            "Invalid value '" + value + "' for parameter '" + paramName
                + "'. Please provide a valid " + expected + ".");
    }

    /**
     * Handles requests for non-existent resources (404).
     * 
     * @param ex the NoResourceFoundException
     * @return ResponseEntity with plain text error message and 404 status
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<String> handleNoResourceFound(NoResourceFoundException ex) {
        logger.warn("Resource not found: {}", ex.getResourcePath());
        return buildErrorResponse(HttpStatus.NOT_FOUND, 
            "Resource not found: " + ex.getResourcePath());
    }

    /**
     * Catch-all handler for unexpected exceptions.
     * 
     * <p>Includes correlation ID in response for easier issue reporting.</p>
     * 
     * @param ex the Exception
     * @return ResponseEntity with generic error message and 500 status
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleGenericException(Exception ex) {
        String correlationId = MDC.get("correlationId");
        logger.error("Unexpected error occurred [correlationId={}]", correlationId, ex);
        
        String message = "An unexpected error occurred. Please try again later.";
        if (correlationId != null) {
            message += " (Reference: " + correlationId + ")";
        }
        
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    /**
     * Builds a standardized error response.
     * 
     * @param status  the HTTP status
     * @param message the error message (without "Error: " prefix)
     * @return ResponseEntity with formatted error
     */
    private ResponseEntity<String> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity
            .status(status)
            .contentType(MediaType.TEXT_PLAIN)
            .body("Error: " + message);
    }
}
