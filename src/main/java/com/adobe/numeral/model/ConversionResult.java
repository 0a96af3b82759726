package com.adobe.numeral.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Response model for a single conversion, in either direction.
 * 
 * <h2>Response Format:</h2>
 * <pre>
 * GET /roman?query=42         → {"input": "42", "output": "ⅩⅬⅡ"}
 * GET /letters/decode?text=aa → {"input": "aa", "output": "26"}
 * </pre>
 * 
 * <p>Both fields are strings regardless of direction, so the same record
 * serves encode and decode endpoints.</p>
 * 
 * @param input  what the caller sent
 * @param output the converted value
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
@Schema(description = "Result of a single numeral conversion")
public record ConversionResult(
    
    @Schema(
        description = "The value that was converted, as a string",
        example = "42"
    )
    String input,
    
    @Schema(
        description = "The converted value, as a string",
        example = "ⅩⅬⅡ"
    )
    String output
    
) {
    /**
     * Result of encoding an integer.
     * 
     * @param number  the integer that was converted
     * @param numeral the encoded text
     * @return a new ConversionResult instance
     */
    public static ConversionResult encoded(long number, String numeral) {
        return new ConversionResult(String.valueOf(number), numeral);
    }

    /**
     * Result of decoding text.
     * 
     * @param numeral the text that was decoded
     * @param number  the decoded integer
     * @return a new ConversionResult instance
     */
    public static ConversionResult decoded(String numeral, long number) {
        return new ConversionResult(numeral, String.valueOf(number));
    }
}
