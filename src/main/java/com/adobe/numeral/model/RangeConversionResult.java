package com.adobe.numeral.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Response model for range-based Roman numeral encoding.
 * 
 * <h2>Response Format:</h2>
 * <pre>
 * {
 *     "conversions": [
 *         {"input": "1", "output": "Ⅰ"},
 *         {"input": "2", "output": "Ⅱ"},
 *         {"input": "3", "output": "Ⅲ"}
 *     ]
 * }
 * </pre>
 * 
 * <p>Results are in ascending order of input value.</p>
 * 
 * @param conversions list of conversion results in ascending order
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
@Schema(description = "Result of a range-based Roman numeral conversion")
public record RangeConversionResult(
    
    @Schema(
        description = "Array of conversion results in ascending order by input value"
    )
    List<ConversionResult> conversions
    
) {
    /**
     * Factory method to create a RangeConversionResult from a list of conversions.
     * 
     * @param conversions the list of conversion results (should be in ascending order)
     * @return a new RangeConversionResult instance
     */
    public static RangeConversionResult of(List<ConversionResult> conversions) {
        return new RangeConversionResult(List.copyOf(conversions));
    }
    
    /**
     * Returns the number of conversions in this result.
     * 
     * @return the count of conversions
     */
    public int size() {
        return conversions != null ? conversions.size() : 0;
    }
}
