package com.adobe.numeral.controller;

import com.adobe.numeral.converter.RomanOptions;
import com.adobe.numeral.exception.InvalidInputException;
import com.adobe.numeral.model.ConversionResult;
import com.adobe.numeral.model.RangeConversionResult;
import com.adobe.numeral.service.NumeralService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for numeral conversion endpoints.
 * 
 * <ul>
 *   <li>Roman encode: GET /roman?query={integer}</li>
 *   <li>Roman range: GET /roman?min={integer}&amp;max={integer}</li>
 *   <li>Roman decode: GET /roman/decode?text={numeral}</li>
 *   <li>Letters: GET /letters?query={integer}, GET /letters/decode?text={letters}</li>
 *   <li>Tokens: GET /tokens?query={integer}&amp;tokens=po,ta, GET /tokens/decode?text=...&amp;tokens=...</li>
 * </ul>
 * 
 * <h2>Response Formats:</h2>
 * <ul>
 *   <li><b>Success:</b> JSON with input/output fields</li>
 *   <li><b>Error:</b> Plain text message</li>
 * </ul>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
@RestController
@Tag(name = "Numeral Conversion", description = "Convert integers to and from Roman numerals, letters and tokens")
public class NumeralController {

    private static final Logger logger = LoggerFactory.getLogger(NumeralController.class);

    private final NumeralService numeralService;
    private final String defaultNegativeSign;
    private final String defaultAlphabet;

    /**
     * Constructs the controller with the conversion service and configured defaults.
     * 
     * @param numeralService      the service for numeral conversions
     * @param defaultNegativeSign sign used when a request does not name one
     * @param defaultAlphabet     alphabet used by the letter endpoints when a request does not name one
     */
    public NumeralController(
            NumeralService numeralService,
            @Value("${app.numeral.negative-sign:-}") String defaultNegativeSign,
            @Value("${app.numeral.alphabet:abcdefghijklmnopqrstuvwxyz}") String defaultAlphabet) {
        this.numeralService = numeralService;
        this.defaultNegativeSign = defaultNegativeSign;
        this.defaultAlphabet = defaultAlphabet;
    }

    /**
     * Encodes a single integer, or a range of integers, as Roman numerals.
     * 
     * <h3>Example:</h3>
     * <pre>
     * Request:  GET /roman?query=42&amp;ascii=true
     * Response: {"input": "42", "output": "XLII"}
     * </pre>
     */
    @GetMapping(value = "/roman", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Convert integer to Roman numeral",
        description = "Use 'query' for a single conversion, or 'min' and 'max' for a range. " +
                      "Flags select ASCII output, additive-only notation, extended range, case, " +
                      "Claudian or apostrophus large numbers, archaic ligatures and signed numbers."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successful conversion",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(oneOf = {ConversionResult.class, RangeConversionResult.class})
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid input or option combination",
            content = @Content(mediaType = "text/plain")
        )
    })
    public ResponseEntity<?> encodeRoman(
            @Parameter(description = "Integer to convert")
            @RequestParam(required = false) Long query,
            @Parameter(description = "Minimum value for range conversion")
            @RequestParam(required = false) Long min,
            @Parameter(description = "Maximum value for range conversion")
            @RequestParam(required = false) Long max,
            @RequestParam(defaultValue = "false") boolean ascii,
            @RequestParam(defaultValue = "false") boolean additive,
            @RequestParam(defaultValue = "true") boolean extended,
            @RequestParam(defaultValue = "true") boolean uppercase,
            @RequestParam(defaultValue = "true") boolean claudian,
            @RequestParam(defaultValue = "false") boolean archaic,
            @RequestParam(defaultValue = "true") boolean signed,
            @Parameter(description = "Prefix for negative numbers")
            @RequestParam(required = false) String sign) {

        RomanOptions options = RomanOptions.builder()
            .onlyAscii(ascii)
            .onlyAdditive(additive)
            .extended(extended)
            .uppercase(uppercase)
            .claudian(claudian)
            .archaic(archaic)
            .signed(signed)
            .negativeSign(signOrDefault(sign))
            .build();

        if (min != null || max != null) {
            if (min == null || max == null) {
                throw new InvalidInputException(
                    "Both 'min' and 'max' parameters are required for range conversion.");
            }
            logger.info("Processing Roman range request: min={}, max={}", min, max);
            RangeConversionResult result = numeralService.encodeRomanRange(min, max, options);
            logger.info("Successfully converted range [{}-{}]: {} conversions", min, max, result.size());
            return ResponseEntity.ok(result);
        }
        if (query == null) {
            throw new InvalidInputException(
                "Missing required parameter. Provide 'query' for single conversion, " +
                "or both 'min' and 'max' for range conversion.");
        }

        logger.info("Processing Roman encode request for: {}", query);
        ConversionResult result = numeralService.encodeRoman(query, options);
        logger.info("Successfully converted {} to {}", result.input(), result.output());
        return ResponseEntity.ok(result);
    }

    /**
     * Decodes a Roman numeral (Unicode or ASCII, any case).
     * 
     * <pre>
     * Request:  GET /roman/decode?text=MDCLXVI
     * Response: {"input": "MDCLXVI", "output": "1666"}
     * </pre>
     */
    @GetMapping(value = "/roman/decode", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Convert Roman numeral to integer",
        description = "Lenient by default; 'strict=true' validates against the standard 1-3999 grammar. " +
                      "Large-number notation is answered with 422."
    )
    public ResponseEntity<ConversionResult> decodeRoman(
            @Parameter(description = "Roman numeral to decode")
            @RequestParam String text,
            @RequestParam(defaultValue = "false") boolean strict,
            @RequestParam(required = false) String sign) {
        logger.info("Processing Roman decode request for: {} (strict={})", text, strict);
        return ResponseEntity.ok(numeralService.decodeRoman(text, strict, signOrDefault(sign)));
    }

    @GetMapping(value = "/letters", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Convert integer to letters", description = "Spreadsheet-column style: 0=a, 25=z, 26=aa")
    public ResponseEntity<ConversionResult> encodeLetters(
            @RequestParam long query,
            @RequestParam(required = false) String alphabet,
            @RequestParam(required = false) String sign) {
        logger.info("Processing letters encode request for: {}", query);
        return ResponseEntity.ok(
            numeralService.encodeLetters(query, alphabetOrDefault(alphabet), signOrDefault(sign)));
    }

    @GetMapping(value = "/letters/decode", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Convert letters to integer")
    public ResponseEntity<ConversionResult> decodeLetters(
            @RequestParam String text,
            @RequestParam(required = false) String alphabet,
            @RequestParam(required = false) String sign) {
        logger.info("Processing letters decode request for: {}", text);
        return ResponseEntity.ok(
            numeralService.decodeLetters(text, alphabetOrDefault(alphabet), signOrDefault(sign)));
    }

    @GetMapping(value = "/tokens", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Convert integer to a bijective token sequence",
               description = "Tokens are given comma separated, in digit order")
    public ResponseEntity<ConversionResult> encodeTokens(
            @RequestParam long query,
            @RequestParam List<String> tokens,
            @RequestParam(required = false) String sign) {
        logger.info("Processing tokens encode request for: {} over {} tokens", query, tokens.size());
        return ResponseEntity.ok(numeralService.encodeTokens(query, tokens, signOrDefault(sign)));
    }

    @GetMapping(value = "/tokens/decode", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Convert a bijective token sequence to integer")
    public ResponseEntity<ConversionResult> decodeTokens(
            @RequestParam String text,
            @RequestParam List<String> tokens,
            @RequestParam(required = false) String sign) {
        logger.info("Processing tokens decode request for: {} over {} tokens", text, tokens.size());
        return ResponseEntity.ok(numeralService.decodeTokens(text, tokens, signOrDefault(sign)));
    }

    private String signOrDefault(String sign) {
        return sign == null || sign.isEmpty() ? defaultNegativeSign : sign;
    }

    private String alphabetOrDefault(String alphabet) {
        return alphabet == null || alphabet.isEmpty() ? defaultAlphabet : alphabet;
    }
}
