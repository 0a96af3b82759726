package com.adobe.numeral.service;

import com.adobe.numeral.converter.LetterConverter;
import com.adobe.numeral.converter.RomanGrammar;
import com.adobe.numeral.converter.RomanNumeralConverter;
import com.adobe.numeral.converter.RomanOptions;
import com.adobe.numeral.converter.TokenConverter;
import com.adobe.numeral.model.ConversionResult;
import com.adobe.numeral.model.RangeConversionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service layer for numeral conversion operations.
 * 
 * <p>Wraps the converters in {@link ConversionResult} objects for the API
 * and records one {@code numeral.conversions.total} count per successful
 * conversion, tagged by numeral system and direction.</p>
 * 
 * <h2>Responsibilities:</h2>
 * <ul>
 *   <li>Roman numeral encoding, decoding and range encoding</li>
 *   <li>Letter (spreadsheet column) encoding and decoding</li>
 *   <li>Encoding and decoding over caller-supplied tokens</li>
 * </ul>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
@Service
public class NumeralService {

    private static final Logger logger = LoggerFactory.getLogger(NumeralService.class);

    private static final String CONVERSIONS_METRIC = "numeral.conversions.total";

    private final RomanNumeralConverter romanConverter;
    private final LetterConverter letterConverter;
    private final TokenConverter tokenConverter;
    private final ParallelRangeProcessor rangeProcessor;
    private final MeterRegistry meterRegistry;

    public NumeralService(RomanNumeralConverter romanConverter,
                          LetterConverter letterConverter,
                          TokenConverter tokenConverter,
                          ParallelRangeProcessor rangeProcessor,
                          MeterRegistry meterRegistry) {
        this.romanConverter = romanConverter;
        this.letterConverter = letterConverter;
        this.tokenConverter = tokenConverter;
        this.rangeProcessor = rangeProcessor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Encodes a single integer as a Roman numeral.
     * 
     * @param number  the integer to convert
     * @param options rendering options
     * @return ConversionResult containing input and output strings
     * @throws com.adobe.numeral.exception.ConfigurationException if the options cannot express the number
     */
    public ConversionResult encodeRoman(long number, RomanOptions options) {
        logger.debug("Encoding {} as Roman numeral", number);
        String numeral = romanConverter.encode(number, options);
        count("roman", "encode");
        return ConversionResult.encoded(number, numeral);
    }

    /**
     * Decodes a Roman numeral, optionally validating it against the standard grammar.
     * 
     * @param text         the numeral
     * @param strict       validate against the 1-3999 grammar first
     * @param negativeSign marker for negative numbers
     * @return ConversionResult with the numeral as input and the integer as output
     */
    public ConversionResult decodeRoman(String text, boolean strict, String negativeSign) {
        logger.debug("Decoding Roman numeral {} (strict={})", text, strict);
        long number = romanConverter.decode(text, strict, RomanGrammar.STANDARD, negativeSign);
        count("roman", "decode");
        return ConversionResult.decoded(text, number);
    }

    /**
     * Encodes a range of integers as Roman numerals in parallel.
     * 
     * @param min     the minimum value (inclusive)
     * @param max     the maximum value (inclusive)
     * @param options rendering options
     * @return RangeConversionResult containing the ordered conversions
     * @throws IllegalArgumentException if the range is invalid
     */
    public RangeConversionResult encodeRomanRange(long min, long max, RomanOptions options) {
        logger.debug("Encoding range: {} to {}", min, max);
        RangeConversionResult result = rangeProcessor.processRange(min, max, options);
        count("roman", "encode", result.size());
        return result;
    }

    public ConversionResult encodeLetters(long number, String alphabet, String negativeSign) {
        String letters = letterConverter.encode(number, alphabet, negativeSign);
        count("letters", "encode");
        return ConversionResult.encoded(number, letters);
    }

    public ConversionResult decodeLetters(String text, String alphabet, String negativeSign) {
        long number = letterConverter.decode(text, alphabet, negativeSign);
        count("letters", "decode");
        return ConversionResult.decoded(text, number);
    }

    public ConversionResult encodeTokens(long number, List<String> tokens, String negativeSign) {
        String text = tokenConverter.encode(number, tokens, negativeSign);
        count("tokens", "encode");
        return ConversionResult.encoded(number, text);
    }

    public ConversionResult decodeTokens(String text, List<String> tokens, String negativeSign) {
        long number = tokenConverter.decode(text, tokens, negativeSign);
        count("tokens", "decode");
        return ConversionResult.decoded(text, number);
    }

    private void count(String system, String direction) {
        count(system, direction, 1);
    }

    private void count(String system, String direction, int amount) {
        Counter.builder(CONVERSIONS_METRIC)
            .description("Successful numeral conversions")
            .tag("system", system)
            .tag("direction", direction)
            .register(meterRegistry)
            .increment(amount);
    }
}
