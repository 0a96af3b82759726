package com.adobe.numeral.converter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default {@link RomanNumeralConverter}, composing the encoder and decoder.
 * 
 * <h2>Thread Safety:</h2>
 * <p>This class is thread-safe. Both halves are stateless and only read the
 * static tables in {@link RomanSymbols}, allowing concurrent use without
 * synchronization.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
@Component
public class StandardRomanNumeralConverter implements RomanNumeralConverter {

    private static final Logger logger = LoggerFactory.getLogger(StandardRomanNumeralConverter.class);

    private final RomanNumeralEncoder encoder = new RomanNumeralEncoder();
    private final RomanNumeralDecoder decoder = new RomanNumeralDecoder();

    @Override
    public String encode(long number, RomanOptions options) {
        String numeral = encoder.encode(number, options);
        logger.debug("Encoded {} as {} with {}", number, numeral, options);
        return numeral;
    }

    @Override
    public long decode(String text, boolean strict, RomanGrammar grammar, String negativeSign) {
        long number = decoder.decode(text, strict, grammar, negativeSign);
        logger.debug("Decoded {} as {} (strict={})", text, number, strict);
        return number;
    }
}
