package com.adobe.numeral.converter;

/**
 * Structural rule applied by strict Roman numeral decoding.
 *
 * <p>Implementations receive the normalized, uppercase ASCII form of the
 * numeral (alphabet {@code IVXLCDM}) without sign.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
@FunctionalInterface
public interface RomanGrammar {

    /**
     * Canonical 1-3999 grammar.
     */
    RomanGrammar STANDARD = new StandardRomanGrammar();

    /**
     * @param numeral normalized ASCII numeral
     * @return true if the numeral is well formed under this grammar
     */
    boolean matches(String numeral);
}
