package com.adobe.numeral.converter;

import com.adobe.numeral.converter.StringRewriter.Replacement;

import java.util.List;
import java.util.Objects;

/**
 * Per-call settings for Roman numeral encoding.
 * 
 * <p>Defaults ({@link #defaults()}): Unicode glyphs, subtractive notation,
 * extended range (zero and large numbers), uppercase, Claudian large-number
 * blocks, no archaic ligatures, no alternative glyphs, negative numbers
 * allowed with sign {@code "-"}.</p>
 * 
 * @param onlyAscii    transliterate the result to plain ASCII letters
 * @param onlyAdditive never use subtractive pairs, allow four repeats instead
 * @param extended     allow zero and values beyond the standard range
 * @param uppercase    fold to uppercase, otherwise lowercase
 * @param claudian     render large magnitudes as Claudian blocks rather than apostrophus glyphs
 * @param archaic      use the archaic ligatures for 6 and 50
 * @param alternatives caller-supplied glyph substitutions, applied in order
 * @param signed       allow negative numbers
 * @param negativeSign prefix for negative numbers
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
public record RomanOptions(
    boolean onlyAscii,
    boolean onlyAdditive,
    boolean extended,
    boolean uppercase,
    boolean claudian,
    boolean archaic,
    List<Replacement> alternatives,
    boolean signed,
    String negativeSign
) {

    private static final RomanOptions DEFAULTS = builder().build();

    public RomanOptions {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        Objects.requireNonNull(negativeSign, "negativeSign");
    }

    public static RomanOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with these options.
     */
    public Builder toBuilder() {
        return new Builder()
            .onlyAscii(onlyAscii)
            .onlyAdditive(onlyAdditive)
            .extended(extended)
            .uppercase(uppercase)
            .claudian(claudian)
            .archaic(archaic)
            .alternatives(alternatives)
            .signed(signed)
            .negativeSign(negativeSign);
    }

    /**
     * Fluent builder for {@link RomanOptions}.
     */
    public static final class Builder {

        private boolean onlyAscii;
        private boolean onlyAdditive;
        private boolean extended = true;
        private boolean uppercase = true;
        private boolean claudian = true;
        private boolean archaic;
        private List<Replacement> alternatives = List.of();
        private boolean signed = true;
        private String negativeSign = TokenConverter.DEFAULT_NEGATIVE_SIGN;

        private Builder() {
        }

        public Builder onlyAscii(boolean onlyAscii) {
            this.onlyAscii = onlyAscii;
            return this;
        }

        public Builder onlyAdditive(boolean onlyAdditive) {
            this.onlyAdditive = onlyAdditive;
            return this;
        }

        public Builder extended(boolean extended) {
            this.extended = extended;
            return this;
        }

        public Builder uppercase(boolean uppercase) {
            this.uppercase = uppercase;
            return this;
        }

        public Builder claudian(boolean claudian) {
            this.claudian = claudian;
            return this;
        }

        public Builder archaic(boolean archaic) {
            this.archaic = archaic;
            return this;
        }

        public Builder alternatives(List<Replacement> alternatives) {
            this.alternatives = alternatives;
            return this;
        }

        public Builder signed(boolean signed) {
            this.signed = signed;
            return this;
        }

        public Builder negativeSign(String negativeSign) {
            this.negativeSign = negativeSign;
            return this;
        }

        public RomanOptions build() {
            return new RomanOptions(onlyAscii, onlyAdditive, extended, uppercase, claudian,
                archaic, alternatives, signed, negativeSign);
        }
    }
}
