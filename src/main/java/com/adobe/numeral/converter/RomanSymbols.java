package com.adobe.numeral.converter;

import com.adobe.numeral.converter.StringRewriter.Replacement;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable symbol tables shared by the Roman numeral encoder and decoder.
 *
 * <p>One source table ({@link #SYMBOLS}) lists every standard glyph of the
 * Unicode Number Forms block with its value. Two views are derived from it:</p>
 * <ul>
 *   <li>{@link #SCAN_ORDER}: value descending, without the ligature-only
 *       glyphs for 11 and 12 and without zero. Drives the encoder's scan.</li>
 *   <li>{@link #SYMBOLS} itself, keyed by glyph, for lookups by symbol.</li>
 * </ul>
 *
 * <p>All tables are built in the static initializer and never change, so
 * concurrent readers need no synchronization.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
final class RomanSymbols {

    static final String ZERO = "N";
    static final String ONE = "Ⅰ";
    static final String HUNDRED = "Ⅽ";
    static final String FIVE_HUNDRED = "Ⅾ";
    static final String THOUSAND = "Ⅿ";

    /** Claudian enclosure glyph (reversed C). */
    static final String ENCLOSURE = "Ↄ";

    /** Apostrophus 1000, used inside Claudian blocks. */
    static final String APOSTROPHUS_THOUSAND = "ↀ";

    /** Stand-in for {@link #ENCLOSURE} after ASCII transliteration. */
    static final String ASCII_ENCLOSURE = "O";

    /** Largest value of the standard table, the base of the range threshold. */
    static final long MAX_STANDARD_VALUE = 1000;

    /** Ligature-only values, produced by a rewrite and never by the scan. */
    private static final List<Long> LIGATURE_VALUES = List.of(11L, 12L);

    /** Glyph → value, ordered from highest to lowest value. */
    static final Map<String, Long> SYMBOLS;

    /** Glyphs in scan order, see class comment. */
    static final List<Map.Entry<String, Long>> SCAN_ORDER;

    /** Apostrophus value → glyph, for exact tabulated magnitudes only. */
    static final Map<Long, String> APOSTROPHUS;

    /** Two-glyph sequences merged into their ligature. */
    static final List<Replacement> LIGATURES = List.of(
        Replacement.of("ⅩⅠ", "Ⅺ"),
        Replacement.of("ⅩⅡ", "Ⅻ"));

    /** Subtractive 4 and 9 glyphs spelled with repeated units. */
    static final List<Replacement> ADDITIVE = List.of(
        Replacement.of("Ⅳ", "ⅡⅡ"),
        Replacement.of("Ⅸ", "ⅤⅡⅡ"));

    static final List<Replacement> ARCHAIC = List.of(
        Replacement.of("Ⅵ", "ↅ"),
        Replacement.of("Ⅼ", "ↆ"));

    static final List<Replacement> UNICODE_TO_ASCII = List.of(
        Replacement.of("Ⅰ", "I"), Replacement.of("Ⅱ", "II"), Replacement.of("Ⅲ", "III"),
        Replacement.of("Ⅳ", "IV"), Replacement.of("Ⅴ", "V"), Replacement.of("Ⅵ", "VI"),
        Replacement.of("Ⅶ", "VII"), Replacement.of("Ⅷ", "VIII"), Replacement.of("Ⅸ", "IX"),
        Replacement.of("Ⅹ", "X"), Replacement.of("Ⅺ", "XI"), Replacement.of("Ⅻ", "XII"),
        Replacement.of("Ⅼ", "L"), Replacement.of("Ⅽ", "C"), Replacement.of("Ⅾ", "D"),
        Replacement.of("Ⅿ", "M"), Replacement.of("ↅ", "VI"), Replacement.of("ↀ", "CD"),
        Replacement.of("ↆ", "L"), Replacement.of(ENCLOSURE, ASCII_ENCLOSURE),
        Replacement.of("ↁ", "DO"), Replacement.of("ↂ", "CCDO"), Replacement.of("ↇ", "DOO"),
        Replacement.of("ↈ", "CCCDOO"));

    /** Glyphs that only occur in large-number notation. */
    static final String LARGE_NUMBER_GLYPHS = ENCLOSURE + "ↀↁↂↇↈ";

    /** ASCII symbol → value, the alphabet the decoder works on. */
    static final Map<Character, Long> ASCII_VALUES = Map.of(
        'I', 1L, 'V', 5L, 'X', 10L, 'L', 50L,
        'C', 100L, 'D', 500L, 'M', 1000L, 'N', 0L);

    static {
        Map<String, Long> symbols = new LinkedHashMap<>();
        symbols.put("Ⅿ", 1000L);
        symbols.put("Ⅾ", 500L);
        symbols.put("Ⅽ", 100L);
        symbols.put("Ⅼ", 50L);
        symbols.put("Ⅻ", 12L);
        symbols.put("Ⅺ", 11L);
        symbols.put("Ⅹ", 10L);
        symbols.put("Ⅸ", 9L);
        symbols.put("Ⅷ", 8L);
        symbols.put("Ⅶ", 7L);
        symbols.put("Ⅵ", 6L);
        symbols.put("Ⅴ", 5L);
        symbols.put("Ⅳ", 4L);
        symbols.put("Ⅲ", 3L);
        symbols.put("Ⅱ", 2L);
        symbols.put(ONE, 1L);
        symbols.put(ZERO, 0L);
        SYMBOLS = Collections.unmodifiableMap(symbols);

        SCAN_ORDER = SYMBOLS.entrySet().stream()
            .filter(e -> e.getValue() > 0 && !LIGATURE_VALUES.contains(e.getValue()))
            .map(e -> Map.entry(e.getKey(), e.getValue()))
            .toList();

        Map<Long, String> apostrophus = new LinkedHashMap<>();
        apostrophus.put(100_000L, "ↈ");
        apostrophus.put(50_000L, "ↇ");
        apostrophus.put(10_000L, "ↂ");
        apostrophus.put(5_000L, "ↁ");
        apostrophus.put(1_000L, APOSTROPHUS_THOUSAND);
        APOSTROPHUS = Collections.unmodifiableMap(apostrophus);
    }

    private RomanSymbols() {
    }

    /**
     * Maximum run of one glyph: 3 with subtractive notation, 4 additive-only.
     */
    static int maxConsecutive(boolean onlyAdditive) {
        return onlyAdditive ? 4 : 3;
    }

    /**
     * Values at or above this use the large-number extension.
     */
    static long standardThreshold(boolean onlyAdditive) {
        return MAX_STANDARD_VALUE * (maxConsecutive(onlyAdditive) + 1);
    }
}
