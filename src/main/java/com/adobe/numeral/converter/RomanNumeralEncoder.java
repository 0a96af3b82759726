package com.adobe.numeral.converter;

import com.adobe.numeral.exception.ConfigurationException;
import com.adobe.numeral.exception.InvalidInputException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.adobe.numeral.converter.StringRewriter.rewrite;

/**
 * Integer to Roman numeral encoder.
 * 
 * <h2>Standard range</h2>
 * <p>Below {@code 1000 × (maxConsecutive + 1)} the encoder repeatedly picks the
 * largest glyph that fits the remainder. A {@link SymbolRun} tracks how often
 * the same glyph was just emitted. When one more copy would reach the repeat
 * limit, the last {@code maxConsecutive - 1} copies are dropped and the next
 * larger glyph of the table is appended instead, which yields the subtractive
 * form: {@code ⅩⅩⅩ} + {@code Ⅹ} becomes {@code ⅩⅬ}.</p>
 * 
 * <h2>Extended range</h2>
 * <p>Above that threshold each step takes the dominant power of ten
 * {@code m} of the remainder (or {@code 5m} when the remainder is at least
 * that) and renders it either as an apostrophus glyph or as a Claudian block,
 * {@code repeat} enclosure glyphs wrapped around a thousand or five-hundred
 * glyph. A remainder of four times the unit borrows from the next block, the
 * large-number analogue of subtractive notation.</p>
 * 
 * <h2>Post-processing</h2>
 * <ol>
 *   <li>merge {@code ⅩⅠ}/{@code ⅩⅡ} into {@code Ⅺ}/{@code Ⅻ}</li>
 *   <li>additive-only: spell 4 and 9 with repeated units</li>
 *   <li>archaic ligatures</li>
 *   <li>caller-supplied alternative glyphs</li>
 *   <li>ASCII transliteration</li>
 *   <li>case folding (tabulated Claudian blocks were already emitted as apostrophus glyphs)</li>
 * </ol>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
final class RomanNumeralEncoder {

    /** Decimal order of the smallest apostrophus glyph (1000). */
    private static final int BASE_LARGE_ORDER = 3;

    String encode(long number, RomanOptions options) {
        boolean negative = number < 0;
        if (negative && !options.signed()) {
            throw new ConfigurationException("`" + number + "` needs the `signed` option");
        }
        if (number == Long.MIN_VALUE) {
            throw new InvalidInputException("Number out of range: " + number);
        }

        String text;
        if (number == 0) {
            if (!options.extended()) {
                throw new ConfigurationException("`0` needs the `extended` option");
            }
            text = RomanSymbols.ZERO;
        } else {
            text = encodeMagnitude(Math.abs(number), options);
        }

        text = postProcess(text, options);
        return negative ? options.negativeSign() + text : text;
    }

    private String encodeMagnitude(long number, RomanOptions options) {
        int maxConsecutive = RomanSymbols.maxConsecutive(options.onlyAdditive());
        long threshold = RomanSymbols.standardThreshold(options.onlyAdditive());

        StringBuilder out = new StringBuilder();
        long remaining = number;
        while (remaining >= threshold) {
            if (!options.extended()) {
                throw new ConfigurationException("`" + number + "` needs the `extended` option");
            }
            int order = decimalOrder(remaining);
            long magnitude = powerOfTen(order);
            boolean half = remaining / 5 >= magnitude;
            int repeat = order - BASE_LARGE_ORDER + (half ? 1 : 0);
            long unit = half ? 5 * magnitude : magnitude;
            long correction = !half && remaining >= unit * (maxConsecutive + 1) ? -2 * unit : 0;

            out.append(largeNumberBlock(half, repeat, unit, number, options));
            remaining -= unit + correction;
        }
        appendStandard(remaining, maxConsecutive, out);
        return out.toString();
    }

    /**
     * Greedy scan over the standard glyphs with run-length limiting.
     */
    private static void appendStandard(long remaining, int maxConsecutive, StringBuilder out) {
        List<Map.Entry<String, Long>> table = RomanSymbols.SCAN_ORDER;
        List<String> emitted = new ArrayList<>();
        SymbolRun run = new SymbolRun(maxConsecutive);

        while (remaining > 0) {
            int index = largestFitting(remaining);
            Map.Entry<String, Long> entry = table.get(index);
            String previous = index > 0 ? table.get(index - 1).getKey() : null;

            Step step = run.next(entry.getKey(), previous);
            if (step.action() == Action.REPLACE_RUN) {
                if (step.symbol() == null) {
                    throw new IllegalStateException("No larger glyph to replace a run of " + entry.getKey());
                }
                for (int i = 0; i < maxConsecutive - 1; i++) {
                    emitted.remove(emitted.size() - 1);
                }
            }
            emitted.add(step.symbol());
            remaining -= entry.getValue();
        }
        emitted.forEach(out::append);
    }

    private static int largestFitting(long remaining) {
        List<Map.Entry<String, Long>> table = RomanSymbols.SCAN_ORDER;
        for (int i = 0; i < table.size(); i++) {
            if (table.get(i).getValue() <= remaining) {
                return i;
            }
        }
        throw new IllegalStateException("No glyph fits " + remaining);
    }

    /**
     * Renders one large-number step. Lowercase output has no form for the
     * apostrophus thousand inside a Claudian block, so a block whose value has
     * a single apostrophus glyph is emitted as that glyph; deeper blocks stay
     * Claudian and are case-folded glyph by glyph.
     */
    private static String largeNumberBlock(boolean half, int repeat, long unit, long number, RomanOptions options) {
        if (!options.claudian()) {
            return apostrophusGlyph(unit, number);
        }
        String glyph = RomanSymbols.APOSTROPHUS.get(unit);
        if (!options.uppercase() && repeat > 0 && glyph != null) {
            return glyph;
        }
        return claudianBlock(half, repeat);
    }

    /**
     * {@code repeat} enclosures around a thousand glyph, or around a
     * five-hundred glyph for the half-magnitude case.
     */
    private static String claudianBlock(boolean half, int repeat) {
        StringBuilder block = new StringBuilder();
        if (half) {
            block.append(RomanSymbols.FIVE_HUNDRED);
        } else {
            block.append(RomanSymbols.HUNDRED.repeat(repeat));
            block.append(repeat > 0 ? RomanSymbols.APOSTROPHUS_THOUSAND : RomanSymbols.THOUSAND);
        }
        block.append(RomanSymbols.ENCLOSURE.repeat(repeat));
        return block.toString();
    }

    private static String apostrophusGlyph(long unit, long number) {
        String glyph = RomanSymbols.APOSTROPHUS.get(unit);
        if (glyph == null) {
            throw new ConfigurationException("`" + number + "` needs the `claudian` option");
        }
        return glyph;
    }

    private static String postProcess(String text, RomanOptions options) {
        String result = rewrite(text, RomanSymbols.LIGATURES);
        if (options.onlyAdditive()) {
            result = rewrite(result, RomanSymbols.ADDITIVE);
        }
        if (options.archaic()) {
            result = rewrite(result, RomanSymbols.ARCHAIC);
        }
        result = rewrite(result, options.alternatives());
        if (options.onlyAscii()) {
            result = rewrite(result, RomanSymbols.UNICODE_TO_ASCII);
        }
        return options.uppercase()
            ? result.toUpperCase(Locale.ROOT)
            : result.toLowerCase(Locale.ROOT);
    }

    static int decimalOrder(long value) {
        int order = 0;
        while (value >= 10) {
            value /= 10;
            order++;
        }
        return order;
    }

    private static long powerOfTen(int order) {
        long result = 1;
        for (int i = 0; i < order; i++) {
            result *= 10;
        }
        return result;
    }

    enum Action {
        APPEND,
        REPLACE_RUN
    }

    /**
     * What to do with the output buffer for one scanned glyph.
     *
     * @param action append the glyph, or drop the current run and append a larger glyph
     * @param symbol the glyph to append
     */
    record Step(Action action, String symbol) {
    }

    /**
     * Tracks {@code (lastSymbol, repeats)} over emitted glyphs.
     *
     * <p>{@code repeats} counts the copies that came before the current one, so
     * the first copy of a glyph has 0. A replacement leaves the state unchanged.</p>
     */
    static final class SymbolRun {

        private final int maxConsecutive;
        private String lastSymbol;
        private int repeats;

        SymbolRun(int maxConsecutive) {
            this.maxConsecutive = maxConsecutive;
        }

        Step next(String symbol, String larger) {
            repeats = symbol.equals(lastSymbol) ? repeats + 1 : 0;
            if (repeats < maxConsecutive) {
                lastSymbol = symbol;
                return new Step(Action.APPEND, symbol);
            }
            return new Step(Action.REPLACE_RUN, larger);
        }
    }
}
