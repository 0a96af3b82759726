package com.adobe.numeral.converter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered literal substitution over a string.
 *
 * <p>Each {@link Replacement} replaces every occurrence of its pattern in the
 * current text before the next one is considered, so later replacements see
 * the output of earlier ones. The list is walked exactly once; there is no
 * fixed-point iteration.</p>
 *
 * <pre>
 * rewrite("python.best", [thon→mrt, est→ase])  → "pymrt.base"
 * rewrite("x-x-x-x",     [x→est, est→test])    → "test-test-test-test"
 * rewrite("x-x-",        [-x-→.test])          → "x.test"
 * </pre>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
public final class StringRewriter {

    private StringRewriter() {
    }

    /**
     * A single literal (non-regex) substitution.
     *
     * @param pattern     the text to look for, never empty
     * @param replacement the text to put in its place
     */
    public record Replacement(String pattern, String replacement) {

        public Replacement {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(replacement, "replacement");
            if (pattern.isEmpty()) {
                throw new IllegalArgumentException("Replacement pattern must not be empty");
            }
        }

        /**
         * Shorthand factory, reads well in table definitions.
         */
        public static Replacement of(String pattern, String replacement) {
            return new Replacement(pattern, replacement);
        }

        /**
         * Returns the same substitution in the opposite direction.
         */
        public Replacement reversed() {
            return new Replacement(replacement, pattern);
        }
    }

    /**
     * Applies the replacements to {@code text} in list order.
     *
     * @param text         the input text
     * @param replacements ordered substitutions
     * @return the rewritten text
     */
    public static String rewrite(String text, List<Replacement> replacements) {
        String result = text;
        for (Replacement r : replacements) {
            result = result.replace(r.pattern(), r.replacement());
        }
        return result;
    }

    /**
     * Builds the reverse-direction table, keeping the original order.
     *
     * @throws IllegalArgumentException if an entry has an empty replacement
     */
    public static List<Replacement> inverse(List<Replacement> replacements) {
        List<Replacement> inverted = new ArrayList<>(replacements.size());
        for (Replacement r : replacements) {
            inverted.add(r.reversed());
        }
        return List.copyOf(inverted);
    }
}
