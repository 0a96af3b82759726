package com.adobe.numeral.converter;

/**
 * Canonical Roman numeral grammar for the range 1 to 3999.
 *
 * <p>The numeral is read as four consecutive groups: thousands, hundreds,
 * tens and units. Each group is one of</p>
 * <ul>
 *   <li>nothing, or up to three repeats of its unit ({@code X}, {@code XX}, {@code XXX})</li>
 *   <li>the half symbol followed by up to three units ({@code L}, {@code LXXX})</li>
 *   <li>one of the two subtractive pairs ({@code XL}, {@code XC})</li>
 * </ul>
 * <p>The thousands group only allows the repeat form. At least one group must
 * be non-empty, so the empty string and the zero symbol are rejected.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
public final class StandardRomanGrammar implements RomanGrammar {

    /**
     * Unit, half and next unit for hundreds, tens and units.
     */
    private static final char[][] GROUPS = {
        {'C', 'D', 'M'},
        {'X', 'L', 'C'},
        {'I', 'V', 'X'}
    };

    private static final int MAX_REPEAT = 3;

    @Override
    public boolean matches(String numeral) {
        if (numeral == null || numeral.isEmpty()) {
            return false;
        }
        int pos = repeats(numeral, 0, 'M');
        for (int i = 0; i < GROUPS.length && pos >= 0; i++) {
            pos = matchGroup(numeral, pos, GROUPS[i][0], GROUPS[i][1], GROUPS[i][2]);
        }
        return pos == numeral.length();
    }

    /**
     * Consumes one group starting at {@code pos}.
     *
     * @return the position after the group, -1 if the unit repeats too often
     */
    private static int matchGroup(String s, int pos, char unit, char half, char next) {
        if (startsWith(s, pos, unit, next) || startsWith(s, pos, unit, half)) {
            return pos + 2;
        }
        if (pos < s.length() && s.charAt(pos) == half) {
            pos++;
        }
        return repeats(s, pos, unit);
    }

    /**
     * Skips up to {@link #MAX_REPEAT} copies of {@code c}; a fourth copy is a mismatch.
     */
    private static int repeats(String s, int pos, char c) {
        int count = 0;
        while (pos < s.length() && s.charAt(pos) == c) {
            pos++;
            count++;
        }
        return count > MAX_REPEAT ? -1 : pos;
    }

    private static boolean startsWith(String s, int pos, char first, char second) {
        return pos + 1 < s.length() && s.charAt(pos) == first && s.charAt(pos + 1) == second;
    }
}
