package com.adobe.numeral.converter;

import com.adobe.numeral.exception.ConfigurationException;
import com.adobe.numeral.exception.InvalidInputException;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Bijective base-k implementation of {@link TokenConverter}.
 * 
 * <h2>Algorithm:</h2>
 * <p>Encoding repeatedly takes {@code digit = n mod k}, prepends
 * {@code tokens[digit]} and continues with {@code n = n div k - 1} until
 * {@code n} drops below zero. The {@code - 1} is what removes the need for a
 * zero digit.</p>
 * 
 * <p>Decoding walks the text from the end, each step removing the first token
 * (in list order) that is a suffix of what is left, and accumulates
 * {@code (index + offset) * k^i}, where the offset is 0 for the rightmost
 * digit and 1 for every other one.</p>
 * 
 * <h2>Thread Safety:</h2>
 * <p>Stateless. Validation happens on every call, nothing is precomputed.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
@Component
public class BijectiveTokenConverter implements TokenConverter {

    @Override
    public String encode(long number, List<String> tokens, String negativeSign) {
        validate(tokens, negativeSign);

        boolean negative = number < 0;
        long remaining = absolute(number);
        int base = tokens.size();

        StringBuilder result = new StringBuilder();
        while (remaining >= 0) {
            result.insert(0, tokens.get((int) (remaining % base)));
            remaining = remaining / base - 1;
        }

        if (negative) {
            result.insert(0, negativeSign);
        }
        return result.toString();
    }

    @Override
    public long decode(String text, List<String> tokens, String negativeSign) {
        validate(tokens, negativeSign);
        if (text == null || text.isEmpty()) {
            throw new InvalidInputException("Text to decode must not be empty");
        }

        boolean negative = text.startsWith(negativeSign);
        String remaining = negative ? text.substring(negativeSign.length()) : text;
        if (remaining.contains(negativeSign)) {
            throw new InvalidInputException(String.format(
                "Sign '%s' is only allowed at the start, got: %s", negativeSign, text));
        }
        if (remaining.isEmpty()) {
            throw new InvalidInputException("No digits after sign in: " + text);
        }
        checkCharacters(remaining, tokens);

        int base = tokens.size();
        long number = 0;
        long weight = 1;
        int position = 0;
        try {
            while (!remaining.isEmpty()) {
                int index = suffixIndex(remaining, tokens);
                if (index < 0) {
                    throw new InvalidInputException(String.format(
                        "Cannot split '%s' into tokens %s", text, tokens));
                }
                remaining = remaining.substring(0, remaining.length() - tokens.get(index).length());

                int offset = position == 0 ? 0 : 1;
                number = Math.addExact(number, Math.multiplyExact(index + offset, weight));
                position++;
                if (!remaining.isEmpty()) {
                    weight = Math.multiplyExact(weight, base);
                }
            }
        } catch (ArithmeticException e) {
            throw new InvalidInputException("Value of '" + text + "' does not fit in a long", e);
        }
        return negative ? -number : number;
    }

    /**
     * Index of the first token that ends {@code text}, or -1.
     */
    private static int suffixIndex(String text, List<String> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            if (text.endsWith(tokens.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private static void checkCharacters(String text, List<String> tokens) {
        Set<Integer> alphabet = new HashSet<>();
        for (String token : tokens) {
            token.codePoints().forEach(alphabet::add);
        }
        text.codePoints().forEach(cp -> {
            if (!alphabet.contains(cp)) {
                throw new InvalidInputException(String.format(
                    "Character '%s' is not part of tokens %s", new String(Character.toChars(cp)), tokens));
            }
        });
    }

    private static void validate(List<String> tokens, String negativeSign) {
        if (tokens == null || tokens.isEmpty()) {
            throw new ConfigurationException("At least one token is required");
        }
        if (negativeSign == null || negativeSign.isEmpty()) {
            throw new ConfigurationException("Negative sign must not be empty");
        }
        Set<String> seen = new HashSet<>();
        for (String token : tokens) {
            if (token == null || token.isEmpty()) {
                throw new ConfigurationException("Tokens must not be empty");
            }
            if (!seen.add(token)) {
                throw new ConfigurationException("Duplicate token: " + token);
            }
            if (token.contains(negativeSign)) {
                throw new ConfigurationException(String.format(
                    "Negative sign '%s' collides with token '%s'", negativeSign, token));
            }
        }
    }

    private static long absolute(long number) {
        if (number == Long.MIN_VALUE) {
            throw new InvalidInputException("Number out of range: " + number);
        }
        return Math.abs(number);
    }
}
