package com.oloc.lexer;

import com.oloc.number.Fraction;

import java.math.BigInteger;

/**
 * Exact value of repeating decimals written {@code 1.2323...} (period detected
 * from the digits) or {@code 10.1:2} (explicit repeating digits).
 */
final class RepeatingDecimal {

    private RepeatingDecimal() {
    }

    /**
     * Shortest period p such that the last p fractional digits occur at least
     * twice in a row at the end; the last digit when nothing repeats.
     */
    static int period(String fraction) {
        for (int p = 1; 2 * p <= fraction.length(); p++) {
            String tail = fraction.substring(fraction.length() - p);
            String before = fraction.substring(fraction.length() - 2 * p, fraction.length() - p);
            if (tail.equals(before)) {
                return p;
            }
        }
        return 1;
    }

    /**
     * Value of {@code integer.fixed(repeat)(repeat)...}.
     */
    static Fraction value(String integer, String fixed, String repeat) {
        BigInteger withRepeat = new BigInteger(integer + fixed + repeat);
        BigInteger withoutRepeat = new BigInteger(integer + fixed);
        BigInteger denominator = BigInteger.TEN.pow(fixed.length())
                .multiply(BigInteger.TEN.pow(repeat.length()).subtract(BigInteger.ONE));
        return Fraction.of(withRepeat.subtract(withoutRepeat), denominator);
    }

    /**
     * Parse a validated repeating decimal literal.
     */
    static Fraction parse(String literal) {
        int dot = literal.indexOf('.');
        String integer = literal.substring(0, dot);
        int colon = literal.indexOf(':');
        if (colon >= 0) {
            return value(integer, literal.substring(dot + 1, colon), literal.substring(colon + 1));
        }
        int end = dot + 1;
        while (end < literal.length() && Character.isDigit(literal.charAt(end))) {
            end++;
        }
        String fraction = literal.substring(dot + 1, end);
        int p = period(fraction);
        String repeat = fraction.substring(fraction.length() - p);
        String fixed = fraction.substring(0, fraction.length() - p);
        while (fixed.endsWith(repeat)) {
            fixed = fixed.substring(0, fixed.length() - p);
        }
        return value(integer, fixed, repeat);
    }
}
