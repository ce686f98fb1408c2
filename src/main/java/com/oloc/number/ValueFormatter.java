package com.oloc.number;

import com.oloc.function.FunctionType;
import com.oloc.token.TokenGrammar;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Prints exact values in the expression language, so a printed value parses
 * back to the same value. Juxtaposition binds tighter than '/', which makes
 * {@code 1/2y} read as one half over y.
 */
public final class ValueFormatter {

    /**
     * Outermost syntactic form of a printed value, from loosest to tightest.
     */
    public enum Shape {
        SUM,
        SIGNED,
        QUOTIENT,
        PRODUCT,
        POWER,
        ATOM
    }

    private ValueFormatter() {
    }

    public static String format(SymbolicValue value) {
        if (value.isZero()) {
            return "0";
        }
        StringBuilder text = new StringBuilder();
        for (SymbolicTerm term : value.terms()) {
            String piece = format(term);
            if (text.length() > 0 && !piece.startsWith("-")) {
                text.append(TokenGrammar.PLUS);
            }
            text.append(piece);
        }
        return text.toString();
    }

    public static String format(SymbolicTerm term) {
        Parts parts = parts(term);
        String text = (parts.negative ? "-" : "") + join(parts.numerator);
        if (!parts.denominator.isEmpty()) {
            text += TokenGrammar.DIVIDE + join(parts.denominator);
        }
        return text;
    }

    public static Shape shape(SymbolicValue value) {
        if (value.terms().size() > 1) {
            return Shape.SUM;
        }
        Parts parts = parts(value.singleTerm());
        if (parts.negative) {
            return Shape.SIGNED;
        }
        if (!parts.denominator.isEmpty()) {
            return Shape.QUOTIENT;
        }
        if (parts.numerator.size() > 1) {
            return Shape.PRODUCT;
        }
        String only = parts.numerator.get(0);
        if (only.indexOf(TokenGrammar.POWER) >= 0 || only.charAt(0) == TokenGrammar.SQRT) {
            return Shape.POWER;
        }
        return Shape.ATOM;
    }

    private record Parts(boolean negative, List<String> numerator, List<String> denominator) {
    }

    private static Parts parts(SymbolicTerm term) {
        Fraction c = term.coefficient();
        List<String> numeratorFactors = new ArrayList<>();
        List<String> denominatorFactors = new ArrayList<>();
        Map<Fraction, BigInteger> radicals = new TreeMap<>();
        for (Map.Entry<Irrational, Fraction> entry : term.factors().entrySet()) {
            Irrational atom = entry.getKey();
            Fraction exponent = entry.getValue();
            if (atom.kind() == IrrationalKind.RADICAL && exponent.signum() > 0) {
                radicals.merge(exponent, atom.radicand(), BigInteger::multiply);
            } else if (exponent.signum() > 0) {
                numeratorFactors.add(power(atom.symbol(), exponent));
            } else {
                denominatorFactors.add(power(atom.symbol(), exponent.negate()));
            }
        }
        radicals.forEach((exponent, radicand) -> numeratorFactors.add(exponent.equals(Fraction.HALF)
                ? TokenGrammar.SQRT + radicand.toString()
                : power(radicand.toString(), exponent)));

        List<String> numerator = new ArrayList<>();
        BigInteger top = c.numerator().abs();
        if (!top.equals(BigInteger.ONE) || numeratorFactors.isEmpty()) {
            numerator.add(top.toString());
        }
        numerator.addAll(numeratorFactors);
        List<String> denominator = new ArrayList<>();
        if (!c.denominator().equals(BigInteger.ONE)) {
            denominator.add(c.denominator().toString());
        }
        denominator.addAll(denominatorFactors);
        return new Parts(c.signum() < 0, numerator, denominator);
    }

    private static String power(String base, Fraction exponent) {
        if (exponent.isOne()) {
            return base;
        }
        if (exponent.isInteger()) {
            return base + TokenGrammar.POWER + exponent;
        }
        return base + TokenGrammar.POWER + "(" + exponent + ")";
    }

    private static String join(List<String> pieces) {
        StringBuilder text = new StringBuilder();
        for (String piece : pieces) {
            text.append(juxtapose(text.toString(), piece));
        }
        return text.toString();
    }

    /**
     * Text to append to {@code left} to write the product with {@code right}:
     * {@code right} itself, or '·' and {@code right} where plain juxtaposition
     * would merge two numbers or spell a function name.
     */
    public static String juxtapose(String left, String right) {
        if (left.isEmpty() || right.isEmpty()) {
            return right;
        }
        char last = left.charAt(left.length() - 1);
        char first = right.charAt(0);
        boolean explicit = (Character.isDigit(last) && Character.isDigit(first))
                || (Character.isLetter(last) && startsWithCall(right));
        return explicit ? TokenGrammar.IMPLICIT_MULTIPLY + right : right;
    }

    private static boolean startsWithCall(String text) {
        for (FunctionType function : FunctionType.values()) {
            String name = function.canonicalName();
            if (text.startsWith(name + "(")) {
                return true;
            }
        }
        return false;
    }
}
