package com.oloc.lexer;

import com.oloc.exception.DivideByZeroException;
import com.oloc.exception.ErrorKind;
import com.oloc.number.Fraction;
import com.oloc.token.Span;
import com.oloc.token.Token;
import com.oloc.token.TokenGrammar;
import com.oloc.token.TokenType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rewrites every rational literal as {@code numerator / denominator} in lowest
 * terms (a lone integer when the denominator is 1) and reduces integer ratios
 * already written that way. A rewritten ratio is parenthesized when a neighbour
 * would otherwise bind one of its halves.
 */
final class Fractionizer {

    /** Operators that take the token after them tighter than '/'. */
    private static final Set<Character> BINDS_RIGHT = Set.of(
            TokenGrammar.DIVIDE, TokenGrammar.POWER, TokenGrammar.PERCENT,
            TokenGrammar.IMPLICIT_MULTIPLY, TokenGrammar.SQRT);

    /** Operators that take the token before them tighter than '/'. */
    private static final Set<Character> BINDS_LEFT = Set.of(
            TokenGrammar.POWER, TokenGrammar.PERCENT, TokenGrammar.IMPLICIT_MULTIPLY,
            TokenGrammar.FACTORIAL, TokenGrammar.DEGREE);

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private Fractionizer() {
    }

    static List<Token> apply(List<Token> tokens, String expression) {
        return reduceRatios(rewriteLiterals(tokens, expression), expression);
    }

    private static List<Token> rewriteLiterals(List<Token> tokens, String expression) {
        List<Token> out = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.type().isRationalLiteral()) {
                out.add(token);
                continue;
            }
            Fraction value = valueOf(token, expression);
            Token before = i > 0 ? tokens.get(i - 1) : null;
            Token after = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
            emit(out, value, token.origin(), bindsRight(before) || bindsLeft(after));
        }
        return out;
    }

    /**
     * Reduce {@code INTEGER / INTEGER} whose neighbours cannot bind either half.
     */
    private static List<Token> reduceRatios(List<Token> tokens, String expression) {
        List<Token> out = new ArrayList<>(tokens.size());
        int i = 0;
        while (i < tokens.size()) {
            if (isRatio(tokens, i)) {
                Token before = i > 0 ? tokens.get(i - 1) : null;
                Token after = i + 3 < tokens.size() ? tokens.get(i + 3) : null;
                if (!bindsRight(before) && !bindsLeft(after)) {
                    Token numerator = tokens.get(i);
                    Token denominator = tokens.get(i + 2);
                    Span origin = numerator.origin().union(denominator.origin());
                    BigInteger d = new BigInteger(denominator.value());
                    if (d.signum() == 0) {
                        throw new DivideByZeroException(ErrorKind.DIVIDE_BY_ZERO, expression, origin,
                                expression.substring(origin.start(), origin.end()));
                    }
                    emit(out, Fraction.of(new BigInteger(numerator.value()), d), origin, false);
                    i += 3;
                    continue;
                }
            }
            out.add(tokens.get(i));
            i++;
        }
        return out;
    }

    private static boolean isRatio(List<Token> tokens, int i) {
        return i + 2 < tokens.size()
                && tokens.get(i).type() == TokenType.INTEGER
                && tokens.get(i + 1).isOperator(TokenGrammar.DIVIDE)
                && tokens.get(i + 2).type() == TokenType.INTEGER;
    }

    private static void emit(List<Token> out, Fraction value, Span origin, boolean parenthesize) {
        if (value.isInteger()) {
            out.add(Token.synthetic(TokenType.INTEGER, value.numerator().toString(), 0, origin));
            return;
        }
        if (parenthesize) {
            out.add(Token.synthetic(TokenType.LBRACKET, "(", 0, origin));
        }
        out.add(Token.synthetic(TokenType.INTEGER, value.numerator().toString(), 0, origin));
        out.add(Token.synthetic(TokenType.OPERATOR, String.valueOf(TokenGrammar.DIVIDE), 0, origin));
        out.add(Token.synthetic(TokenType.INTEGER, value.denominator().toString(), 0, origin));
        if (parenthesize) {
            out.add(Token.synthetic(TokenType.RBRACKET, ")", 0, origin));
        }
    }

    private static boolean bindsRight(Token token) {
        return token != null && token.type() == TokenType.OPERATOR && BINDS_RIGHT.contains(token.value().charAt(0));
    }

    private static boolean bindsLeft(Token token) {
        return token != null && token.type() == TokenType.OPERATOR && BINDS_LEFT.contains(token.value().charAt(0));
    }

    /**
     * Exact value of a validated rational literal.
     */
    static Fraction valueOf(Token token, String expression) {
        String text = token.value();
        return switch (token.type()) {
            case INTEGER -> Fraction.of(new BigInteger(text));
            case FINITE_DECIMAL -> Fraction.of(new BigDecimal(text));
            case INFINITE_DECIMAL -> RepeatingDecimal.parse(text);
            case PERCENTAGE -> Fraction.of(new BigDecimal(text.substring(0, text.length() - 1)))
                    .divide(Fraction.of(HUNDRED));
            case MIXED_FRACTION -> mixed(token, expression);
            default -> throw new IllegalArgumentException("Not a rational literal: " + token);
        };
    }

    private static Fraction mixed(Token token, String expression) {
        String text = token.value();
        int bar = Math.max(text.indexOf(TokenGrammar.UNDERSCORE), text.indexOf(TokenGrammar.ABS_BAR));
        int slash = text.indexOf(TokenGrammar.DIVIDE);
        BigInteger whole = new BigInteger(text.substring(0, bar));
        BigInteger numerator = new BigInteger(text.substring(bar + 1, slash));
        BigInteger denominator = new BigInteger(text.substring(slash + 1));
        if (denominator.signum() == 0) {
            throw new DivideByZeroException(ErrorKind.DIVIDE_BY_ZERO, expression, token.origin(), text);
        }
        return Fraction.of(whole).add(Fraction.of(numerator, denominator));
    }
}
