package com.oloc.parser;

import com.oloc.token.TokenGrammar;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operators with their binding strength; a higher precedence binds tighter.
 */
public enum Operator {
    PLUS(TokenGrammar.PLUS, Operator.ADDITIVE),
    MINUS(TokenGrammar.MINUS, Operator.ADDITIVE),
    MULTIPLY(TokenGrammar.MULTIPLY, Operator.MULTIPLICATIVE),
    DIVIDE(TokenGrammar.DIVIDE, Operator.MULTIPLICATIVE),
    IMPLICIT_MULTIPLY(TokenGrammar.IMPLICIT_MULTIPLY, Operator.IMPLICIT),
    POWER(TokenGrammar.POWER, Operator.EXPONENT),
    MODULO(TokenGrammar.PERCENT, Operator.EXPONENT),
    SQRT(TokenGrammar.SQRT, Operator.UNARY),
    FACTORIAL(TokenGrammar.FACTORIAL, Operator.UNARY),
    DEGREE(TokenGrammar.DEGREE, Operator.UNARY),
    ABS(TokenGrammar.ABS_BAR, Operator.PRIMARY);

    public static final int ADDITIVE = 1;
    public static final int MULTIPLICATIVE = 2;
    public static final int IMPLICIT = 3;
    public static final int EXPONENT = 4;
    public static final int UNARY = 5;
    public static final int PRIMARY = 6;

    private final char symbol;
    private final int precedence;

    Operator(char symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public static Optional<Operator> fromSymbol(char symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol == symbol).findFirst();
    }

    public char symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isPostfix() {
        return this == FACTORIAL || this == DEGREE;
    }
}
