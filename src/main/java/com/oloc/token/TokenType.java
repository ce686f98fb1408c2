package com.oloc.token;

import com.oloc.exception.ErrorKind;

/**
 * Token types produced by the lexer.
 */
public enum TokenType {
    // Rational literals
    INTEGER(ErrorKind.INVALID_INTEGER),
    FINITE_DECIMAL(ErrorKind.INVALID_FINITE_DECIMAL),
    INFINITE_DECIMAL(ErrorKind.INVALID_INFINITE_DECIMAL),
    PERCENTAGE(ErrorKind.INVALID_PERCENTAGE),
    MIXED_FRACTION(ErrorKind.INVALID_MIXED_FRACTION),

    // Irrationals
    NATIVE_IRRATIONAL(ErrorKind.UNKNOWN_TOKEN),
    SHORT_CUSTOM_IRRATIONAL(ErrorKind.INVALID_SHORT_CUSTOM_IRRATIONAL),
    LONG_CUSTOM_IRRATIONAL(ErrorKind.INVALID_LONG_CUSTOM_IRRATIONAL),
    IRRATIONAL_PARAM(ErrorKind.INVALID_IRRATIONAL_PARAM),

    // Operators and delimiters
    OPERATOR(ErrorKind.UNKNOWN_TOKEN),
    LBRACKET(ErrorKind.UNKNOWN_TOKEN),
    RBRACKET(ErrorKind.UNKNOWN_TOKEN),
    FUNCTION(ErrorKind.UNKNOWN_TOKEN),
    PARAM_SEPARATOR(ErrorKind.UNKNOWN_TOKEN),

    // Special
    UNKNOWN(ErrorKind.UNKNOWN_TOKEN);

    private final ErrorKind invalidKind;

    TokenType(ErrorKind invalidKind) {
        this.invalidKind = invalidKind;
    }

    /**
     * Error kind reported when a token of this type fails its grammar check.
     */
    public ErrorKind invalidKind() {
        return invalidKind;
    }

    public boolean isRationalLiteral() {
        return this == INTEGER || this == FINITE_DECIMAL || this == INFINITE_DECIMAL
                || this == PERCENTAGE || this == MIXED_FRACTION;
    }

    public boolean isIrrational() {
        return this == NATIVE_IRRATIONAL || this == SHORT_CUSTOM_IRRATIONAL || this == LONG_CUSTOM_IRRATIONAL;
    }

    public boolean isIrrationalFamily() {
        return isIrrational() || this == IRRATIONAL_PARAM;
    }
}
