package com.oloc.token;

/**
 * Classified lexical unit of a normalized expression.
 *
 * @param type   Token type
 * @param value  Text of the token as it appears in the stream source
 * @param span   Position in the token stream source
 * @param origin Position in the original input the token derives from
 * @param valid  Result of the type-specific grammar check
 */
public record Token(TokenType type, String value, Span span, Span origin, boolean valid) {

    public Token {
        if (span.length() != value.length()) {
            throw new IllegalArgumentException("Span " + span + " does not match token value '" + value + "'");
        }
    }

    /**
     * Create a token and run its grammar check.
     */
    public static Token of(TokenType type, String value, int start, Span origin) {
        return new Token(type, value, Span.of(start, start + value.length()), origin,
                TokenGrammar.check(type, value));
    }

    /**
     * Synthetic token (inserted or rewritten by a lexer pass) placed at {@code start}.
     */
    public static Token synthetic(TokenType type, String value, int start, Span origin) {
        return of(type, value, start, origin);
    }

    /**
     * Copy of this token relocated to {@code start} in a rebuilt stream.
     */
    public Token moveTo(int start) {
        if (start == span.start()) {
            return this;
        }
        return new Token(type, value, Span.of(start, start + value.length()), origin, valid);
    }

    /**
     * Copy of this token with a different value of the same type.
     */
    public Token withValue(String newValue) {
        return of(type, newValue, span.start(), origin);
    }

    public boolean isOperator(char symbol) {
        return type == TokenType.OPERATOR && value.length() == 1 && value.charAt(0) == symbol;
    }

    public boolean isBinaryOperator() {
        return type == TokenType.OPERATOR && TokenGrammar.BINARY_OPERATORS.contains(value.charAt(0));
    }

    @Override
    public String toString() {
        return type + "(" + value + ")";
    }
}
