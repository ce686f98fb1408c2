package com.oloc.exception;

import com.oloc.token.Span;

import java.util.List;

/**
 * Thrown for malformed short/long custom irrationals and irrational parameters.
 */
public class IrrationalFormatException extends ExpressionException {

    public IrrationalFormatException(ErrorKind kind, String expression, List<Span> spans, Object... args) {
        super(kind, expression, spans, args);
    }

    public IrrationalFormatException(ErrorKind kind, String expression, Span span, Object... args) {
        super(kind, expression, List.of(span), args);
    }
}
