package com.oloc.exception;

import com.oloc.token.Span;

import java.util.List;

/**
 * Thrown for unmatched brackets and bracket hierarchy violations.
 */
public class BracketException extends ExpressionException {

    public BracketException(ErrorKind kind, String expression, List<Span> spans, Object... args) {
        super(kind, expression, spans, args);
    }

    public BracketException(ErrorKind kind, String expression, Span span, Object... args) {
        super(kind, expression, List.of(span), args);
    }
}
