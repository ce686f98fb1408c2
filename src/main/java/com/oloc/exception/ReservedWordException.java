package com.oloc.exception;

import com.oloc.token.Span;

import java.util.List;

/**
 * Thrown when a custom irrational collides with a reserved word.
 */
public class ReservedWordException extends ExpressionException {

    public ReservedWordException(ErrorKind kind, String expression, List<Span> spans, Object... args) {
        super(kind, expression, spans, args);
    }

    public ReservedWordException(ErrorKind kind, String expression, Span span, Object... args) {
        super(kind, expression, List.of(span), args);
    }
}
