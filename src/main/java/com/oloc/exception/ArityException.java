package com.oloc.exception;

import com.oloc.token.Span;

import java.util.List;

/**
 * Thrown when a function is called with the wrong number of arguments.
 */
public class ArityException extends ExpressionException {

    public ArityException(ErrorKind kind, String expression, List<Span> spans, Object... args) {
        super(kind, expression, spans, args);
    }

    public ArityException(ErrorKind kind, String expression, Span span, Object... args) {
        super(kind, expression, List.of(span), args);
    }
}
