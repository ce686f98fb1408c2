package com.oloc.exception;

import com.oloc.token.Span;

import java.util.List;

/**
 * Thrown when a digit-group separator is placed illegally.
 */
public class SeparatorException extends ExpressionException {

    public SeparatorException(ErrorKind kind, String expression, List<Span> spans, Object... args) {
        super(kind, expression, spans, args);
    }

    public SeparatorException(ErrorKind kind, String expression, Span span, Object... args) {
        super(kind, expression, List.of(span), args);
    }
}
