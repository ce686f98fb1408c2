package com.oloc.exception;

import com.oloc.token.Span;

import java.util.List;

/**
 * Thrown when dividing (or taking a modulo) by an exact zero.
 */
public class DivideByZeroException extends ExpressionException {

    public DivideByZeroException(ErrorKind kind, String expression, List<Span> spans, Object... args) {
        super(kind, expression, spans, args);
    }

    public DivideByZeroException(ErrorKind kind, String expression, Span span, Object... args) {
        super(kind, expression, List.of(span), args);
    }
}
