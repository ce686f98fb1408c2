package com.oloc.exception;

import com.oloc.token.Span;

import java.util.List;

/**
 * Thrown when a numeric literal (or an unrecognized token) is malformed.
 */
public class LiteralFormatException extends ExpressionException {

    public LiteralFormatException(ErrorKind kind, String expression, List<Span> spans, Object... args) {
        super(kind, expression, spans, args);
    }

    public LiteralFormatException(ErrorKind kind, String expression, Span span, Object... args) {
        super(kind, expression, List.of(span), args);
    }
}
