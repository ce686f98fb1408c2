package com.oloc.exception;

import com.oloc.token.Span;

import java.util.List;

/**
 * Thrown when a token appears where the grammar does not allow it.
 */
public class PlacementException extends ExpressionException {

    public PlacementException(ErrorKind kind, String expression, List<Span> spans, Object... args) {
        super(kind, expression, spans, args);
    }

    public PlacementException(ErrorKind kind, String expression, Span span, Object... args) {
        super(kind, expression, List.of(span), args);
    }
}
