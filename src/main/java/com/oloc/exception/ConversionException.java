package com.oloc.exception;

import com.oloc.token.Span;

import java.util.List;

/**
 * Thrown when a value cannot be converted to the requested numeric form.
 */
public class ConversionException extends ExpressionException {

    public ConversionException(ErrorKind kind, String expression, List<Span> spans, Object... args) {
        super(kind, expression, spans, args);
    }

    public ConversionException(ErrorKind kind, String expression, Span span, Object... args) {
        super(kind, expression, List.of(span), args);
    }
}
