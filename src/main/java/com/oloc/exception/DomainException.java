package com.oloc.exception;

import com.oloc.token.Span;

import java.util.List;

/**
 * Thrown when a function or operator receives an operand outside its domain.
 */
public class DomainException extends ExpressionException {

    public DomainException(ErrorKind kind, String expression, List<Span> spans, Object... args) {
        super(kind, expression, spans, args);
    }

    public DomainException(ErrorKind kind, String expression, Span span, Object... args) {
        super(kind, expression, List.of(span), args);
    }
}
