package com.oloc.exception;

import com.oloc.token.Span;

import java.util.List;

/**
 * Thrown when free comments are not properly paired.
 */
public class CommentException extends ExpressionException {

    public CommentException(ErrorKind kind, String expression, List<Span> spans, Object... args) {
        super(kind, expression, spans, args);
    }

    public CommentException(ErrorKind kind, String expression, Span span, Object... args) {
        super(kind, expression, List.of(span), args);
    }
}
