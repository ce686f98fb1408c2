package com.oloc.exception;

import com.oloc.token.Span;

import java.util.Arrays;
import java.util.List;

/**
 * Base class for errors detected while processing an expression.
 * Carries the error kind, a snapshot of the offending expression and the spans
 * (into that snapshot) the error refers to. Nothing is printed here; callers
 * render diagnostics with {@link #render()} or from the raw data.
 */
public abstract class ExpressionException extends OlocException {

    private final ErrorKind kind;
    private final String expression;
    private final List<Span> spans;

    protected ExpressionException(ErrorKind kind, String expression, List<Span> spans, Object... args) {
        super(kind.format(args));
        this.kind = kind;
        this.expression = expression == null ? "" : expression;
        this.spans = List.copyOf(spans);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getExpression() {
        return expression;
    }

    public List<Span> getSpans() {
        return spans;
    }

    public String getHint() {
        return kind.hint();
    }

    /**
     * Caret-style diagnostic: message, expression, marker line and hint.
     */
    public String render() {
        char[] markers = new char[expression.length()];
        Arrays.fill(markers, ' ');
        for (Span span : spans) {
            int end = Math.min(span.end(), expression.length());
            for (int i = span.start(); i < end; i++) {
                markers[i] = '^';
            }
            if (span.isEmpty() && span.start() < markers.length) {
                markers[span.start()] = '^';
            }
        }
        return getClass().getSimpleName() + ": " + getMessage() + "\n"
                + expression + "\n"
                + new String(markers).stripTrailing() + "\n"
                + "Hint: " + getHint();
    }
}
