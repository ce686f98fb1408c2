package com.oloc.preprocess;

import com.oloc.token.Span;

/**
 * Preprocessor output: the original input, the normalized text and the span
 * map from normalized positions back to the input.
 *
 * @param original Input as given by the caller
 * @param tracked  Normalized text with per-character origins
 */
public record NormalizedExpression(String original, TrackedText tracked) {

    /**
     * Treat already normalized text as its own original.
     */
    public static NormalizedExpression identity(String text) {
        return new NormalizedExpression(text, TrackedText.of(text));
    }

    public String text() {
        return tracked.text();
    }

    public Span originOf(Span span) {
        return tracked.originOf(span);
    }
}
