package com.oloc.preprocess;

import com.oloc.token.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Text being rewritten by the preprocessor, with the span of the original input
 * every character derives from. Characters inserted by a rewrite carry the span
 * of the input they replace.
 */
public final class TrackedText {

    private final String text;
    private final List<Span> origins;
    private final int originalLength;

    private TrackedText(String text, List<Span> origins, int originalLength) {
        this.text = text;
        this.origins = List.copyOf(origins);
        this.originalLength = originalLength;
    }

    /**
     * Untouched input: character i maps to [i, i+1).
     */
    public static TrackedText of(String original) {
        List<Span> origins = new ArrayList<>(original.length());
        for (int i = 0; i < original.length(); i++) {
            origins.add(Span.at(i));
        }
        return new TrackedText(original, origins, original.length());
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public char charAt(int index) {
        return text.charAt(index);
    }

    public Span originAt(int index) {
        return origins.get(index);
    }

    /**
     * Original-input span covered by a span of this text. An empty span maps
     * to the original position it sits at.
     */
    public Span originOf(Span span) {
        if (span.isEmpty() || text.isEmpty()) {
            int position;
            if (span.start() < origins.size()) {
                position = origins.get(span.start()).start();
            } else if (!origins.isEmpty()) {
                position = origins.get(origins.size() - 1).end();
            } else {
                position = originalLength;
            }
            return Span.of(position, position);
        }
        int end = Math.min(span.end(), origins.size());
        Span result = origins.get(span.start());
        for (int i = span.start() + 1; i < end; i++) {
            result = result.union(origins.get(i));
        }
        return result;
    }

    public Builder rewrite() {
        return new Builder(originalLength);
    }

    @Override
    public String toString() {
        return text;
    }

    /**
     * Accumulates a rewritten text with its origins.
     */
    public static final class Builder {

        private final StringBuilder text = new StringBuilder();
        private final List<Span> origins = new ArrayList<>();
        private final int originalLength;

        private Builder(int originalLength) {
            this.originalLength = originalLength;
        }

        public Builder append(char c, Span origin) {
            text.append(c);
            origins.add(origin);
            return this;
        }

        public Builder append(String s, Span origin) {
            for (int i = 0; i < s.length(); i++) {
                append(s.charAt(i), origin);
            }
            return this;
        }

        /**
         * Copy characters [from, to) of {@code source} with their origins.
         */
        public Builder copy(TrackedText source, int from, int to) {
            for (int i = from; i < to; i++) {
                append(source.charAt(i), source.originAt(i));
            }
            return this;
        }

        public int length() {
            return text.length();
        }

        public char lastChar() {
            return text.charAt(text.length() - 1);
        }

        public TrackedText build() {
            return new TrackedText(text.toString(), origins, originalLength);
        }
    }
}
