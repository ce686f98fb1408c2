package com.oloc.token;

/**
 * Half-open position range {@code [start, end)} inside an expression string.
 *
 * @param start First index covered
 * @param end   Index one past the last covered position
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public static Span of(int start, int end) {
        return new Span(start, end);
    }

    public static Span at(int position) {
        return new Span(position, position + 1);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int position) {
        return position >= start && position < end;
    }

    /**
     * Smallest span covering both this span and {@code other}.
     */
    public Span union(Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
