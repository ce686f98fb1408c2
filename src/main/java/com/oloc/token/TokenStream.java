package com.oloc.token;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered tokens plus the string they were derived from.
 * Concatenating the token values in order reproduces {@link #source()} exactly.
 */
public final class TokenStream {

    private final List<Token> tokens;
    private final String source;

    private TokenStream(List<Token> tokens, String source) {
        this.tokens = List.copyOf(tokens);
        this.source = source;
    }

    /**
     * Rebuild a stream from tokens, relocating spans so they are contiguous.
     */
    public static TokenStream of(List<Token> tokens) {
        List<Token> relocated = new ArrayList<>(tokens.size());
        StringBuilder source = new StringBuilder();
        for (Token token : tokens) {
            relocated.add(token.moveTo(source.length()));
            source.append(token.value());
        }
        return new TokenStream(relocated, source.toString());
    }

    public List<Token> tokens() {
        return tokens;
    }

    public String source() {
        return source;
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public List<String> values() {
        return tokens.stream().map(Token::value).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TokenStream other)) {
            return false;
        }
        return source.equals(other.source) && sameShape(other);
    }

    private boolean sameShape(TokenStream other) {
        if (tokens.size() != other.tokens.size()) {
            return false;
        }
        for (int i = 0; i < tokens.size(); i++) {
            Token a = tokens.get(i);
            Token b = other.tokens.get(i);
            if (a.type() != b.type() || !a.value().equals(b.value()) || !a.span().equals(b.span())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return tokens.toString();
    }
}
