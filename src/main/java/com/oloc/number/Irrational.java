package com.oloc.number;

import com.oloc.function.FunctionType;
import com.oloc.token.TokenGrammar;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Irrational factor of a symbolic term. Identity is the kind plus the symbol,
 * so two factors print the same exactly when they are the same factor.
 */
public final class Irrational implements Comparable<Irrational> {

    public static final Irrational PI = new Irrational(IrrationalKind.PI, TokenGrammar.PI, null, null, null, List.of());
    public static final Irrational E = new Irrational(IrrationalKind.E, TokenGrammar.E, null, null, null, List.of());

    private final IrrationalKind kind;
    private final String symbol;
    private final BigInteger radicand;
    private final SymbolicValue group;
    private final FunctionType function;
    private final List<SymbolicValue> arguments;

    private Irrational(IrrationalKind kind, String symbol, BigInteger radicand, SymbolicValue group,
                       FunctionType function, List<SymbolicValue> arguments) {
        this.kind = kind;
        this.symbol = symbol;
        this.radicand = radicand;
        this.group = group;
        this.function = function;
        this.arguments = List.copyOf(arguments);
    }

    /**
     * Short (single character) or long ({@code <name>}) custom irrational.
     */
    public static Irrational custom(String symbol) {
        IrrationalKind kind = symbol.startsWith(String.valueOf(TokenGrammar.LONG_OPEN))
                ? IrrationalKind.LONG_CUSTOM : IrrationalKind.SHORT_CUSTOM;
        return new Irrational(kind, symbol, null, null, null, List.of());
    }

    /**
     * Root base; {@code radicand} is a prime or an integer that could not be factored further.
     */
    public static Irrational radical(BigInteger radicand) {
        if (radicand.compareTo(BigInteger.ONE) <= 0) {
            throw new IllegalArgumentException("Radicand must be greater than 1: " + radicand);
        }
        return new Irrational(IrrationalKind.RADICAL, radicand.toString(), radicand, null, null, List.of());
    }

    /**
     * Irreducible sum used as a single factor.
     */
    public static Irrational group(SymbolicValue sum) {
        return new Irrational(IrrationalKind.GROUP, "(" + ValueFormatter.format(sum) + ")", null, sum, null, List.of());
    }

    /**
     * Function application that has no exact reduction.
     */
    public static Irrational retained(FunctionType function, List<SymbolicValue> arguments) {
        String text = function.canonicalName() + arguments.stream()
                .map(ValueFormatter::format)
                .collect(Collectors.joining(String.valueOf(TokenGrammar.SEPARATOR), "(", ")"));
        return new Irrational(IrrationalKind.RETAINED, text, null, null, function, arguments);
    }

    public IrrationalKind kind() {
        return kind;
    }

    public String symbol() {
        return symbol;
    }

    public BigInteger radicand() {
        return radicand;
    }

    public SymbolicValue group() {
        return group;
    }

    public FunctionType function() {
        return function;
    }

    public List<SymbolicValue> arguments() {
        return arguments;
    }

    @Override
    public int compareTo(Irrational other) {
        int byKind = kind.compareTo(other.kind);
        if (byKind != 0) {
            return byKind;
        }
        if (kind == IrrationalKind.RADICAL) {
            return radicand.compareTo(other.radicand);
        }
        return symbol.compareTo(other.symbol);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Irrational other)) {
            return false;
        }
        return kind == other.kind && symbol.equals(other.symbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
