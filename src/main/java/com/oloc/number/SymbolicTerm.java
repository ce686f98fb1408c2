package com.oloc.number;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Rational coefficient times a product of irrational factors with rational
 * exponents. Negative exponents are denominator factors. Radical exponents are
 * kept inside (0, 1); whole powers of a radical move into the coefficient.
 */
public final class SymbolicTerm implements Comparable<SymbolicTerm> {

    public static final SymbolicTerm ZERO = new SymbolicTerm(Fraction.ZERO, Collections.emptySortedMap());
    public static final SymbolicTerm ONE = new SymbolicTerm(Fraction.ONE, Collections.emptySortedMap());

    private final Fraction coefficient;
    private final SortedMap<Irrational, Fraction> factors;

    private SymbolicTerm(Fraction coefficient, SortedMap<Irrational, Fraction> factors) {
        this.coefficient = coefficient;
        this.factors = factors;
    }

    public static SymbolicTerm of(Fraction coefficient) {
        return coefficient.isZero() ? ZERO : new SymbolicTerm(coefficient, Collections.emptySortedMap());
    }

    public static SymbolicTerm of(Irrational atom) {
        return of(Fraction.ONE, Map.of(atom, Fraction.ONE));
    }

    public static SymbolicTerm of(Fraction coefficient, Map<Irrational, Fraction> factors) {
        if (coefficient.isZero()) {
            return ZERO;
        }
        SortedMap<Irrational, Fraction> normalized = new TreeMap<>();
        Fraction c = coefficient;
        for (Map.Entry<Irrational, Fraction> entry : factors.entrySet()) {
            Irrational atom = entry.getKey();
            Fraction exponent = entry.getValue();
            if (atom.kind() == IrrationalKind.RADICAL) {
                BigInteger whole = exponent.floor();
                if (whole.signum() != 0) {
                    c = c.multiply(Fraction.of(atom.radicand()).pow(whole.intValueExact()));
                    exponent = exponent.subtract(Fraction.of(whole));
                }
            }
            if (!exponent.isZero()) {
                normalized.put(atom, exponent);
            }
        }
        return new SymbolicTerm(c, Collections.unmodifiableSortedMap(normalized));
    }

    public Fraction coefficient() {
        return coefficient;
    }

    public SortedMap<Irrational, Fraction> factors() {
        return factors;
    }

    public boolean isConstant() {
        return factors.isEmpty();
    }

    public boolean isZero() {
        return coefficient.isZero();
    }

    public SymbolicTerm withCoefficient(Fraction newCoefficient) {
        return newCoefficient.isZero() ? ZERO : new SymbolicTerm(newCoefficient, factors);
    }

    public SymbolicTerm negate() {
        return withCoefficient(coefficient.negate());
    }

    public SymbolicTerm multiply(Fraction factor) {
        return withCoefficient(coefficient.multiply(factor));
    }

    public SymbolicTerm multiply(SymbolicTerm other) {
        if (isZero() || other.isZero()) {
            return ZERO;
        }
        Map<Irrational, Fraction> merged = new TreeMap<>(factors);
        other.factors.forEach((atom, exponent) -> merged.merge(atom, exponent, Fraction::add));
        return of(coefficient.multiply(other.coefficient), merged);
    }

    /**
     * @throws ArithmeticException if this term is zero
     */
    public SymbolicTerm inverse() {
        return pow(Fraction.MINUS_ONE);
    }

    /**
     * Raise to a rational power. Every factor exponent is scaled; the
     * coefficient goes through {@link Radicals#power(Fraction, Fraction)}.
     *
     * @throws ArithmeticException for zero to a non-positive power and even roots of negatives
     */
    public SymbolicTerm pow(Fraction exponent) {
        if (exponent.isZero()) {
            if (isZero()) {
                throw new ArithmeticException("Zero to the zeroth power");
            }
            return ONE;
        }
        SymbolicTerm base = Radicals.power(coefficient, exponent);
        Map<Irrational, Fraction> scaled = new TreeMap<>();
        factors.forEach((atom, e) -> scaled.put(atom, e.multiply(exponent)));
        return base.multiply(of(Fraction.ONE, scaled));
    }

    /**
     * Orders terms by factor signature; higher powers first, constants last.
     */
    @Override
    public int compareTo(SymbolicTerm other) {
        Iterator<Map.Entry<Irrational, Fraction>> a = factors.entrySet().iterator();
        Iterator<Map.Entry<Irrational, Fraction>> b = other.factors.entrySet().iterator();
        while (a.hasNext() && b.hasNext()) {
            Map.Entry<Irrational, Fraction> x = a.next();
            Map.Entry<Irrational, Fraction> y = b.next();
            int byAtom = x.getKey().compareTo(y.getKey());
            if (byAtom != 0) {
                return byAtom;
            }
            int byExponent = y.getValue().compareTo(x.getValue());
            if (byExponent != 0) {
                return byExponent;
            }
        }
        if (a.hasNext()) {
            return -1;
        }
        if (b.hasNext()) {
            return 1;
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymbolicTerm other)) {
            return false;
        }
        return coefficient.equals(other.coefficient) && factors.equals(other.factors);
    }

    @Override
    public int hashCode() {
        return 31 * coefficient.hashCode() + factors.hashCode();
    }

    @Override
    public String toString() {
        return ValueFormatter.format(this);
    }
}
