package com.oloc.function;

import com.oloc.number.Fraction;
import com.oloc.number.Irrational;
import com.oloc.number.SymbolicTerm;
import com.oloc.number.SymbolicValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Exact values of the trigonometric functions at rational multiples of π with
 * denominators 1, 2, 3, 4 and 6, and the inverse lookups on the same table.
 */
final class TrigIdentities {

    private static final Fraction SIXTH = Fraction.of(1, 6);
    private static final Fraction QUARTER = Fraction.of(1, 4);
    private static final Fraction THIRD = Fraction.of(1, 3);
    private static final Fraction TWO = Fraction.of(2);

    /** sin(kπ) → k for k in [-1/2, 1/2]. */
    private static final Map<SymbolicValue, Fraction> ARCSIN = new LinkedHashMap<>();
    /** tan(kπ) → k for k in (-1/2, 1/2). */
    private static final Map<SymbolicValue, Fraction> ARCTAN = new LinkedHashMap<>();

    static {
        Fraction[] angles = {Fraction.ZERO, SIXTH, QUARTER, THIRD, Fraction.HALF};
        for (Fraction k : angles) {
            for (Fraction signed : new Fraction[]{k, k.negate()}) {
                SymbolicValue sine = sinOfPiMultiple(signed).orElseThrow();
                ARCSIN.putIfAbsent(sine, signed);
                if (!k.equals(Fraction.HALF)) {
                    SymbolicValue cosine = sinOfPiMultiple(signed.add(Fraction.HALF)).orElseThrow();
                    ARCTAN.putIfAbsent(sine.divide(cosine), signed);
                }
            }
        }
    }

    private TrigIdentities() {
    }

    /**
     * Multiplier k when the value is exactly kπ (k may be zero).
     */
    static Optional<Fraction> piMultiple(SymbolicValue value) {
        if (value.isZero()) {
            return Optional.of(Fraction.ZERO);
        }
        if (!value.isSingleTerm()) {
            return Optional.empty();
        }
        SymbolicTerm term = value.singleTerm();
        if (term.factors().equals(Map.of(Irrational.PI, Fraction.ONE))) {
            return Optional.of(term.coefficient());
        }
        return Optional.empty();
    }

    static Optional<SymbolicValue> sinOfPiMultiple(Fraction k) {
        Fraction reduced = k.mod(TWO);
        boolean negative = false;
        if (reduced.compareTo(Fraction.ONE) >= 0) {
            reduced = reduced.subtract(Fraction.ONE);
            negative = true;
        }
        if (reduced.compareTo(Fraction.HALF) > 0) {
            reduced = Fraction.ONE.subtract(reduced);
        }
        SymbolicValue value;
        if (reduced.isZero()) {
            value = SymbolicValue.ZERO;
        } else if (reduced.equals(SIXTH)) {
            value = SymbolicValue.of(Fraction.HALF);
        } else if (reduced.equals(QUARTER)) {
            value = SymbolicValue.of(2).pow(Fraction.HALF).multiply(SymbolicValue.of(Fraction.HALF));
        } else if (reduced.equals(THIRD)) {
            value = SymbolicValue.of(3).pow(Fraction.HALF).multiply(SymbolicValue.of(Fraction.HALF));
        } else if (reduced.equals(Fraction.HALF)) {
            value = SymbolicValue.ONE;
        } else {
            return Optional.empty();
        }
        return Optional.of(negative ? value.negate() : value);
    }

    static Optional<SymbolicValue> cosOfPiMultiple(Fraction k) {
        return sinOfPiMultiple(k.add(Fraction.HALF));
    }

    /**
     * Multiplier k in [-1/2, 1/2] with sin(kπ) equal to the value.
     */
    static Optional<Fraction> arcsinMultiple(SymbolicValue value) {
        return Optional.ofNullable(ARCSIN.get(value));
    }

    /**
     * Multiplier k in (-1/2, 1/2) with tan(kπ) equal to the value.
     */
    static Optional<Fraction> arctanMultiple(SymbolicValue value) {
        return Optional.ofNullable(ARCTAN.get(value));
    }
}
