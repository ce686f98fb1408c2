package com.oloc.function;

import com.oloc.number.Fraction;
import com.oloc.number.Irrational;

import java.util.Optional;

/**
 * What is known about an irrational factor from its declared parameter.
 */
@FunctionalInterface
public interface ParamResolver {

    ParamResolver NATIVE_ONLY = atom -> switch (atom.kind()) {
        case PI, E, RADICAL -> 1;
        default -> 0;
    };

    /**
     * Known sign: 1, -1, or 0 when unknown.
     */
    int signOf(Irrational atom);

    /**
     * Declared conversion value of a custom irrational.
     */
    default Optional<Fraction> valueOf(Irrational atom) {
        return Optional.empty();
    }
}
