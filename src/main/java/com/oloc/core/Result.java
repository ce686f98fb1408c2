package com.oloc.core;

import com.oloc.exception.ConversionException;
import com.oloc.exception.ErrorKind;
import com.oloc.number.DecimalApproximator;
import com.oloc.number.Fraction;
import com.oloc.number.IrrationalParam;
import com.oloc.number.SymbolicValue;
import com.oloc.number.ValueFormatter;
import com.oloc.token.Span;

import java.util.List;
import java.util.Map;

/**
 * Final value of a calculation together with its step trace.
 *
 * @param expression    Input as given by the caller
 * @param value         Exact final value
 * @param steps         Reduction trace; the last entry is the formatted final value
 * @param params        Irrational parameters declared in the expression, by symbol
 * @param decimalPlaces Default places for {@link #toDecimalString()}
 */
public record Result(
        String expression,
        SymbolicValue value,
        List<String> steps,
        Map<String, IrrationalParam> params,
        int decimalPlaces
) {

    public Result {
        steps = List.copyOf(steps);
        params = Map.copyOf(params);
    }

    public String formatted() {
        return ValueFormatter.format(value);
    }

    public boolean isRational() {
        return value.isRational();
    }

    /**
     * @throws ConversionException if the value keeps irrational terms
     */
    public Fraction toFraction() {
        if (!isRational()) {
            throw new ConversionException(ErrorKind.NOT_RATIONAL, expression,
                    Span.of(0, expression.length()), formatted());
        }
        return value.asFraction();
    }

    public String toDecimalString() {
        return toDecimalString(decimalPlaces);
    }

    /**
     * Fixed-precision decimal form. Native irrationals honour their own declared
     * places; custom irrationals need a declared value. Retained calls such as
     * {@code sin(1)} are computed in {@code double} and carry at most 15
     * significant digits.
     *
     * @throws ConversionException if a custom irrational has no value
     */
    public String toDecimalString(int places) {
        if (places < 0) {
            throw new IllegalArgumentException("places must not be negative: " + places);
        }
        DecimalApproximator approximator = new DecimalApproximator(expression, params, places);
        return DecimalApproximator.toDecimalString(approximator.approximate(value), places);
    }

    @Override
    public String toString() {
        return expression + " = " + formatted();
    }
}
