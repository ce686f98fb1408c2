package com.oloc.number;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SymbolicValue arithmetic and its printed form.
 */
class SymbolicValueTest {

    private static final SymbolicValue X = SymbolicValue.of(Irrational.custom("x"));
    private static final SymbolicValue Y = SymbolicValue.of(Irrational.custom("y"));
    private static final SymbolicValue PI = SymbolicValue.of(Irrational.PI);

    private static SymbolicValue of(long numerator, long denominator) {
        return SymbolicValue.of(Fraction.of(numerator, denominator));
    }

    @Test
    @DisplayName("Should merge like terms and drop zero terms")
    void shouldMergeLikeTerms() {
        assertEquals("2x", X.add(X).toString());
        assertEquals("0", X.subtract(X).toString());
        assertTrue(X.subtract(X).isZero());
        assertTrue(X.subtract(X).isRational());
    }

    @Test
    @DisplayName("Should cancel factors present in numerator and denominator")
    void shouldCancelFactors() {
        SymbolicValue numerator = SymbolicValue.of(3).multiply(X);
        SymbolicValue denominator = SymbolicValue.of(6).multiply(X).multiply(Y);

        SymbolicValue quotient = numerator.divide(denominator);

        assertEquals("1/2y", quotient.toString());
        assertEquals(Fraction.HALF, quotient.singleTerm().coefficient());
    }

    @Test
    @DisplayName("Rational values stay plain fractions")
    void shouldKeepRationals() {
        SymbolicValue sum = of(-1, 2).add(of(1, 3));

        assertTrue(sum.isRational());
        assertEquals(Fraction.of(-1, 6), sum.asFraction());
        assertEquals("-1/6", sum.toString());
    }

    @Test
    @DisplayName("Irrational terms come first, constants last")
    void shouldOrderTerms() {
        assertEquals("π+x", X.add(PI).toString());
        assertEquals("2π+3", SymbolicValue.of(3).add(PI.multiply(SymbolicValue.of(2))).toString());
        assertEquals("π-3", PI.subtract(SymbolicValue.of(3)).toString());
        assertEquals("-x", X.negate().toString());
    }

    @Test
    @DisplayName("Should extract perfect powers from roots")
    void shouldSimplifyRadicals() {
        assertEquals("2√2", SymbolicValue.of(8).pow(Fraction.HALF).toString());
        assertEquals("√6", SymbolicValue.of(2).pow(Fraction.HALF)
                .multiply(SymbolicValue.of(3).pow(Fraction.HALF)).toString());
        assertEquals("6", SymbolicValue.of(12).pow(Fraction.HALF)
                .multiply(SymbolicValue.of(3).pow(Fraction.HALF)).toString());
        assertEquals("2^(1/3)", SymbolicValue.of(2).pow(Fraction.of(1, 3)).toString());
        assertEquals("√2/2", SymbolicValue.ONE.divide(SymbolicValue.of(2).pow(Fraction.HALF)).toString());
        assertEquals("-2", SymbolicValue.of(-8).pow(Fraction.of(1, 3)).toString());
    }

    @Test
    @DisplayName("Roots of powers scale factor exponents")
    void shouldScaleFactorExponents() {
        SymbolicValue ninePiSquared = PI.multiply(PI).multiply(SymbolicValue.of(9));

        assertEquals("3π", ninePiSquared.pow(Fraction.HALF).toString());
        assertEquals("π^(1/2)", PI.pow(Fraction.HALF).toString());
        assertEquals("x^2", X.pow(Fraction.of(4)).pow(Fraction.HALF).toString());
    }

    @Test
    @DisplayName("Even roots of negative numbers are rejected")
    void shouldRejectEvenRootOfNegative() {
        assertThrows(ArithmeticException.class, () -> SymbolicValue.of(-4).pow(Fraction.HALF));
        assertThrows(ArithmeticException.class, () -> SymbolicValue.ZERO.pow(Fraction.MINUS_ONE));
    }

    @Test
    @DisplayName("Should expand whole powers of sums")
    void shouldExpandPowersOfSums() {
        SymbolicValue sum = X.add(SymbolicValue.ONE);

        assertEquals("x+1", sum.toString());
        assertEquals("x^2+2x+1", sum.pow(Fraction.of(2)).toString());
    }

    @Test
    @DisplayName("Dividing by a sum keeps it as a group factor that cancels again")
    void shouldKeepGroups() {
        SymbolicValue sum = X.add(SymbolicValue.ONE);

        SymbolicValue inverse = SymbolicValue.ONE.divide(sum);

        assertEquals("1/(x+1)", inverse.toString());
        assertEquals(SymbolicValue.ONE, inverse.multiply(sum));
        assertEquals(SymbolicValue.of(2), sum.multiply(SymbolicValue.of(2)).divide(sum));
    }

    @Test
    @DisplayName("Division by zero is an arithmetic error")
    void shouldRejectDivisionByZero() {
        assertThrows(ArithmeticException.class, () -> X.divide(SymbolicValue.ZERO));
    }

    @Test
    @DisplayName("Printed shape decides where brackets are needed")
    void shouldReportShape() {
        assertEquals(ValueFormatter.Shape.SUM, ValueFormatter.shape(X.add(SymbolicValue.ONE)));
        assertEquals(ValueFormatter.Shape.SIGNED, ValueFormatter.shape(X.negate()));
        assertEquals(ValueFormatter.Shape.QUOTIENT, ValueFormatter.shape(of(1, 2)));
        assertEquals(ValueFormatter.Shape.PRODUCT, ValueFormatter.shape(X.multiply(SymbolicValue.of(3))));
        assertEquals(ValueFormatter.Shape.POWER, ValueFormatter.shape(SymbolicValue.of(2).pow(Fraction.HALF)));
        assertEquals(ValueFormatter.Shape.ATOM, ValueFormatter.shape(PI));
    }

    @Test
    @DisplayName("Juxtaposition never merges numbers or spells a function name")
    void shouldSeparateAmbiguousProducts() {
        assertEquals("2·3", "2" + ValueFormatter.juxtapose("2", "3"));
        assertEquals("a·sin(1)", "a" + ValueFormatter.juxtapose("a", "sin(1)"));
        assertEquals("3x", "3" + ValueFormatter.juxtapose("3", "x"));
    }
}
