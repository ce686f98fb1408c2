package com.oloc.number;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Fraction.
 */
class FractionTest {

    @ParameterizedTest
    @DisplayName("Should keep fractions in lowest terms with a positive denominator")
    @CsvSource({
            "2, 4, 1/2",
            "-3, 9, -1/3",
            "3, -9, -1/3",
            "-4, -8, 1/2",
            "0, 5, 0",
            "10, 5, 2"
    })
    void shouldNormalize(long numerator, long denominator, String expected) {
        Fraction fraction = Fraction.of(numerator, denominator);

        assertEquals(expected, fraction.toString());
        assertEquals(1, fraction.denominator().signum());
        assertEquals(BigInteger.ONE, fraction.numerator().gcd(fraction.denominator()));
    }

    @Test
    @DisplayName("Zero is always 0/1")
    void zeroIsCanonical() {
        assertEquals(Fraction.ZERO, Fraction.of(0, -7));
        assertEquals(BigInteger.ONE, Fraction.of(0, 12).denominator());
    }

    @Test
    @DisplayName("Should reject a zero denominator")
    void shouldRejectZeroDenominator() {
        assertThrows(ArithmeticException.class, () -> Fraction.of(1, 0));
        assertThrows(ArithmeticException.class, () -> Fraction.ONE.divide(Fraction.ZERO));
    }

    @Test
    @DisplayName("Should do exact arithmetic")
    void shouldDoArithmetic() {
        Fraction half = Fraction.of(1, 2);
        Fraction third = Fraction.of(1, 3);

        assertEquals(Fraction.of(5, 6), half.add(third));
        assertEquals(Fraction.of(1, 6), half.subtract(third));
        assertEquals(Fraction.of(1, 6), half.multiply(third));
        assertEquals(Fraction.of(3, 2), half.divide(third));
        assertEquals(Fraction.of(-1, 6), half.negate().add(third));
        assertEquals(Fraction.of(3), third.reciprocal());
    }

    @Test
    @DisplayName("Negative integer powers invert")
    void shouldRaiseToIntegerPowers() {
        assertEquals(Fraction.of(8, 27), Fraction.of(2, 3).pow(3));
        assertEquals(Fraction.of(9, 4), Fraction.of(2, 3).pow(-2));
        assertEquals(Fraction.ONE, Fraction.of(7, 5).pow(0));
        assertThrows(ArithmeticException.class, () -> Fraction.ZERO.pow(-1));
    }

    @ParameterizedTest
    @DisplayName("Floor and floored modulo follow the divisor's sign")
    @CsvSource({
            "7/2, 3",
            "-7/2, -4",
            "-3, -3",
            "1/3, 0"
    })
    void shouldFloor(String value, long expected) {
        assertEquals(BigInteger.valueOf(expected), Fraction.parse(value).floor());
    }

    @ParameterizedTest
    @DisplayName("Modulo takes the sign of the divisor")
    @CsvSource({
            "7, 3, 1",
            "-7, 3, 2",
            "7, -3, -2",
            "7/2, 1, 1/2"
    })
    void shouldModulo(String a, String b, String expected) {
        assertEquals(Fraction.parse(expected), Fraction.parse(a).mod(Fraction.parse(b)));
    }

    @Test
    @DisplayName("Should convert decimals exactly")
    void shouldConvertDecimals() {
        assertEquals(Fraction.of(1, 8), Fraction.of(new BigDecimal("0.125")));
        assertEquals(Fraction.of(12), Fraction.of(new BigDecimal("12")));
        assertEquals("0.3333", Fraction.of(1, 3).toBigDecimal(4).toPlainString());
    }

    @Test
    @DisplayName("Should compare by value")
    void shouldCompare() {
        assertTrue(Fraction.of(1, 3).compareTo(Fraction.of(1, 2)) < 0);
        assertTrue(Fraction.of(-1, 2).compareTo(Fraction.of(-2, 3)) > 0);
        assertEquals(0, Fraction.of(2, 4).compareTo(Fraction.HALF));
    }
}
