package com.oloc.function;

import com.oloc.exception.ConversionException;
import com.oloc.exception.DivideByZeroException;
import com.oloc.exception.DomainException;
import com.oloc.exception.ErrorKind;
import com.oloc.number.Fraction;
import com.oloc.number.Irrational;
import com.oloc.number.IrrationalKind;
import com.oloc.number.SymbolicTerm;
import com.oloc.number.SymbolicValue;
import com.oloc.token.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Reductions.
 */
class ReductionsTest {

    private static final CallSite SITE = new CallSite("f(x)", Span.of(0, 4), ParamResolver.NATIVE_ONLY);
    private static final SymbolicValue PI = SymbolicValue.of(Irrational.PI);
    private static final SymbolicValue X = SymbolicValue.of(Irrational.custom("x"));

    private static SymbolicValue piTimes(long numerator, long denominator) {
        return SymbolicValue.of(SymbolicTerm.of(Fraction.of(numerator, denominator), Map.of(Irrational.PI, Fraction.ONE)));
    }

    private static String call(FunctionType function, SymbolicValue... args) {
        return Reductions.call(function, List.of(args), SITE).toString();
    }

    private static CallSite withSign(int sign) {
        return new CallSite("f(x)", Span.of(0, 4), atom -> sign);
    }

    private static CallSite withValue(Fraction value) {
        return new CallSite("f(x)", Span.of(0, 4), new ParamResolver() {
            @Override
            public int signOf(Irrational atom) {
                return value.signum();
            }

            @Override
            public Optional<Fraction> valueOf(Irrational atom) {
                return Optional.of(value);
            }
        });
    }

    private static SymbolicValue xSquared() {
        return X.multiply(X);
    }

    @Test
    @DisplayName("Division by zero points at the call site")
    void shouldRejectDivisionByZero() {
        DivideByZeroException error = assertThrows(DivideByZeroException.class,
                () -> Reductions.divide(SymbolicValue.ONE, SymbolicValue.ZERO, SITE));

        assertEquals(List.of(Span.of(0, 4)), error.getSpans());
        assertThrows(DivideByZeroException.class, () -> Reductions.modulo(SymbolicValue.ONE, SymbolicValue.ZERO, SITE));
        assertThrows(DivideByZeroException.class, () -> call(FunctionType.REC, SymbolicValue.ZERO));
    }

    @Test
    @DisplayName("Should raise to integer and rational powers")
    void shouldPower() {
        assertEquals("8", Reductions.power(SymbolicValue.of(2), SymbolicValue.of(3), SITE).toString());
        assertEquals("1/4", Reductions.power(SymbolicValue.of(2), SymbolicValue.of(-2), SITE).toString());
        assertEquals("2√2", Reductions.power(SymbolicValue.of(2), SymbolicValue.of(Fraction.of(3, 2)), SITE).toString());
        assertEquals("3", Reductions.sqrt(SymbolicValue.of(9), SITE).toString());
        assertEquals("1", Reductions.power(SymbolicValue.ONE, X, SITE).toString());
        assertEquals("pow(2,x)", Reductions.power(SymbolicValue.of(2), X, SITE).toString());
    }

    @Test
    @DisplayName("Zero powers and even roots of negatives are rejected")
    void shouldRejectInvalidPowers() {
        DomainException zeroToZero = assertThrows(DomainException.class,
                () -> Reductions.power(SymbolicValue.ZERO, SymbolicValue.ZERO, SITE));
        assertEquals(ErrorKind.FUNCTION_DOMAIN, zeroToZero.getKind());
        assertThrows(DivideByZeroException.class,
                () -> Reductions.power(SymbolicValue.ZERO, SymbolicValue.of(-1), SITE));
        assertThrows(DomainException.class, () -> Reductions.sqrt(SymbolicValue.of(-4), SITE));
        assertThrows(DomainException.class, () -> Reductions.sqrt(PI.negate(), SITE));
    }

    @Test
    @DisplayName("An even root of an even power keeps an unknown sign as abs")
    void shouldTakeAbsForUnknownSign() {
        assertEquals("abs(x)", Reductions.sqrt(xSquared(), SITE).toString());
        assertEquals("2abs(x)", Reductions.sqrt(xSquared().multiply(SymbolicValue.of(4)), SITE).toString());
        assertEquals("abs(x)^3", Reductions.power(xSquared(), SymbolicValue.of(Fraction.of(3, 2)), SITE).toString());
        assertEquals("x^2", Reductions.sqrt(xSquared().multiply(xSquared()), SITE).toString());
        assertEquals("x^(1/2)", Reductions.sqrt(X, SITE).toString());
    }

    @Test
    @DisplayName("An even root of an even power uses the declared sign")
    void shouldUseDeclaredSignForEvenRoots() {
        assertEquals("x", Reductions.sqrt(xSquared(), withSign(1)).toString());
        assertEquals("-x", Reductions.sqrt(xSquared(), withSign(-1)).toString());
        assertEquals("-x^3", Reductions.power(xSquared(), SymbolicValue.of(Fraction.of(3, 2)), withSign(-1)).toString());
        assertEquals("abs(x)^(1/2)",
                Reductions.power(xSquared(), SymbolicValue.of(Fraction.of(1, 4)), withSign(-1)).toString());
    }

    @Test
    @DisplayName("Integer functions substitute declared values")
    void shouldSubstituteDeclaredValues() {
        CallSite three = withValue(Fraction.of(3));

        assertEquals("6", Reductions.factorial(X, three).toString());
        assertEquals("720", Reductions.factorial(X.multiply(SymbolicValue.of(2)), three).toString());
        assertEquals("24", Reductions.factorial(X.add(SymbolicValue.ONE), three).toString());
        assertEquals("2", Reductions.call(FunctionType.GCD, List.of(X.add(SymbolicValue.ONE), SymbolicValue.of(6)),
                three).toString());
        assertEquals("12", Reductions.call(FunctionType.LCM, List.of(X.add(SymbolicValue.ONE), SymbolicValue.of(6)),
                three).toString());
        assertThrows(DomainException.class, () -> Reductions.factorial(X, withValue(Fraction.HALF)));
    }

    @Test
    @DisplayName("Integer functions need a declared value for custom irrationals")
    void shouldRequireDeclaredValues() {
        ConversionException error = assertThrows(ConversionException.class, () -> Reductions.factorial(X, SITE));

        assertEquals(ErrorKind.MISSING_CONVERSION_VALUE, error.getKind());
        assertEquals(List.of(Span.of(0, 4)), error.getSpans());
        assertThrows(ConversionException.class, () -> call(FunctionType.GCD, X, SymbolicValue.of(6)));
        assertThrows(DomainException.class, () -> Reductions.factorial(PI, SITE));
    }

    @ParameterizedTest
    @DisplayName("Modulo is floored on rationals")
    @CsvSource({
            "7, 3, 1",
            "-7, 3, 2",
            "7, -3, -2"
    })
    void shouldModulo(long a, long b, String expected) {
        assertEquals(expected, Reductions.modulo(SymbolicValue.of(a), SymbolicValue.of(b), SITE).toString());
    }

    @Test
    @DisplayName("Factorial accepts non-negative integers only")
    void shouldFactorial() {
        assertEquals("120", Reductions.factorial(SymbolicValue.of(5), SITE).toString());
        assertEquals("1", Reductions.factorial(SymbolicValue.ZERO, SITE).toString());
        assertThrows(DomainException.class, () -> Reductions.factorial(SymbolicValue.of(-1), SITE));
        assertThrows(DomainException.class, () -> Reductions.factorial(SymbolicValue.of(Fraction.HALF), SITE));
    }

    @Test
    @DisplayName("Degrees convert to multiples of π")
    void shouldConvertDegrees() {
        assertEquals("π/2", Reductions.degrees(SymbolicValue.of(90)).toString());
        assertEquals("π", Reductions.degrees(SymbolicValue.of(180)).toString());
    }

    @Test
    @DisplayName("Should apply the simple functions")
    void shouldApplySimpleFunctions() {
        assertEquals("9", call(FunctionType.SQ, SymbolicValue.of(3)));
        assertEquals("-8", call(FunctionType.CUB, SymbolicValue.of(-2)));
        assertEquals("1/3", call(FunctionType.REC, SymbolicValue.of(3)));
        assertEquals("𝑒^2", call(FunctionType.EXP, SymbolicValue.of(2)));
        assertEquals("4", call(FunctionType.GCD, SymbolicValue.of(12), SymbolicValue.of(8), SymbolicValue.of(20)));
        assertEquals("24", call(FunctionType.LCM, SymbolicValue.of(12), SymbolicValue.of(8)));
        assertThrows(DomainException.class, () -> call(FunctionType.GCD, SymbolicValue.of(Fraction.HALF), SymbolicValue.ONE));
    }

    @Test
    @DisplayName("abs and sign need a known sign")
    void shouldResolveSigns() {
        assertEquals("3", call(FunctionType.ABS, SymbolicValue.of(-3)));
        assertEquals("π", call(FunctionType.ABS, PI.negate()));
        assertEquals("-1", call(FunctionType.SIGN, PI.negate()));
        assertEquals("0", call(FunctionType.SIGN, SymbolicValue.ZERO));
        assertEquals("abs(x)", call(FunctionType.ABS, X));

        CallSite positiveX = new CallSite("f(x)", Span.of(0, 4), atom -> 1);
        assertEquals("x", Reductions.call(FunctionType.ABS, List.of(X.negate()), positiveX).toString());
    }

    @Test
    @DisplayName("Trigonometric identities hold at multiples of π")
    void shouldEvaluateTrigIdentities() {
        assertEquals("0", call(FunctionType.SIN, PI));
        assertEquals("0", call(FunctionType.SIN, SymbolicValue.ZERO));
        assertEquals("1/2", call(FunctionType.SIN, piTimes(1, 6)));
        assertEquals("√2/2", call(FunctionType.SIN, piTimes(1, 4)));
        assertEquals("-√3/2", call(FunctionType.SIN, piTimes(4, 3)));
        assertEquals("1/2", call(FunctionType.COS, piTimes(1, 3)));
        assertEquals("-1", call(FunctionType.COS, PI));
        assertEquals("1", call(FunctionType.TAN, piTimes(1, 4)));
        assertEquals("√3", call(FunctionType.TAN, piTimes(1, 3)));
        assertEquals("sin(1)", call(FunctionType.SIN, SymbolicValue.ONE));
    }

    @Test
    @DisplayName("tan is undefined at its poles")
    void shouldRejectTangentPoles() {
        assertThrows(DomainException.class, () -> call(FunctionType.TAN, piTimes(1, 2)));
    }

    @Test
    @DisplayName("Inverse functions read the same table")
    void shouldEvaluateInverseTrig() {
        assertEquals("π/6", call(FunctionType.ASIN, SymbolicValue.of(Fraction.HALF)));
        assertEquals("π/3", call(FunctionType.ACOS, SymbolicValue.of(Fraction.HALF)));
        assertEquals("π/4", call(FunctionType.ATAN, SymbolicValue.ONE));
        assertEquals("-π/2", call(FunctionType.ASIN, SymbolicValue.of(-1)));
        assertThrows(DomainException.class, () -> call(FunctionType.ASIN, SymbolicValue.of(2)));
        assertThrows(DomainException.class, () -> call(FunctionType.ACOS, SymbolicValue.of(-2)));
    }

    @Test
    @DisplayName("Logarithms are exact for powers of the base")
    void shouldEvaluateLogarithms() {
        assertEquals("3", call(FunctionType.LOG, SymbolicValue.of(8), SymbolicValue.of(2)));
        assertEquals("1/3", call(FunctionType.LOG, SymbolicValue.of(2), SymbolicValue.of(8)));
        assertEquals("3", call(FunctionType.LG, SymbolicValue.of(1000)));
        assertEquals("2", call(FunctionType.LN, Reductions.call(FunctionType.EXP, List.of(SymbolicValue.of(2)), SITE)));
        assertEquals("0", call(FunctionType.LN, SymbolicValue.ONE));
        assertEquals("ln(2)", call(FunctionType.LN, SymbolicValue.of(2)));

        SymbolicValue retained = Reductions.call(FunctionType.LN, List.of(SymbolicValue.of(2)), SITE);
        assertEquals(IrrationalKind.RETAINED, retained.singleTerm().factors().firstKey().kind());
    }

    @Test
    @DisplayName("Logarithms reject non-positive arguments and bases")
    void shouldRejectInvalidLogarithms() {
        assertThrows(DomainException.class, () -> call(FunctionType.LN, SymbolicValue.ZERO));
        assertThrows(DomainException.class, () -> call(FunctionType.LG, SymbolicValue.of(-10)));
        assertThrows(DomainException.class, () -> call(FunctionType.LOG, SymbolicValue.of(2), SymbolicValue.ONE));
        assertThrows(DomainException.class, () -> call(FunctionType.LOG, SymbolicValue.of(2), SymbolicValue.of(-2)));
    }
}
