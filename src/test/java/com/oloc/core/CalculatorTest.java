package com.oloc.core;

import com.oloc.config.OlocConfig;
import com.oloc.exception.BracketException;
import com.oloc.exception.ConversionException;
import com.oloc.exception.DivideByZeroException;
import com.oloc.exception.ErrorKind;
import com.oloc.exception.IrrationalFormatException;
import com.oloc.number.Fraction;
import com.oloc.token.Span;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Calculator, end to end from raw input to the final value.
 */
class CalculatorTest {

    private static Calculator calculator;

    @BeforeAll
    static void setUp() {
        calculator = new Calculator(OlocConfig.defaults());
    }

    @ParameterizedTest
    @DisplayName("Should calculate exact results")
    @CsvSource(delimiter = '|', value = {
            "1+1                | 2",
            "-1/2+1/3           | -1/6",
            "3x/6xy             | 1/2y",
            "2 pi + pi          | 3π",
            "1,000 + 1          | 1001",
            "0.5 + 1/3          | 5/6",
            "2.3... - 1/3       | 2",
            "√8                 | 2√2",
            "sqrt(2) * sqrt(2)  | 2",
            "3!                 | 6",
            "180°               | π",
            "7 % 3              | 1",
            "50% + 1            | 3/2",
            "2^10               | 1024",
            "1+1=               | 2",
            "(x+1)/(x+1)        | 1",
            "sin(pi/6)          | 1/2",
            "log(8, 2)          | 3",
            "ln(1)              | 0",
            "{[1+2]*3}          | 9"
    })
    void shouldCalculate(String expression, String expected) {
        assertEquals(expected, calculator.calculate(expression).formatted());
    }

    @Test
    @DisplayName("Should trace every visible reduction")
    void shouldTraceSteps() {
        Result result = calculator.calculate("-1/2+1/3");

        assertEquals(List.of("-1/2+1/3", "-1/6"), result.steps());
        assertEquals("-1/2+1/3 = -1/6", result.toString());
    }

    @Test
    @DisplayName("Same input gives the same result")
    void shouldBeDeterministic() {
        Result first = calculator.calculate("3x/6xy + sin(1)");
        Result second = calculator.calculate("3x/6xy + sin(1)");

        assertEquals(first.value(), second.value());
        assertEquals(first.steps(), second.steps());
    }

    @Test
    @DisplayName("Division by zero points at the fraction")
    void shouldReportDivisionByZero() {
        DivideByZeroException error = assertThrows(DivideByZeroException.class,
                () -> calculator.calculate("5/0"));

        assertEquals(ErrorKind.DIVIDE_BY_ZERO, error.getKind());
        assertEquals(List.of(Span.of(0, 3)), error.getSpans());
    }

    @Test
    @DisplayName("Should render a caret diagnostic under the original input")
    void shouldRenderDiagnostic() {
        DivideByZeroException error = assertThrows(DivideByZeroException.class,
                () -> calculator.calculate("1 + 5/0"));

        String[] lines = error.render().split("\n");
        assertEquals(4, lines.length);
        assertTrue(lines[0].startsWith("DivideByZeroException: "));
        assertEquals("1 + 5/0", lines[1]);
        assertEquals("    ^^^", lines[2]);
        assertEquals("Hint: " + ErrorKind.DIVIDE_BY_ZERO.hint(), lines[3]);
    }

    @Test
    @DisplayName("Division by an expression that is zero is also rejected")
    void shouldReportComputedDivisionByZero() {
        assertThrows(DivideByZeroException.class, () -> calculator.calculate("1/(2-2)"));
    }

    @Test
    @DisplayName("Brackets must nest in hierarchy order")
    void shouldRejectBracketHierarchy() {
        BracketException error = assertThrows(BracketException.class,
                () -> calculator.calculate("3+(3/4+[5/6])"));

        assertEquals(ErrorKind.BRACKET_HIERARCHY, error.getKind());
        assertFalse(error.getSpans().isEmpty());
    }

    @Test
    @DisplayName("Should convert rational results to fractions")
    void shouldConvertToFraction() {
        assertEquals(Fraction.of(5, 6), calculator.calculate("1/2+1/3").toFraction());

        Result irrational = calculator.calculate("π+1");
        assertFalse(irrational.isRational());
        ConversionException error = assertThrows(ConversionException.class, irrational::toFraction);
        assertEquals(ErrorKind.NOT_RATIONAL, error.getKind());
        assertEquals(List.of(Span.of(0, 3)), error.getSpans());
    }

    @Test
    @DisplayName("Should convert to decimals with configured and explicit places")
    void shouldConvertToDecimal() {
        assertEquals("0.3333333", calculator.calculate("1/3").toDecimalString());
        assertEquals("1.414", calculator.calculate("√2").toDecimalString(3));
        assertEquals("0.33", calculator.calculate("1/3",
                CalculationOptions.from(calculator.getConfig()).withDecimalPlaces(2)).toDecimalString());
        assertEquals("5.00", calculator.calculate("2x2.5?").toDecimalString(2));
        assertThrows(IllegalArgumentException.class, () -> calculator.calculate("1").toDecimalString(-1));
    }

    @Test
    @DisplayName("Custom irrationals without a value cannot become decimals")
    void shouldRequireValuesForDecimals() {
        ConversionException error = assertThrows(ConversionException.class,
                () -> calculator.calculate("x+1").toDecimalString());

        assertEquals(ErrorKind.MISSING_CONVERSION_VALUE, error.getKind());
    }

    @ParameterizedTest
    @DisplayName("Even roots of even powers follow the declared sign")
    @CsvSource(delimiter = '|', value = {
            "√(x^2)          | abs(x)",
            "√(x2?^2)        | x",
            "√(x-3?^2)       | -x",
            "(x-3?^2)^(1/2)  | -x",
            "√(4x^2)         | 2abs(x)"
    })
    void shouldTakeEvenRootsBySign(String expression, String expected) {
        assertEquals(expected, calculator.calculate(expression).formatted());
    }

    @Test
    @DisplayName("A negative declared value survives an even root")
    void shouldKeepNegativeValueThroughRoot() {
        assertEquals("3", calculator.calculate("√(x-3?^2)").toDecimalString(0));
    }

    @ParameterizedTest
    @DisplayName("Integer functions use declared values of custom irrationals")
    @CsvSource(delimiter = '|', value = {
            "fact(x3?)     | 6",
            "gcd(x4?, 6)   | 2",
            "lcm(x4?, 6)   | 12"
    })
    void shouldUseDeclaredValues(String expression, String expected) {
        assertEquals(expected, calculator.calculate(expression).formatted());
    }

    @Test
    @DisplayName("Integer functions reject custom irrationals without a value")
    void shouldRejectUndeclaredValues() {
        ConversionException error = assertThrows(ConversionException.class,
                () -> calculator.calculate("fact(x)"));

        assertEquals(ErrorKind.MISSING_CONVERSION_VALUE, error.getKind());
        assertEquals(List.of(Span.of(0, 7)), error.getSpans());
    }

    @Test
    @DisplayName("π and 𝑒 reject place counts beyond the limit")
    void shouldRejectTooManyPlaces() {
        IrrationalFormatException error = assertThrows(IrrationalFormatException.class,
                () -> calculator.calculate("π99999999999?"));

        assertEquals(ErrorKind.PLACES_OUT_OF_RANGE, error.getKind());
        assertEquals(List.of(Span.of(0, 13)), error.getSpans());
    }

    @Test
    @DisplayName("Should expose declared irrational parameters")
    void shouldExposeParams() {
        Result result = calculator.calculate("<radius>2.5? * 2");

        assertEquals("2<radius>", result.formatted());
        assertTrue(result.params().containsKey("<radius>"));
        assertEquals("5.0", result.toDecimalString(1));
    }

    @ParameterizedTest
    @DisplayName("Should recognize reserved words")
    @CsvSource({
            "sin, true",
            "log, true",
            "π, true",
            "+, true",
            "__reserved1, true",
            "x, false",
            "<radius>, false",
            "'', false"
    })
    void shouldRecognizeReservedWords(String symbol, boolean reserved) {
        assertEquals(reserved, calculator.isReserved(symbol));
    }

    @Test
    @DisplayName("Null is not a reserved word")
    void shouldTreatNullAsUnreserved() {
        assertFalse(calculator.isReserved(null));
    }
}
