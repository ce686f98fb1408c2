package com.oloc.preprocess;

import com.oloc.config.OlocConfig;
import com.oloc.exception.CommentException;
import com.oloc.exception.ErrorKind;
import com.oloc.exception.PlacementException;
import com.oloc.exception.SeparatorException;
import com.oloc.token.Span;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Preprocessor.
 */
class PreprocessorTest {

    private static Preprocessor preprocessor;

    @BeforeAll
    static void setUp() {
        preprocessor = new Preprocessor(OlocConfig.defaults());
    }

    private static String normalize(String expression) {
        return preprocessor.process(expression).text();
    }

    @ParameterizedTest
    @DisplayName("Should normalize raw input")
    @CsvSource(delimiter = '|', value = {
            " 1 + 1 = | 1+1",
            "1+1#note# | 1+1",
            "2+3@trailing note | 2+3",
            "x² | x^2",
            "10³⁴ | 10^34",
            "2 × 3 ÷ 4 | 2*3/4",
            "2pi | 2π",
            "e | 𝑒",
            "exp(1) | exp(1)",
            "power(2,3) | pow(2,3)",
            "square(3) | sq(3)",
            "1--2 | 1+2",
            "1---2 | 1-2",
            "+-1 | -1",
            "(+1) | (1)",
            "1,000,000+1 | 1000000+1",
            "pow(1,000;2) | pow(1000,2)",
            "<pi> | <pi>"
    })
    void shouldNormalize(String input, String expected) {
        assertEquals(expected, normalize(input));
    }

    @Test
    @DisplayName("Normalized positions map back to the original input")
    void shouldKeepOrigins() {
        NormalizedExpression normalized = preprocessor.process(" 5 / 0");

        assertEquals("5/0", normalized.text());
        assertEquals(Span.of(1, 6), normalized.originOf(Span.of(0, 3)));
        assertEquals(" 5 / 0", normalized.original());
    }

    @Test
    @DisplayName("An unmatched '#' is reported where it stands")
    void shouldRejectUnmatchedHash() {
        CommentException error = assertThrows(CommentException.class, () -> normalize("1+#x"));

        assertEquals(ErrorKind.MISMATCHED_HASH, error.getKind());
        assertEquals(List.of(Span.of(2, 3)), error.getSpans());
    }

    @Test
    @DisplayName("'=' is only allowed once at the end")
    void shouldRejectMisplacedEquals() {
        PlacementException error = assertThrows(PlacementException.class, () -> normalize("1=2"));

        assertEquals(ErrorKind.MISPLACED_EQUAL_SIGN, error.getKind());
        assertEquals(List.of(Span.of(1, 2)), error.getSpans());
        assertThrows(PlacementException.class, () -> normalize("1+1=="));
    }

    @ParameterizedTest
    @DisplayName("Should reject commas that neither group digits nor separate arguments")
    @CsvSource(delimiter = '|', value = {"1,00", "2,3", "1.000,5", ",1"})
    void shouldRejectInvalidSeparators(String input) {
        SeparatorException error = assertThrows(SeparatorException.class, () -> normalize(input));

        assertEquals(ErrorKind.INVALID_DIGIT_SEPARATOR, error.getKind());
    }

    @Test
    @DisplayName("Digit groups need three digits after each comma")
    void shouldCheckDigitGroups() {
        assertTrue(Preprocessor.isDigitGroupSeparator("1,000", 1));
        assertTrue(Preprocessor.isDigitGroupSeparator("12,345,678", 6));
        assertFalse(Preprocessor.isDigitGroupSeparator("1234,567", 4));
        assertFalse(Preprocessor.isDigitGroupSeparator("1,0000", 1));
    }
}
