package com.oloc.lexer;

import com.oloc.number.Fraction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RepeatingDecimal.
 */
class RepeatingDecimalTest {

    @ParameterizedTest
    @DisplayName("Should detect the shortest trailing period")
    @CsvSource({
            "3, 1",
            "33, 1",
            "2323, 2",
            "12323, 2",
            "123123, 3",
            "1234, 1"
    })
    void shouldDetectPeriod(String fraction, int period) {
        assertEquals(period, RepeatingDecimal.period(fraction));
    }

    @ParameterizedTest
    @DisplayName("Should convert repeating decimals to exact fractions")
    @CsvSource({
            "2.3..., 7/3",
            "0.3333..., 1/3",
            "1.2323..., 122/99",
            "0.1666..., 1/6",
            "1.2:3, 37/30",
            "10.1:2, 911/90",
            "0.0:9, 1/10"
    })
    void shouldParse(String literal, String expected) {
        assertEquals(Fraction.parse(expected), RepeatingDecimal.parse(literal));
    }
}
