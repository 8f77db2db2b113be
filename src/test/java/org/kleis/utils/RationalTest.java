package org.kleis.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class RationalTest {

    @Test
    @DisplayName("约分并保持分母为正")
    void testNormalization() {
        assertAll(
                () -> assertEquals(Rational.valueOf(1, 2), Rational.valueOf(2, 4)),
                () -> assertEquals(Rational.valueOf(-1, 2), Rational.valueOf(1, -2)),
                () -> assertEquals(BigInteger.TWO, Rational.valueOf(-3, -6).getDenominator()),
                () -> assertSame(Rational.ZERO, Rational.valueOf(0, 7)),
                () -> assertSame(Rational.ONE, Rational.valueOf(5, 5))
        );
    }

    @Test
    @DisplayName("分母为0")
    void testZeroDenominator() {
        assertThrows(ArithmeticException.class, () -> Rational.valueOf(1, 0));
        assertThrows(NumberFormatException.class, () -> Rational.valueOf("1/0"));
    }

    @Test
    @DisplayName("解析整数、小数与分数")
    void testParse() {
        assertAll(
                () -> assertEquals(Rational.valueOf(42), Rational.valueOf("42")),
                () -> assertEquals(Rational.valueOf(1, 4), Rational.valueOf("0.25")),
                () -> assertEquals(Rational.valueOf(-3, 2), Rational.valueOf("-1.5")),
                () -> assertEquals(Rational.valueOf(2, 3), Rational.valueOf(" 4/6 ")),
                () -> assertTrue(Rational.valueOf("1.0").isInteger()),
                () -> assertEquals("1/3", Rational.valueOf("1/3").toString()),
                () -> assertEquals("7", Rational.valueOf("7").toString())
        );
    }

    @Test
    @DisplayName("非法字面量")
    void testInvalidLiterals() {
        for (String s : new String[]{"", "abc", "1/", "/2", "1/x", "12abc", "\"1\""}) {
            assertFalse(Rational.isNumeric(s), s);
            assertThrows(NumberFormatException.class, () -> Rational.valueOf(s), s);
        }
        assertFalse(Rational.isNumeric(null));
    }

    @Test
    @DisplayName("比较与取负")
    void testCompareAndNegate() {
        assertTrue(Rational.valueOf(1, 3).compareTo(Rational.valueOf(1, 2)) < 0);
        assertEquals(0, Rational.valueOf(2, 4).compareTo(Rational.valueOf(1, 2)));
        assertEquals(Rational.valueOf(-1, 3), Rational.valueOf(1, 3).negate());
        assertEquals(Rational.valueOf(2, 4).hashCode(), Rational.valueOf(1, 2).hashCode());
    }
}
