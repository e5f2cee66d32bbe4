package org.symbex.utils;

import org.junit.jupiter.api.*;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class RationalTest {

    @Nested
    @DisplayName("构造与规范化测试 (Construction)")
    class ConstructionTests {

        @Test
        @DisplayName("分数应约分且分母为正")
        void testValueOf_WhenNotReduced_ShouldNormalize() {
            Rational r = Rational.valueOf(6, -4);
            assertAll("规范化",
                    () -> assertEquals(BigInteger.valueOf(-3), r.getNumerator(), "分子"),
                    () -> assertEquals(BigInteger.valueOf(2), r.getDenominator(), "分母为正"),
                    () -> assertSame(Rational.ONE, Rational.valueOf(7, 7), "等值的 1 应复用常量"),
                    () -> assertThrows(ArithmeticException.class, () -> Rational.valueOf(1, 0), "分母不能为 0"));
        }

        @Test
        @DisplayName("解析小数、科学计数法和分数字符串")
        void testValueOfString_WhenValid_ShouldParseExactly() {
            assertAll("解析",
                    () -> assertEquals(Rational.valueOf(5, 2), Rational.valueOf("2.5")),
                    () -> assertEquals(Rational.valueOf(-1, 8), Rational.valueOf("-0.125")),
                    () -> assertEquals(Rational.valueOf(1000), Rational.valueOf("1e3")),
                    () -> assertEquals(Rational.valueOf(1, 3), Rational.valueOf(" 1/3 ")),
                    () -> assertThrows(NumberFormatException.class, () -> Rational.valueOf("abc")),
                    () -> assertThrows(NumberFormatException.class, () -> Rational.valueOf("1/")));
        }
    }

    @Nested
    @DisplayName("运算与输出测试 (Arithmetic and Output)")
    class ArithmeticTests {

        @Test
        @DisplayName("四则运算结果精确")
        void testArithmetic_WhenCombined_ShouldBeExact() {
            Rational third = Rational.valueOf(1, 3);
            Rational sixth = Rational.valueOf(1, 6);
            assertAll("运算",
                    () -> assertEquals(Rational.valueOf(1, 2), third.add(sixth)),
                    () -> assertEquals(Rational.valueOf(1, 6), third.subtract(sixth)),
                    () -> assertEquals(Rational.valueOf(1, 18), third.multiply(sixth)),
                    () -> assertEquals(Rational.valueOf(2), third.divide(sixth)),
                    () -> assertThrows(ArithmeticException.class, () -> third.divide(Rational.ZERO)));
        }

        @Test
        @DisplayName("向下取整与截断对负数结果不同")
        void testRounding_WhenNegative_ShouldDifferBetweenFloorAndTruncate() {
            Rational r = Rational.valueOf(-7, 2);
            assertAll("取整",
                    () -> assertEquals(BigInteger.valueOf(-4), r.floor(), "floor(-3.5) = -4"),
                    () -> assertEquals(BigInteger.valueOf(-3), r.truncate(), "trunc(-3.5) = -3"),
                    () -> assertEquals(-1, r.signum()));
        }

        @Test
        @DisplayName("有限小数精确输出，无限小数带 ? 标记")
        void testToDecimalString_WhenTerminatingOrNot_ShouldFormat() {
            assertAll("十进制输出",
                    () -> assertEquals("2.5", Rational.valueOf(5, 2).toDecimalString()),
                    () -> assertEquals("3", Rational.valueOf(3).toDecimalString()),
                    () -> assertEquals("0.33333333333333333333?", Rational.valueOf(1, 3).toDecimalString()),
                    () -> assertTrue(Rational.valueOf(1, 3).compareTo(Rational.valueOf(1, 2)) < 0));
        }
    }
}
