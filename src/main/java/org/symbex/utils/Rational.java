package org.symbex.utils;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 精确有理数，用于源程序中的小数常量以及求解器实数模型的无损表示。
 * 分母恒为正，分子分母互质。此类是不可变的。
 * @author Ayalyt
 */
public final class Rational implements Comparable<Rational> {

    private static final Logger logger = LoggerFactory.getLogger(Rational.class);
    private static final int MAX_CACHE_MAGNITUDE = 1024;
    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    /** 非有限小数展开时保留的有效位数 */
    public static final int DECIMAL_PRECISION = 20;

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);

    static {
        CACHE.put(ZERO.getCacheKey(), ZERO);
        CACHE.put(ONE.getCacheKey(), ONE);
    }

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(BigInteger numerator) {
        return valueOf(numerator, BigInteger.ONE);
    }

    public static Rational valueOf(long numerator) {
        if (numerator == 0L) {
            return ZERO;
        }
        if (numerator == 1L) {
            return ONE;
        }
        return valueOf(BigInteger.valueOf(numerator), BigInteger.ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "Numerator cannot be null.");
        Objects.requireNonNull(denominator, "Denominator cannot be null.");
        if (denominator.signum() == 0) {
            logger.error("尝试创建分母为0的Rational: {} / {}", numerator, denominator);
            throw new ArithmeticException("Rational 分母不能为0: " + numerator + "/" + denominator);
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        // 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        if (numerator.equals(denominator)) {
            return ONE;
        }
        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BigInteger.ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            logger.debug("从缓存命中: {}/{}", numerator, denominator);
            return cached;
        }
        Rational result = new Rational(numerator, denominator);
        if (shouldCache(result)) {
            CACHE.put(key, result);
        }
        return result;
    }

    /**
     * 解析十进制小数 ("2.5", "-0.125", "1e3") 或分数 ("1/3") 形式的字符串。
     * @param s 输入字符串。
     * @return 对应的 Rational。
     * @throws NumberFormatException 如果格式非法。
     */
    public static Rational valueOf(String s) {
        if (s == null || s.trim().isEmpty()) {
            throw new NumberFormatException("输入非法");
        }
        s = s.trim();

        if (s.contains("/")) {
            String[] parts = s.split("/", 2);
            if (parts[0].isEmpty() || parts[1].isEmpty()) {
                throw new NumberFormatException("无效分数格式: " + s);
            }
            try {
                return valueOf(new BigInteger(parts[0].trim()), new BigInteger(parts[1].trim()));
            } catch (NumberFormatException e) {
                throw new NumberFormatException("分数" + s + "的数字无效: " + e.getMessage());
            }
        }

        try {
            return valueOf(new BigDecimal(s));
        } catch (NumberFormatException e) {
            throw new NumberFormatException("无效数字格式: " + s);
        }
    }

    public static Rational valueOf(BigDecimal bd) {
        int scale = bd.scale();
        if (scale <= 0) {
            return valueOf(bd.unscaledValue().multiply(BigInteger.TEN.pow(-scale)), BigInteger.ONE);
        }
        return valueOf(bd.unscaledValue(), BigInteger.TEN.pow(scale));
    }

    // ========== 基础运算 ==========

    public Rational add(Rational other) {
        if (this == ZERO) {
            return other;
        }
        if (other == ZERO) {
            return this;
        }
        return valueOf(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return add(other.negate());
    }

    public Rational multiply(Rational other) {
        if (this == ZERO || other == ZERO) {
            return ZERO;
        }
        return valueOf(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    public Rational divide(Rational other) {
        if (other.isZero()) {
            throw new ArithmeticException("除以零: " + this + " / " + other);
        }
        return valueOf(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    public Rational negate() {
        if (this == ZERO) {
            return ZERO;
        }
        return valueOf(numerator.negate(), denominator);
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    public int signum() {
        return numerator.signum();
    }

    /**
     * 向零截断取整。
     */
    public BigInteger truncate() {
        return numerator.divide(denominator);
    }

    /**
     * 向下取整。
     */
    public BigInteger floor() {
        BigInteger[] qr = numerator.divideAndRemainder(denominator);
        if (qr[1].signum() < 0) {
            return qr[0].subtract(BigInteger.ONE);
        }
        return qr[0];
    }

    /**
     * 十进制字符串表示。有限小数精确输出；无限循环小数保留 {@link #DECIMAL_PRECISION} 位有效数字，
     * 末尾追加 "?" 以标记截断（与 Z3 的十进制输出约定一致）。
     * @return 不经过二进制浮点的十进制字符串。
     */
    public String toDecimalString() {
        BigDecimal num = new BigDecimal(numerator);
        BigDecimal den = new BigDecimal(denominator);
        try {
            return num.divide(den).stripTrailingZeros().toPlainString();
        } catch (ArithmeticException nonTerminating) {
            BigDecimal approx = num.divide(den, new MathContext(DECIMAL_PRECISION, RoundingMode.HALF_EVEN));
            return approx.stripTrailingZeros().toPlainString() + "?";
        }
    }

    public ArithExpr toZ3Real(Context ctx) {
        if (isInteger()) {
            return ctx.mkReal(numerator.toString());
        }
        return ctx.mkDiv(ctx.mkReal(numerator.toString()), ctx.mkReal(denominator.toString()));
    }

    @Override
    public int compareTo(Rational other) {
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Rational rational = (Rational) o;
        return numerator.equals(rational.numerator) && denominator.equals(rational.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            hash = h;
        }
        return h;
    }

    private List<BigInteger> getCacheKey() {
        return List.of(numerator, denominator);
    }

    private static boolean shouldCache(Rational r) {
        return r.numerator.abs().compareTo(BigInteger.valueOf(MAX_CACHE_MAGNITUDE)) <= 0
                && r.denominator.compareTo(BigInteger.valueOf(MAX_CACHE_MAGNITUDE)) <= 0;
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return numerator.toString();
        }
        return numerator + "/" + denominator;
    }
}
