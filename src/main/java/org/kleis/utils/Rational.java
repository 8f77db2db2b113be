package org.kleis.utils;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * 数字字面量的精确有理数表示。字面量可写作整数、小数或分数 {@code p/q}。
 * 规范形式：分母为正，分子分母互素。
 */
@Getter
public final class Rational implements Comparable<Rational> {

    private static final Logger logger = LoggerFactory.getLogger(Rational.class);

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);

    private final BigInteger numerator;
    private final BigInteger denominator;
    private int hash;

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static Rational valueOf(long numerator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "分子不能为空");
        Objects.requireNonNull(denominator, "分母不能为空");
        if (denominator.signum() == 0) {
            throw new ArithmeticException("分母为0: " + numerator + "/0");
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
        BigInteger gcd = numerator.gcd(denominator);
        if (!gcd.equals(BigInteger.ONE)) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
        return new Rational(numerator, denominator);
    }

    /**
     * 解析数字字面量。
     *
     * @throws NumberFormatException 不是整数、小数或分数
     */
    public static Rational valueOf(String s) {
        if (s == null || s.trim().isEmpty()) {
            throw new NumberFormatException("输入非法");
        }
        s = s.trim();

        // 分数形式
        if (s.contains("/")) {
            String[] parts = s.split("/", 2);
            if (parts[0].isEmpty() || parts[1].isEmpty()) {
                throw new NumberFormatException("无效分数格式: " + s);
            }
            try {
                BigInteger num = new BigInteger(parts[0].trim());
                BigInteger den = new BigInteger(parts[1].trim());
                if (den.signum() == 0) {
                    throw new NumberFormatException("分母为0: " + s);
                }
                return valueOf(num, den);
            } catch (NumberFormatException e) {
                throw new NumberFormatException("分数" + s + "的数字无效: " + e.getMessage());
            }
        }

        // 整数和小数
        try {
            BigDecimal bd = new BigDecimal(s);
            int scale = bd.scale();
            if (scale <= 0) {
                return valueOf(bd.unscaledValue().multiply(BigInteger.TEN.pow(-scale)), BigInteger.ONE);
            }
            return valueOf(bd.unscaledValue(), BigInteger.TEN.pow(scale));
        } catch (NumberFormatException e) {
            throw new NumberFormatException("无效数字格式: " + s);
        }
    }

    /**
     * 判断字符串是否是合法的数字字面量，不抛异常。
     */
    public static boolean isNumeric(String s) {
        try {
            valueOf(s);
            return true;
        } catch (NumberFormatException e) {
            logger.trace("'{}' 不是数字字面量", s);
            return false;
        }
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    public Rational negate() {
        return valueOf(numerator.negate(), denominator);
    }

    @Override
    public int compareTo(Rational other) {
        BigInteger ad = this.numerator.multiply(other.denominator);
        BigInteger cb = other.numerator.multiply(this.denominator);
        return ad.compareTo(cb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational that)) {
            return false;
        }
        return numerator.equals(that.numerator) && denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return numerator.toString();
        }
        return numerator + "/" + denominator;
    }
}
