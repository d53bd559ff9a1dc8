package com.tradecontrol.common;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Shared BigDecimal arithmetic for prices, amounts and percentages.
 */
public final class Decimals {

    public static final MathContext MC = MathContext.DECIMAL64;

    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Decimals() {}

    /** {@code value * (1 - percent/100)}. */
    public static BigDecimal reduceByPercent(BigDecimal value, BigDecimal percent) {
        return value.multiply(BigDecimal.ONE.subtract(percent.divide(HUNDRED, MC)), MC);
    }

    /** {@code value * (1 + percent/100)}. */
    public static BigDecimal increaseByPercent(BigDecimal value, BigDecimal percent) {
        return value.multiply(BigDecimal.ONE.add(percent.divide(HUNDRED, MC)), MC);
    }

    /** {@code part / whole * 100}. Caller guarantees {@code whole != 0}. */
    public static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        return part.divide(whole, MC).multiply(HUNDRED, MC);
    }

    /** {@code value * percent / 100}. */
    public static BigDecimal percentage(BigDecimal value, BigDecimal percent) {
        return value.multiply(percent, MC).divide(HUNDRED, MC);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }
}
