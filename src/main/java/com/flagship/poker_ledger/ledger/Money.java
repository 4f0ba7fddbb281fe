package com.flagship.poker_ledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point currency helpers.
 *
 * All amounts in the ledger are two-decimal values. The same tolerance of one
 * minor unit is used for the closing gate and for settlement remainders.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final BigDecimal EPSILON = new BigDecimal("0.01");
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Money() {
    }

    /**
     * Normalizes an amount to scale 2 (HALF_UP). Null is treated as zero.
     */
    public static BigDecimal normalize(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * |a - b| <= 0.01
     */
    public static boolean withinTolerance(BigDecimal a, BigDecimal b) {
        return normalize(a).subtract(normalize(b)).abs().compareTo(EPSILON) <= 0;
    }

    /**
     * |amount| < 0.01
     */
    public static boolean isNegligible(BigDecimal amount) {
        return normalize(amount).abs().compareTo(EPSILON) < 0;
    }

    /**
     * True if the amount needs no rounding to fit two decimals, so 150.50 and
     * 150.500 pass while 150.005 does not.
     */
    public static boolean hasValidScale(BigDecimal amount) {
        return amount != null && amount.stripTrailingZeros().scale() <= SCALE;
    }
}
