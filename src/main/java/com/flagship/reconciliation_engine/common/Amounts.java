package com.flagship.reconciliation_engine.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point money helpers.
 *
 * Amounts enter with at most 2 fractional digits. Running sums are held at
 * {@link #INTERNAL_SCALE} and rounded exactly once, to {@link #EXPOSED_SCALE},
 * when they are exposed on a document.
 */
public final class Amounts {

    public static final int INTERNAL_SCALE = 4;
    public static final int EXPOSED_SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    /** Smallest difference that still counts as a variance. */
    public static final BigDecimal CENT = new BigDecimal("0.01");

    private Amounts() {
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(INTERNAL_SCALE);
    }

    public static BigDecimal exposedZero() {
        return BigDecimal.ZERO.setScale(EXPOSED_SCALE);
    }

    /**
     * Adds without losing precision; the result keeps at least the internal scale.
     */
    public static BigDecimal accumulate(BigDecimal running, BigDecimal amount) {
        BigDecimal sum = running.add(orZero(amount));
        return sum.scale() < INTERNAL_SCALE ? sum.setScale(INTERNAL_SCALE) : sum;
    }

    public static BigDecimal round2(BigDecimal amount) {
        return orZero(amount).setScale(EXPOSED_SCALE, ROUNDING);
    }

    public static BigDecimal orZero(BigDecimal amount) {
        return amount == null ? BigDecimal.ZERO : amount;
    }

    /**
     * True when the value carries no more than 2 significant fractional digits.
     */
    public static boolean hasCentPrecision(BigDecimal amount) {
        return amount.stripTrailingZeros().scale() <= EXPOSED_SCALE;
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }
}
