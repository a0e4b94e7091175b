package com.flagship.vendor_finance.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding rules for monetary values.
 *
 * All amounts are held at scale 2 with HALF_UP rounding, applied at bucket
 * boundaries only. Rates keep their configured scale.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    /** Scale used for intermediate divisions before the final rounding. */
    public static final int DIVISION_SCALE = 10;

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private Money() {
    }

    public static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    /**
     * {@code part / whole * 100}, rounded to 2 places. Zero when {@code whole} is zero.
     */
    public static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) {
            return ZERO;
        }
        return round(part.multiply(HUNDRED).divide(whole, DIVISION_SCALE, ROUNDING));
    }
}
