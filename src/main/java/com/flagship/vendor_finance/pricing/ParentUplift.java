package com.flagship.vendor_finance.pricing;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Uplift a parent vendor adds on top of a sub-vendor's quoted price.
 */
@Value
public class ParentUplift {
    UpliftKind kind;
    BigDecimal value;

    public static ParentUplift fixedAmount(BigDecimal amount) {
        return new ParentUplift(UpliftKind.FIXED_AMOUNT, amount);
    }

    public static ParentUplift percentage(BigDecimal fraction) {
        return new ParentUplift(UpliftKind.PERCENTAGE, fraction);
    }
}
