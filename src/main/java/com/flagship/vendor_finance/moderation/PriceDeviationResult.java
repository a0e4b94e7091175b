package com.flagship.vendor_finance.moderation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of comparing a listed price with its category benchmark.
 * {@code deviationPercent} is a fraction (0.30 = 30%) at 4 decimal places.
 */
@Value
public class PriceDeviationResult {
    BigDecimal observedPrice;
    BigDecimal benchmarkPrice;
    BigDecimal deviationPercent;
    BigDecimal threshold;
    boolean flagged;
    DeviationDirection direction;
}
