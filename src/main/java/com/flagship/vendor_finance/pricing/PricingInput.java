package com.flagship.vendor_finance.pricing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Everything needed to price one line item. Built per calculation, never stored.
 *
 * {@code parentUplift} and {@code upliftOverride} are optional. When the override is
 * present it replaces the category's default uplift rate entirely.
 */
@Value
@Builder
public class PricingInput {
    BigDecimal vendorBasePrice;
    String categoryId;
    boolean vendorVatRegistered;
    boolean vendorLegalized;
    ParentUplift parentUplift;
    BigDecimal upliftOverride;
}
