package com.flagship.vendor_finance.pricing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Full price breakdown of a line item.
 *
 * The final price is split into four buckets:
 * <ul>
 *   <li>A - vendor revenue: base price plus parent uplift</li>
 *   <li>B - vendor VAT: VAT on A, only for VAT-registered vendors</li>
 *   <li>C - platform revenue: cooperative fee, marketplace uplift and logistics surcharge</li>
 *   <li>D - platform VAT: VAT on C, always charged</li>
 * </ul>
 *
 * Invariant: {@code finalPrice == A + B + C + D} at scale 2, every bucket non-negative.
 */
@Value
@Builder
public class PricingBreakdown {
    BigDecimal vendorBasePrice;
    BigDecimal cooperativeFee;
    BigDecimal parentUpliftAmount;
    BigDecimal marketplaceUplift;
    BigDecimal logisticsSurcharge;

    /** Bucket A. */
    BigDecimal vendorRevenue;
    /** Bucket B. */
    BigDecimal vendorVat;
    /** Bucket C. */
    BigDecimal platformRevenue;
    /** Bucket D. */
    BigDecimal platformVat;

    BigDecimal finalPrice;
    BigDecimal vendorNetPayout;
    BigDecimal commissionRate;
    BigDecimal vatRate;
    BigDecimal totalVat;
    BigDecimal platformMargin;
    BigDecimal marginPercent;

    public BigDecimal bucketTotal() {
        return vendorRevenue.add(vendorVat).add(platformRevenue).add(platformVat);
    }
}
