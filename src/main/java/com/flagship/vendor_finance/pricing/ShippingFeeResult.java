package com.flagship.vendor_finance.pricing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Shipping fee split between the customer and the platform subsidy.
 * {@code customerShippingFee + platformSubsidy == totalShippingFee}.
 */
@Value
@Builder
public class ShippingFeeResult {
    BigDecimal actualWeightKg;
    BigDecimal volumetricWeightKg;
    BigDecimal chargeableWeightKg;
    BigDecimal baseFee;
    BigDecimal extraWeightFee;
    BigDecimal totalShippingFee;
    BigDecimal platformSubsidy;
    BigDecimal customerShippingFee;
}
