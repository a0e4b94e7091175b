package com.flagship.vendor_finance.pricing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Parcel measurements used to price delivery. Dimensions are in centimetres.
 */
@Value
@Builder
public class ShippingFeeInput {
    BigDecimal actualWeightKg;
    BigDecimal lengthCm;
    BigDecimal widthCm;
    BigDecimal heightCm;
}
