package com.flagship.vendor_finance.pricing;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class Category {
    String id;
    BigDecimal defaultUpliftRate;
}
