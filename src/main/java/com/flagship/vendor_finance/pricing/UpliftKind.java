package com.flagship.vendor_finance.pricing;

/**
 * How a parent vendor's uplift on a sub-vendor product is expressed.
 */
public enum UpliftKind {
    /** A fixed amount added to the base price. */
    FIXED_AMOUNT,

    /** A fraction of the base price (0.10 = 10%). */
    PERCENTAGE
}
