package com.flagship.vendor_finance.moderation;

/**
 * Which side of the category benchmark a flagged price falls on.
 */
public enum DeviationDirection {
    ABOVE,
    BELOW,
    /** Within the threshold, not flagged. */
    WITHIN
}
