package com.flagship.vendor_finance.common;

/**
 * Classifies failures raised by the finance core so the calling layer can decide
 * how to surface them.
 */
public enum ErrorCategory {
    /**
     * Input rejected before any calculation or mutation ran.
     */
    VALIDATION,

    /**
     * Expected business outcome (e.g. payout below threshold). Not retried.
     */
    POLICY,

    /**
     * Referenced wallet or entry does not exist.
     */
    NOT_FOUND,

    /**
     * Optimistic concurrency retries were exhausted.
     */
    CONCURRENCY,

    /**
     * A balance or accounting invariant would have been broken.
     * Needs manual reconciliation.
     */
    INVARIANT
}
