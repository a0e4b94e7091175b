package com.flagship.vendor_finance.ledger;

public enum TransactionType {
    SALE,
    COMMISSION,
    VAT,
    SHIPPING,
    REFUND,
    PAYOUT,

    /**
     * Moves funds from pending to available once the escrow hold is over.
     * Always posted as AVAILABLE with a positive vendor amount; lifetime totals are untouched.
     */
    ESCROW_RELEASE
}
