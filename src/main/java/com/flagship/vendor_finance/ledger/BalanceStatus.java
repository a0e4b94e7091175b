package com.flagship.vendor_finance.ledger;

/**
 * Where the funds of a ledger entry sit in the vendor wallet.
 */
public enum BalanceStatus {
    /** Held in escrow until the release date. */
    PENDING,

    /** Released and withdrawable. */
    AVAILABLE,

    /** Paid out to the vendor. */
    WITHDRAWN
}
