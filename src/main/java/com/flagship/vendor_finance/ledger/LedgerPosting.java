package com.flagship.vendor_finance.ledger;

import com.flagship.vendor_finance.wallet.VendorWallet;
import lombok.Value;

/**
 * Result of posting an entry: the entry and the wallet right after it.
 * {@code replayed} is true when an idempotency key matched an earlier posting,
 * in which case {@code wallet} is the current wallet.
 */
@Value
public class LedgerPosting {
    LedgerEntry entry;
    VendorWallet wallet;
    boolean replayed;
}
