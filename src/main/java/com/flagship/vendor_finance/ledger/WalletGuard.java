package com.flagship.vendor_finance.ledger;

import com.flagship.vendor_finance.wallet.VendorWallet;

/**
 * Precondition evaluated against the freshly loaded wallet on every posting attempt.
 * Throwing aborts the posting without touching the wallet.
 */
@FunctionalInterface
public interface WalletGuard {

    WalletGuard NONE = wallet -> { };

    void check(VendorWallet wallet);
}
