package com.flagship.vendor_finance.ledger;

import com.flagship.vendor_finance.common.ErrorCategory;
import com.flagship.vendor_finance.common.FinanceException;

import java.util.Map;
import java.util.UUID;

/**
 * Every attempt to update the wallet lost an optimistic version check.
 * Nothing was applied; the caller may resubmit.
 */
public class ConcurrentWalletModificationException extends FinanceException {

    public ConcurrentWalletModificationException(UUID vendorId, int attempts, Throwable cause) {
        super(ErrorCategory.CONCURRENCY,
            String.format("Wallet of vendor %s was modified concurrently; gave up after %d attempts", vendorId, attempts),
            Map.of("vendorId", String.valueOf(vendorId), "attempts", String.valueOf(attempts)),
            cause);
    }
}
