package com.flagship.vendor_finance.wallet;

import com.flagship.vendor_finance.common.ErrorCategory;
import com.flagship.vendor_finance.common.FinanceException;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Applying an entry would drive a wallet balance below zero.
 * Signals a double spend or a skipped transition; the operation is aborted, never clamped.
 */
public class NegativeBalanceViolationException extends FinanceException {

    public NegativeBalanceViolationException(UUID vendorId, String balance, BigDecimal before, BigDecimal after) {
        super(ErrorCategory.INVARIANT,
            String.format("%s of vendor %s would become %s (was %s)", balance, vendorId, after, before),
            Map.of("vendorId", String.valueOf(vendorId),
                "balance", balance,
                "before", before.toPlainString(),
                "after", after.toPlainString()));
    }
}
