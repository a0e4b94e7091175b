package com.flagship.vendor_finance.wallet;

import com.flagship.vendor_finance.common.ErrorCategory;
import com.flagship.vendor_finance.common.FinanceException;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * {@code lifetimeEarnings - lifetimePayouts} no longer equals the held balances.
 */
public class AccountingIdentityViolationException extends FinanceException {

    public AccountingIdentityViolationException(UUID vendorId, BigDecimal netEarnings, BigDecimal heldBalance) {
        super(ErrorCategory.INVARIANT,
            String.format("Accounting identity broken for vendor %s: earnings - payouts = %s, pending + available = %s",
                vendorId, netEarnings, heldBalance),
            Map.of("vendorId", String.valueOf(vendorId),
                "netEarnings", netEarnings.toPlainString(),
                "heldBalance", heldBalance.toPlainString()));
    }
}
