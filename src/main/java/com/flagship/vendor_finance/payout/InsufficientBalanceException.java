package com.flagship.vendor_finance.payout;

import com.flagship.vendor_finance.common.ErrorCategory;
import com.flagship.vendor_finance.common.FinanceException;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * The requested payout exceeds the wallet's available balance.
 */
public class InsufficientBalanceException extends FinanceException {

    private final BigDecimal availableBalance;

    public InsufficientBalanceException(UUID vendorId, BigDecimal requested, BigDecimal availableBalance) {
        super(ErrorCategory.POLICY,
            String.format("Vendor %s requested %s but only %s is available",
                vendorId, requested.toPlainString(), availableBalance.toPlainString()),
            Map.of("vendorId", String.valueOf(vendorId),
                "requested", requested.toPlainString(),
                "available", availableBalance.toPlainString()));
        this.availableBalance = availableBalance;
    }

    public BigDecimal getAvailableBalance() {
        return availableBalance;
    }
}
