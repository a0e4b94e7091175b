package com.flagship.vendor_finance.payout;

import com.flagship.vendor_finance.common.ErrorCategory;
import com.flagship.vendor_finance.common.FinanceException;

import java.math.BigDecimal;
import java.util.Map;

public class InvalidPayoutAmountException extends FinanceException {

    public InvalidPayoutAmountException(BigDecimal amount) {
        super(ErrorCategory.VALIDATION, "Payout amount must be greater than zero, got " + amount,
            Map.of("amount", String.valueOf(amount)));
    }
}
