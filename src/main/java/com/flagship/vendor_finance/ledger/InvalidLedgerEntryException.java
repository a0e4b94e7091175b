package com.flagship.vendor_finance.ledger;

import com.flagship.vendor_finance.common.ErrorCategory;
import com.flagship.vendor_finance.common.FinanceException;

import java.util.Map;

public class InvalidLedgerEntryException extends FinanceException {

    public InvalidLedgerEntryException(String field, String reason) {
        super(ErrorCategory.VALIDATION,
            String.format("Invalid ledger entry '%s': %s", field, reason),
            Map.of(field, reason));
    }
}
