package com.flagship.vendor_finance.pricing;

import com.flagship.vendor_finance.common.ErrorCategory;
import com.flagship.vendor_finance.common.FinanceException;

import java.util.Map;

/**
 * Raised before any calculation when a pricing or shipping input is invalid.
 * {@link #getField()} names the offending input.
 */
public class InvalidPricingInputException extends FinanceException {

    private final String field;

    public InvalidPricingInputException(String field, String reason) {
        super(ErrorCategory.VALIDATION,
            String.format("Invalid pricing input '%s': %s", field, reason),
            Map.of(field, reason));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
