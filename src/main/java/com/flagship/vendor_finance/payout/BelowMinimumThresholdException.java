package com.flagship.vendor_finance.payout;

import com.flagship.vendor_finance.common.ErrorCategory;
import com.flagship.vendor_finance.common.FinanceException;

import java.math.BigDecimal;
import java.util.Map;

/**
 * The requested payout is smaller than the configured minimum.
 */
public class BelowMinimumThresholdException extends FinanceException {

    private final BigDecimal minimum;

    public BelowMinimumThresholdException(BigDecimal amount, BigDecimal minimum) {
        super(ErrorCategory.POLICY,
            String.format("Payout of %s is below the minimum of %s", amount.toPlainString(), minimum.toPlainString()),
            Map.of("amount", amount.toPlainString(), "minimum", minimum.toPlainString()));
        this.minimum = minimum;
    }

    public BigDecimal getMinimum() {
        return minimum;
    }
}
