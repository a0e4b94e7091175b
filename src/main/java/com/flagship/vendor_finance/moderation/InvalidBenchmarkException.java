package com.flagship.vendor_finance.moderation;

import com.flagship.vendor_finance.common.ErrorCategory;
import com.flagship.vendor_finance.common.FinanceException;

import java.math.BigDecimal;
import java.util.Map;

/**
 * The category benchmark is missing, zero or negative, so no deviation can be computed.
 */
public class InvalidBenchmarkException extends FinanceException {

    public InvalidBenchmarkException(BigDecimal benchmark) {
        super(ErrorCategory.VALIDATION,
            "Category benchmark must be greater than zero, got " + benchmark,
            Map.of("benchmark", String.valueOf(benchmark)));
    }
}
