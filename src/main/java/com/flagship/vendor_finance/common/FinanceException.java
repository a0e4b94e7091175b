package com.flagship.vendor_finance.common;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every failure raised by the finance core.
 *
 * Carries a category and a field-to-reason map so the caller can reconstruct
 * which input was rejected without parsing the message.
 */
public abstract class FinanceException extends RuntimeException {

    private final ErrorCategory category;
    private final Map<String, String> details;

    protected FinanceException(ErrorCategory category, String message, Map<String, String> details) {
        super(message);
        this.category = category;
        this.details = details == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    protected FinanceException(ErrorCategory category, String message) {
        this(category, message, null);
    }

    protected FinanceException(ErrorCategory category, String message, Map<String, String> details, Throwable cause) {
        this(category, message, details);
        initCause(cause);
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
