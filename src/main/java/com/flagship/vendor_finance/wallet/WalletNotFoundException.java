package com.flagship.vendor_finance.wallet;

import com.flagship.vendor_finance.common.ErrorCategory;
import com.flagship.vendor_finance.common.FinanceException;

import java.util.Map;
import java.util.UUID;

/**
 * No wallet has been provisioned for the vendor.
 */
public class WalletNotFoundException extends FinanceException {

    private final UUID vendorId;

    public WalletNotFoundException(UUID vendorId) {
        super(ErrorCategory.NOT_FOUND, "Wallet not found for vendor " + vendorId,
            Map.of("vendorId", String.valueOf(vendorId)));
        this.vendorId = vendorId;
    }

    public UUID getVendorId() {
        return vendorId;
    }
}
