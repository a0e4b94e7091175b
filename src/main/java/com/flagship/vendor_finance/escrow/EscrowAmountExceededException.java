package com.flagship.vendor_finance.escrow;

import com.flagship.vendor_finance.common.ErrorCategory;
import com.flagship.vendor_finance.common.FinanceException;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * A release asked for more than the order still has in escrow.
 */
public class EscrowAmountExceededException extends FinanceException {

    private final BigDecimal heldAmount;

    public EscrowAmountExceededException(UUID orderId, BigDecimal requested, BigDecimal heldAmount) {
        super(ErrorCategory.VALIDATION,
            String.format("Cannot release %s for order %s: only %s is held in escrow",
                requested.toPlainString(), orderId, heldAmount.toPlainString()),
            Map.of(
                "orderId", orderId.toString(),
                "amount", requested.toPlainString(),
                "heldAmount", heldAmount.toPlainString()));
        this.heldAmount = heldAmount;
    }

    public BigDecimal getHeldAmount() {
        return heldAmount;
    }
}
