package com.flagship.vendor_finance.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Ledger entry as submitted by a caller, before it has an id or a timestamp.
 *
 * {@code commissionAmount} and {@code vatAmount} are informational and default to zero.
 * {@code idempotencyKey} is optional; when present the entry is applied at most once.
 */
@Value
@Builder
public class LedgerEntryDraft {
    UUID orderId;
    TransactionType transactionType;
    BigDecimal amount;
    BigDecimal vendorAmount;
    BigDecimal commissionAmount;
    BigDecimal vatAmount;
    String description;
    BalanceStatus balanceStatus;
    String idempotencyKey;
}
