package com.flagship.vendor_finance.ledger;

import com.flagship.vendor_finance.common.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An immutable record of a single financial event on a vendor wallet.
 *
 * Entries are never updated or deleted. Corrections are appended as offsetting entries.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID vendorId;
    UUID orderId;
    TransactionType transactionType;
    BigDecimal amount;
    BigDecimal vendorAmount;
    BigDecimal commissionAmount;
    BigDecimal vatAmount;
    String description;
    BalanceStatus balanceStatus;
    String idempotencyKey;
    Instant createdAt;

    /**
     * Creates a new entry from a validated draft.
     */
    public static LedgerEntry fromDraft(UUID vendorId, LedgerEntryDraft draft, Instant createdAt) {
        return new LedgerEntry(
            UUID.randomUUID(),
            vendorId,
            draft.getOrderId(),
            draft.getTransactionType(),
            Money.round(draft.getAmount()),
            Money.round(draft.getVendorAmount()),
            Money.round(Money.nz(draft.getCommissionAmount())),
            Money.round(Money.nz(draft.getVatAmount())),
            draft.getDescription(),
            draft.getBalanceStatus(),
            draft.getIdempotencyKey(),
            createdAt
        );
    }
}
