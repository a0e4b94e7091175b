package com.flagship.vendor_finance.ledger.event;

import com.flagship.vendor_finance.ledger.LedgerEntry;
import com.flagship.vendor_finance.wallet.VendorWallet;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published for every entry applied to a vendor wallet, carrying the resulting balances.
 */
@Value
public class LedgerEntryRecordedEvent {
    UUID eventId;
    UUID entryId;
    UUID vendorId;
    UUID orderId;
    String transactionType;
    String balanceStatus;
    BigDecimal amount;
    BigDecimal vendorAmount;
    BigDecimal commissionAmount;
    BigDecimal vatAmount;
    String description;
    BigDecimal pendingBalance;
    BigDecimal availableBalance;
    BigDecimal lifetimeEarnings;
    BigDecimal lifetimePayouts;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LedgerEntryRecorded";

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LedgerEntryRecordedEvent of(LedgerEntry entry, VendorWallet wallet) {
        return new LedgerEntryRecordedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getVendorId(),
            entry.getOrderId(),
            entry.getTransactionType().name(),
            entry.getBalanceStatus().name(),
            entry.getAmount(),
            entry.getVendorAmount(),
            entry.getCommissionAmount(),
            entry.getVatAmount(),
            entry.getDescription(),
            wallet.getPendingBalance(),
            wallet.getAvailableBalance(),
            wallet.getLifetimeEarnings(),
            wallet.getLifetimePayouts(),
            entry.getCreatedAt()
        );
    }
}
