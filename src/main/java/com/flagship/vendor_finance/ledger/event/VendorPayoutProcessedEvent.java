package com.flagship.vendor_finance.ledger.event;

import com.flagship.vendor_finance.ledger.LedgerEntry;
import com.flagship.vendor_finance.wallet.VendorWallet;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when funds leave a vendor wallet. Downstream bank transfer jobs consume this.
 */
@Value
public class VendorPayoutProcessedEvent {
    UUID eventId;
    UUID entryId;
    UUID vendorId;
    BigDecimal payoutAmount;
    BigDecimal remainingAvailableBalance;
    String description;
    Instant occurredAt;

    public static final String EVENT_TYPE = "VendorPayoutProcessed";

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static VendorPayoutProcessedEvent of(LedgerEntry entry, VendorWallet wallet) {
        return new VendorPayoutProcessedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getVendorId(),
            entry.getVendorAmount().abs(),
            wallet.getAvailableBalance(),
            entry.getDescription(),
            entry.getCreatedAt()
        );
    }
}
