package com.flagship.vendor_finance.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Optional criteria for listing a vendor's ledger. Null fields are ignored.
 * {@code from} is inclusive, {@code to} exclusive.
 */
@Value
@Builder
public class LedgerEntryFilter {
    TransactionType transactionType;
    BalanceStatus balanceStatus;
    Instant from;
    Instant to;

    public static LedgerEntryFilter none() {
        return LedgerEntryFilter.builder().build();
    }
}
