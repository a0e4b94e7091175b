package com.flagship.vendor_finance.ledger;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only persistence port for ledger entries.
 */
public interface LedgerEntryStore {

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException if the idempotency key is taken
     */
    LedgerEntry append(LedgerEntry entry);

    Optional<LedgerEntry> findById(UUID entryId);

    Optional<LedgerEntry> findByIdempotencyKey(String idempotencyKey);

    /**
     * Entries of one vendor matching the filter, newest first.
     */
    Page<LedgerEntry> findByVendor(UUID vendorId, LedgerEntryFilter filter, Pageable pageable);

    /**
     * Every entry a vendor has for one order, oldest first.
     */
    List<LedgerEntry> findByOrder(UUID vendorId, UUID orderId);
}
