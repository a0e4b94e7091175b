package com.flagship.vendor_finance.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Read side of the vendor ledger.
 */
@Service
@RequiredArgsConstructor
public class LedgerQueryService {

    static final int MAX_PAGE_SIZE = 100;

    private final LedgerEntryStore entryStore;

    /**
     * Lists a vendor's entries, newest first.
     *
     * @param page zero-based page index
     * @param size page size, 1 to 100
     */
    public Page<LedgerEntry> findEntries(UUID vendorId, LedgerEntryFilter filter, int page, int size) {
        if (vendorId == null) {
            throw new IllegalArgumentException("Vendor ID cannot be null");
        }
        if (page < 0) {
            throw new IllegalArgumentException("Page index must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }
        LedgerEntryFilter effective = filter != null ? filter : LedgerEntryFilter.none();
        if (effective.getFrom() != null && effective.getTo() != null && !effective.getFrom().isBefore(effective.getTo())) {
            throw new IllegalArgumentException("Filter range start must be before its end");
        }
        return entryStore.findByVendor(vendorId, effective, PageRequest.of(page, size));
    }

    public Optional<LedgerEntry> findEntry(UUID entryId) {
        return entryStore.findById(entryId);
    }
}
