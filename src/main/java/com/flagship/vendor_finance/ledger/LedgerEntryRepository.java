package com.flagship.vendor_finance.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntryEntity, UUID>,
        JpaSpecificationExecutor<LedgerEntryEntity> {

    Optional<LedgerEntryEntity> findByIdempotencyKey(String idempotencyKey);

    List<LedgerEntryEntity> findByVendorIdAndOrderIdOrderBySequenceNumberAsc(UUID vendorId, UUID orderId);
}
