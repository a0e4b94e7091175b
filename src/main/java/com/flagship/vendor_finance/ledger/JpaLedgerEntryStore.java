package com.flagship.vendor_finance.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaLedgerEntryStore implements LedgerEntryStore {

    private static final Sort NEWEST_FIRST = Sort.by(
        Sort.Order.desc("createdAt"), Sort.Order.desc("sequenceNumber"));

    private final LedgerEntryRepository repository;

    @Override
    @Transactional
    public LedgerEntry append(LedgerEntry entry) {
        LedgerEntryEntity saved = repository.saveAndFlush(LedgerEntryEntity.fromDomain(entry));
        log.debug("Appended ledger entry {} for vendor {}", saved.getId(), saved.getVendorId());
        return saved.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findById(UUID entryId) {
        return repository.findById(entryId).map(LedgerEntryEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findByIdempotencyKey(String idempotencyKey) {
        return repository.findByIdempotencyKey(idempotencyKey).map(LedgerEntryEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<LedgerEntry> findByVendor(UUID vendorId, LedgerEntryFilter filter, Pageable pageable) {
        Pageable sorted = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), NEWEST_FIRST);
        return repository.findAll(matching(vendorId, filter), sorted).map(LedgerEntryEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEntry> findByOrder(UUID vendorId, UUID orderId) {
        return repository.findByVendorIdAndOrderIdOrderBySequenceNumberAsc(vendorId, orderId).stream()
            .map(LedgerEntryEntity::toDomain)
            .toList();
    }

    private static Specification<LedgerEntryEntity> matching(UUID vendorId, LedgerEntryFilter filter) {
        Specification<LedgerEntryEntity> spec = (root, query, cb) -> cb.equal(root.get("vendorId"), vendorId);
        if (filter.getTransactionType() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("transactionType"), filter.getTransactionType()));
        }
        if (filter.getBalanceStatus() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("balanceStatus"), filter.getBalanceStatus()));
        }
        if (filter.getFrom() != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("createdAt"), filter.getFrom()));
        }
        if (filter.getTo() != null) {
            spec = spec.and((root, query, cb) -> cb.lessThan(root.get("createdAt"), filter.getTo()));
        }
        return spec;
    }
}
