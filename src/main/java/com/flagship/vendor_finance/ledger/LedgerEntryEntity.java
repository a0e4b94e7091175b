package com.flagship.vendor_finance.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for ledger entries.
 *
 * Every column is {@code updatable = false}; the schema additionally turns UPDATE and
 * DELETE on {@code ledger_entries} into no-ops.
 */
@Entity
@Table(
    name = "ledger_entries",
    indexes = {
        @Index(name = "idx_ledger_entries_vendor_created", columnList = "vendor_id, created_at"),
        @Index(name = "idx_ledger_entries_order", columnList = "order_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "vendor_id", nullable = false, updatable = false)
    private UUID vendorId;

    @Column(name = "order_id", updatable = false)
    private UUID orderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, updatable = false, length = 20)
    private TransactionType transactionType;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "vendor_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal vendorAmount;

    @Column(name = "commission_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal commissionAmount;

    @Column(name = "vat_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal vatAmount;

    @Column(nullable = false, updatable = false, length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "balance_status", nullable = false, updatable = false, length = 20)
    private BalanceStatus balanceStatus;

    @Column(name = "idempotency_key", unique = true, updatable = false, length = 100)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static LedgerEntryEntity fromDomain(LedgerEntry entry) {
        return new LedgerEntryEntity(
            entry.getId(),
            entry.getVendorId(),
            entry.getOrderId(),
            entry.getTransactionType(),
            entry.getAmount(),
            entry.getVendorAmount(),
            entry.getCommissionAmount(),
            entry.getVatAmount(),
            entry.getDescription(),
            entry.getBalanceStatus(),
            entry.getIdempotencyKey(),
            entry.getCreatedAt(),
            null // assigned by the database
        );
    }

    LedgerEntry toDomain() {
        return new LedgerEntry(
            id,
            vendorId,
            orderId,
            transactionType,
            amount,
            vendorAmount,
            commissionAmount,
            vatAmount,
            description,
            balanceStatus,
            idempotencyKey,
            createdAt
        );
    }
}
