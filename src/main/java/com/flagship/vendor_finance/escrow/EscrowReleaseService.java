package com.flagship.vendor_finance.escrow;

import com.flagship.vendor_finance.common.Money;
import com.flagship.vendor_finance.ledger.BalanceStatus;
import com.flagship.vendor_finance.ledger.LedgerAccountant;
import com.flagship.vendor_finance.ledger.LedgerEntry;
import com.flagship.vendor_finance.ledger.LedgerEntryDraft;
import com.flagship.vendor_finance.ledger.LedgerEntryStore;
import com.flagship.vendor_finance.ledger.LedgerPosting;
import com.flagship.vendor_finance.ledger.TransactionType;
import com.flagship.vendor_finance.ledger.WalletGuard;
import com.flagship.vendor_finance.observability.FinanceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Promotes an order's escrowed funds from pending to available once the hold is over.
 *
 * Eligibility is recomputed on every call. A release can only move what the order itself
 * put into pending (its PENDING entries, reversals included, less earlier releases), so
 * funds of orders still on hold stay pending. The posting is keyed by order, so calling
 * this repeatedly for the same order releases the funds once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowReleaseService {

    static final String IDEMPOTENCY_PREFIX = "escrow-release:";

    private final EscrowScheduler escrowScheduler;
    private final LedgerAccountant ledgerAccountant;
    private final LedgerEntryStore entryStore;
    private final FinanceMetrics metrics;

    /**
     * @return the release posting, or empty while the order is still on hold
     * @throws EscrowAmountExceededException if {@code amount} is more than the order holds
     */
    public Optional<LedgerPosting> releaseIfEligible(UUID vendorId, UUID orderId, BigDecimal amount, Instant deliveredAt) {
        if (vendorId == null) {
            throw new IllegalArgumentException("Vendor ID cannot be null");
        }
        if (orderId == null) {
            throw new IllegalArgumentException("Order ID cannot be null");
        }
        if (!Money.isPositive(amount)) {
            throw new IllegalArgumentException("Release amount must be greater than zero");
        }

        EscrowResult escrow = escrowScheduler.computeRelease(deliveredAt);
        if (!escrow.isReleased()) {
            log.debug("Order {} still on hold until {} ({} days)", orderId, escrow.getReleaseDate(), escrow.getDaysRemaining());
            return Optional.empty();
        }

        String idempotencyKey = IDEMPOTENCY_PREFIX + orderId;
        List<LedgerEntry> orderEntries = entryStore.findByOrder(vendorId, orderId);
        boolean alreadyReleased = orderEntries.stream()
            .anyMatch(entry -> idempotencyKey.equals(entry.getIdempotencyKey()));
        if (!alreadyReleased) {
            BigDecimal held = heldInEscrow(orderEntries);
            if (amount.compareTo(held) > 0) {
                log.warn("Rejected release of {} for order {} of vendor {}: {} held", amount, orderId, vendorId, held);
                throw new EscrowAmountExceededException(orderId, amount, held);
            }
        }

        LedgerEntryDraft draft = LedgerEntryDraft.builder()
            .orderId(orderId)
            .transactionType(TransactionType.ESCROW_RELEASE)
            .balanceStatus(BalanceStatus.AVAILABLE)
            .amount(amount)
            .vendorAmount(amount)
            .description("Escrow release for order " + orderId)
            .idempotencyKey(idempotencyKey)
            .build();

        LedgerPosting posting = ledgerAccountant.post(vendorId, draft, WalletGuard.NONE);
        if (!posting.isReplayed()) {
            metrics.recordEscrowRelease();
            log.info("Released {} from escrow for order {} of vendor {}", amount, orderId, vendorId);
        }
        return Optional.of(posting);
    }

    private static BigDecimal heldInEscrow(List<LedgerEntry> orderEntries) {
        BigDecimal held = Money.ZERO;
        for (LedgerEntry entry : orderEntries) {
            if (entry.getTransactionType() == TransactionType.ESCROW_RELEASE) {
                held = held.subtract(entry.getVendorAmount());
            } else if (entry.getBalanceStatus() == BalanceStatus.PENDING) {
                held = held.add(entry.getVendorAmount());
            }
        }
        return held.max(Money.ZERO);
    }
}
