package com.flagship.vendor_finance.ledger;

import com.flagship.vendor_finance.config.FinancePolicyProperties;
import com.flagship.vendor_finance.ledger.event.LedgerEntryRecordedEvent;
import com.flagship.vendor_finance.ledger.event.VendorPayoutProcessedEvent;
import com.flagship.vendor_finance.observability.FinanceMetrics;
import com.flagship.vendor_finance.outbox.OutboxService;
import com.flagship.vendor_finance.wallet.AccountingIdentityViolationException;
import com.flagship.vendor_finance.wallet.NegativeBalanceViolationException;
import com.flagship.vendor_finance.wallet.VendorWallet;
import com.flagship.vendor_finance.wallet.VendorWalletStore;
import com.flagship.vendor_finance.wallet.WalletNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies ledger entries to vendor wallets.
 *
 * Each attempt runs in its own transaction: load the wallet, run the caller's guard,
 * apply the entry, write the wallet with a version check, append the entry and queue
 * the outbox events. Any failure rolls all of it back. The application wires a
 * REQUIRES_NEW template here (see {@code TransactionConfig}), so an attempt never joins a
 * transaction the caller has open.
 *
 * Concurrent postings to one wallet are serialized by the version check. A losing
 * attempt is retried from a fresh read (guard included) up to
 * {@code finance.policy.max-wallet-update-attempts} times. Postings to different
 * wallets never contend.
 *
 * Entries carrying an idempotency key are applied at most once; a repeated key returns
 * the original entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerAccountant {

    static final String MDC_VENDOR_ID = "vendorId";
    static final int MAX_DESCRIPTION_LENGTH = 500;
    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 100;

    private final VendorWalletStore walletStore;
    private final LedgerEntryStore entryStore;
    private final LedgerIdempotencyService idempotency;
    private final OutboxService outboxService;
    private final TransactionOperations transactions;
    private final FinanceMetrics metrics;
    private final FinancePolicyProperties policy;
    private final Clock clock;

    /**
     * Applies one entry to the vendor's wallet and returns the stored entry.
     *
     * @throws InvalidLedgerEntryException if the draft is malformed
     * @throws WalletNotFoundException if the vendor has no wallet
     * @throws NegativeBalanceViolationException if a balance would go below zero
     * @throws ConcurrentWalletModificationException if every attempt lost a version check
     */
    public LedgerEntry applyEntry(UUID vendorId, LedgerEntryDraft draft) {
        return post(vendorId, draft, WalletGuard.NONE).getEntry();
    }

    /**
     * Like {@link #applyEntry} but runs {@code guard} against the current wallet before each
     * attempt and returns the resulting wallet alongside the entry.
     */
    public LedgerPosting post(UUID vendorId, LedgerEntryDraft draft, WalletGuard guard) {
        validate(vendorId, draft);
        String previousVendor = MDC.get(MDC_VENDOR_ID);
        MDC.put(MDC_VENDOR_ID, vendorId.toString());
        try {
            return metrics.timePosting(() -> postWithRetry(vendorId, draft, guard));
        } finally {
            if (previousVendor == null) {
                MDC.remove(MDC_VENDOR_ID);
            } else {
                MDC.put(MDC_VENDOR_ID, previousVendor);
            }
        }
    }

    private LedgerPosting postWithRetry(UUID vendorId, LedgerEntryDraft draft, WalletGuard guard) {
        String key = draft.getIdempotencyKey();
        if (key != null) {
            Optional<LedgerPosting> replay = replay(vendorId, key);
            if (replay.isPresent()) {
                return replay.get();
            }
        }

        int maxAttempts = policy.getMaxWalletUpdateAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                LedgerPosting posting = transactions.execute(status -> postOnce(vendorId, draft, guard));
                afterCommit(posting);
                return posting;
            } catch (OptimisticLockingFailureException e) {
                metrics.recordOptimisticConflict();
                if (attempt >= maxAttempts) {
                    log.warn("Giving up on {} entry for vendor {} after {} version conflicts",
                        draft.getTransactionType(), vendorId, attempt);
                    throw new ConcurrentWalletModificationException(vendorId, attempt, e);
                }
                log.warn("Wallet of vendor {} changed concurrently, retrying (attempt {}/{})",
                    vendorId, attempt, maxAttempts);
            } catch (DataIntegrityViolationException e) {
                if (key == null) {
                    throw e;
                }
                // lost the race to another request with the same key
                return replay(vendorId, key).orElseThrow(() -> e);
            } catch (NegativeBalanceViolationException | AccountingIdentityViolationException e) {
                metrics.recordInvariantViolation(e.getClass().getSimpleName());
                log.error("Rejected {} entry for vendor {} (vendorAmount={}): {}",
                    draft.getTransactionType(), vendorId, draft.getVendorAmount(), e.getMessage());
                throw e;
            }
        }
    }

    private LedgerPosting postOnce(UUID vendorId, LedgerEntryDraft draft, WalletGuard guard) {
        VendorWallet wallet = walletStore.findByVendorId(vendorId)
            .orElseThrow(() -> new WalletNotFoundException(vendorId));
        guard.check(wallet);

        Instant now = clock.instant();
        LedgerEntry entry = LedgerEntry.fromDraft(vendorId, draft, now);
        VendorWallet updated = walletStore.update(wallet.apply(entry, now));
        LedgerEntry stored = entryStore.append(entry);

        outboxService.saveEvent(OutboxService.WALLET_AGGREGATE, vendorId,
            LedgerEntryRecordedEvent.EVENT_TYPE, LedgerEntryRecordedEvent.of(stored, updated));
        if (stored.getTransactionType() == TransactionType.PAYOUT) {
            outboxService.saveEvent(OutboxService.WALLET_AGGREGATE, vendorId,
                VendorPayoutProcessedEvent.EVENT_TYPE, VendorPayoutProcessedEvent.of(stored, updated));
        }
        return new LedgerPosting(stored, updated, false);
    }

    private void afterCommit(LedgerPosting posting) {
        LedgerEntry entry = posting.getEntry();
        VendorWallet wallet = posting.getWallet();
        if (entry.getIdempotencyKey() != null) {
            idempotency.remember(entry.getIdempotencyKey(), entry.getId());
        }
        metrics.recordEntryApplied(entry.getTransactionType().name(), entry.getBalanceStatus().name());
        log.info("Applied {} {} entry {} for vendor {}: vendorAmount={}, pending={}, available={}",
            entry.getTransactionType(), entry.getBalanceStatus(), entry.getId(), entry.getVendorId(),
            entry.getVendorAmount(), wallet.getPendingBalance(), wallet.getAvailableBalance());
    }

    private Optional<LedgerPosting> replay(UUID vendorId, String key) {
        return idempotency.findAppliedEntry(key).map(entry -> {
            if (!entry.getVendorId().equals(vendorId)) {
                throw new InvalidLedgerEntryException("idempotencyKey", "already used for another vendor");
            }
            VendorWallet wallet = walletStore.findByVendorId(vendorId)
                .orElseThrow(() -> new WalletNotFoundException(vendorId));
            metrics.recordIdempotentReplay();
            log.info("Idempotency key {} already applied as entry {}, returning it", key, entry.getId());
            return new LedgerPosting(entry, wallet, true);
        });
    }

    private static void validate(UUID vendorId, LedgerEntryDraft draft) {
        if (vendorId == null) {
            throw new InvalidLedgerEntryException("vendorId", "must not be null");
        }
        if (draft == null) {
            throw new InvalidLedgerEntryException("draft", "must not be null");
        }
        if (draft.getTransactionType() == null) {
            throw new InvalidLedgerEntryException("transactionType", "must not be null");
        }
        if (draft.getBalanceStatus() == null) {
            throw new InvalidLedgerEntryException("balanceStatus", "must not be null");
        }
        if (draft.getAmount() == null || draft.getAmount().signum() == 0) {
            throw new InvalidLedgerEntryException("amount", "must not be zero");
        }
        if (draft.getVendorAmount() == null) {
            throw new InvalidLedgerEntryException("vendorAmount", "must not be null");
        }
        requireCents("amount", draft.getAmount());
        requireCents("vendorAmount", draft.getVendorAmount());
        requireCents("commissionAmount", draft.getCommissionAmount());
        requireCents("vatAmount", draft.getVatAmount());

        String description = draft.getDescription();
        if (description == null || description.isBlank()) {
            throw new InvalidLedgerEntryException("description", "must not be blank");
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new InvalidLedgerEntryException("description",
                "must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        String key = draft.getIdempotencyKey();
        if (key != null && (key.isBlank() || key.length() > MAX_IDEMPOTENCY_KEY_LENGTH)) {
            throw new InvalidLedgerEntryException("idempotencyKey",
                "must be 1 to " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }

        if (draft.getTransactionType() == TransactionType.ESCROW_RELEASE) {
            if (draft.getBalanceStatus() != BalanceStatus.AVAILABLE) {
                throw new InvalidLedgerEntryException("balanceStatus", "escrow release must be AVAILABLE");
            }
            if (draft.getVendorAmount().signum() <= 0) {
                throw new InvalidLedgerEntryException("vendorAmount", "escrow release must be positive");
            }
        }
    }

    private static void requireCents(String field, BigDecimal value) {
        if (value != null && value.stripTrailingZeros().scale() > 2) {
            throw new InvalidLedgerEntryException(field, "must have at most 2 decimal places");
        }
    }
}
