package com.flagship.vendor_finance.payout;

import com.flagship.vendor_finance.config.FinancePolicyProperties;
import com.flagship.vendor_finance.ledger.BalanceStatus;
import com.flagship.vendor_finance.ledger.LedgerAccountant;
import com.flagship.vendor_finance.ledger.LedgerEntry;
import com.flagship.vendor_finance.ledger.LedgerEntryDraft;
import com.flagship.vendor_finance.ledger.LedgerPosting;
import com.flagship.vendor_finance.ledger.TransactionType;
import com.flagship.vendor_finance.ledger.WalletGuard;
import com.flagship.vendor_finance.observability.FinanceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Withdraws available funds from a vendor wallet.
 *
 * Checks, in order: amount is positive, amount reaches the minimum payout threshold,
 * amount fits in the available balance. The balance check runs inside each posting
 * attempt against the freshly loaded wallet, so two concurrent payouts can never both
 * spend the same funds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutProcessor {

    private final LedgerAccountant ledgerAccountant;
    private final FinancePolicyProperties policy;
    private final FinanceMetrics metrics;

    public LedgerEntry payout(UUID vendorId, BigDecimal amount, String note) {
        return payout(vendorId, amount, note, null);
    }

    /**
     * Pays out {@code amount} and returns the WITHDRAWN ledger entry ({@code amount} negated).
     *
     * @param note description for the entry, defaults to "Vendor payout of ..."
     * @param idempotencyKey optional; a repeated key returns the original payout
     * @throws InvalidPayoutAmountException if amount is missing, zero or negative
     * @throws BelowMinimumThresholdException if amount is below the configured minimum
     * @throws InsufficientBalanceException if the wallet cannot cover the amount
     */
    public LedgerEntry payout(UUID vendorId, BigDecimal amount, String note, String idempotencyKey) {
        if (vendorId == null) {
            throw new IllegalArgumentException("Vendor ID cannot be null");
        }
        if (amount == null || amount.signum() <= 0) {
            metrics.recordPayout("invalid_amount");
            throw new InvalidPayoutAmountException(amount);
        }
        BigDecimal minimum = policy.getMinimumPayoutThreshold();
        if (amount.compareTo(minimum) < 0) {
            metrics.recordPayout("below_minimum");
            log.warn("Payout of {} for vendor {} rejected: below minimum {}", amount, vendorId, minimum);
            throw new BelowMinimumThresholdException(amount, minimum);
        }

        LedgerEntryDraft draft = LedgerEntryDraft.builder()
            .transactionType(TransactionType.PAYOUT)
            .balanceStatus(BalanceStatus.WITHDRAWN)
            .amount(amount.negate())
            .vendorAmount(amount.negate())
            .description(describe(amount, note))
            .idempotencyKey(idempotencyKey)
            .build();

        WalletGuard sufficientFunds = wallet -> {
            if (wallet.getAvailableBalance().compareTo(amount) < 0) {
                throw new InsufficientBalanceException(vendorId, amount, wallet.getAvailableBalance());
            }
        };

        try {
            LedgerPosting posting = metrics.timePayout(() -> ledgerAccountant.post(vendorId, draft, sufficientFunds));
            metrics.recordPayout(posting.isReplayed() ? "replayed" : "success");
            log.info("Paid out {} to vendor {}, available balance now {}",
                amount, vendorId, posting.getWallet().getAvailableBalance());
            return posting.getEntry();
        } catch (InsufficientBalanceException e) {
            metrics.recordPayout("insufficient_balance");
            log.warn("Payout of {} for vendor {} rejected: only {} available",
                amount, vendorId, e.getAvailableBalance());
            throw e;
        }
    }

    private String describe(BigDecimal amount, String note) {
        if (note != null && !note.isBlank()) {
            return note.trim();
        }
        return String.format("Vendor payout of %s %s", amount.toPlainString(), policy.getCurrency());
    }
}
