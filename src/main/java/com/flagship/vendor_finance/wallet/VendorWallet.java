package com.flagship.vendor_finance.wallet;

import com.flagship.vendor_finance.common.Money;
import com.flagship.vendor_finance.ledger.LedgerEntry;
import com.flagship.vendor_finance.ledger.TransactionType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A vendor's running balances.
 *
 * Invariants, checked after every applied entry:
 * <ul>
 *   <li>{@code pendingBalance >= 0} and {@code availableBalance >= 0}</li>
 *   <li>{@code lifetimeEarnings - lifetimePayouts == pendingBalance + availableBalance}</li>
 * </ul>
 *
 * Immutable: {@link #apply} returns a new wallet and leaves this one untouched.
 * {@code version} is the optimistic concurrency token, {@code null} until first stored.
 */
@Value
public class VendorWallet {
    UUID vendorId;
    BigDecimal pendingBalance;
    BigDecimal availableBalance;
    BigDecimal lifetimeEarnings;
    BigDecimal lifetimePayouts;
    Instant createdAt;
    Instant updatedAt;
    Long version;

    /**
     * Creates an empty wallet for a vendor.
     */
    public static VendorWallet open(UUID vendorId, Instant now) {
        if (vendorId == null) {
            throw new IllegalArgumentException("Vendor ID cannot be null");
        }
        return new VendorWallet(vendorId, Money.ZERO, Money.ZERO, Money.ZERO, Money.ZERO, now, now, null);
    }

    public BigDecimal getTotalBalance() {
        return pendingBalance.add(availableBalance);
    }

    /**
     * Applies a ledger entry according to its balance status.
     *
     * <pre>
     * PENDING         pending   += vendorAmount, earnings += vendorAmount
     * AVAILABLE       available += vendorAmount, earnings += vendorAmount
     * WITHDRAWN       available -= |vendorAmount|, payouts += |vendorAmount|
     * ESCROW_RELEASE  pending   -= vendorAmount, available += vendorAmount
     * </pre>
     *
     * A negative vendor amount on a PENDING or AVAILABLE entry is a reversal and lowers
     * lifetime earnings by the same amount.
     *
     * @throws NegativeBalanceViolationException if either balance would drop below zero
     * @throws AccountingIdentityViolationException if the identity no longer holds
     */
    public VendorWallet apply(LedgerEntry entry, Instant now) {
        BigDecimal vendorAmount = entry.getVendorAmount();
        BigDecimal pending = pendingBalance;
        BigDecimal available = availableBalance;
        BigDecimal earnings = lifetimeEarnings;
        BigDecimal payouts = lifetimePayouts;

        if (entry.getTransactionType() == TransactionType.ESCROW_RELEASE) {
            pending = pending.subtract(vendorAmount);
            available = available.add(vendorAmount);
        } else {
            switch (entry.getBalanceStatus()) {
                case PENDING:
                    pending = pending.add(vendorAmount);
                    earnings = earnings.add(vendorAmount);
                    break;
                case AVAILABLE:
                    available = available.add(vendorAmount);
                    earnings = earnings.add(vendorAmount);
                    break;
                case WITHDRAWN:
                    available = available.subtract(vendorAmount.abs());
                    payouts = payouts.add(vendorAmount.abs());
                    break;
                default:
                    throw new IllegalStateException("Unhandled balance status: " + entry.getBalanceStatus());
            }
        }

        if (pending.signum() < 0) {
            throw new NegativeBalanceViolationException(vendorId, "pendingBalance", pendingBalance, pending);
        }
        if (available.signum() < 0) {
            throw new NegativeBalanceViolationException(vendorId, "availableBalance", availableBalance, available);
        }
        VendorWallet updated = new VendorWallet(vendorId, pending, available, earnings, payouts, createdAt, now, version);
        updated.verifyIdentity();
        return updated;
    }

    /**
     * @throws AccountingIdentityViolationException if earnings minus payouts differ from the balances
     */
    public void verifyIdentity() {
        BigDecimal net = lifetimeEarnings.subtract(lifetimePayouts);
        BigDecimal held = getTotalBalance();
        if (net.compareTo(held) != 0) {
            throw new AccountingIdentityViolationException(vendorId, net, held);
        }
    }
}
