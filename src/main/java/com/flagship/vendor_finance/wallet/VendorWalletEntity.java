package com.flagship.vendor_finance.wallet;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for vendor wallets.
 *
 * No setters: balances change only through {@link #updateFromDomain(VendorWallet)}.
 * {@code version} is checked on every update, so two writers holding the same
 * version cannot both commit.
 */
@Entity
@Table(name = "vendor_wallets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VendorWalletEntity {

    @Id
    @Column(name = "vendor_id", nullable = false, updatable = false)
    private UUID vendorId;

    @Column(name = "pending_balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal pendingBalance;

    @Column(name = "available_balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal availableBalance;

    @Column(name = "lifetime_earnings", nullable = false, precision = 19, scale = 2)
    private BigDecimal lifetimeEarnings;

    @Column(name = "lifetime_payouts", nullable = false, precision = 19, scale = 2)
    private BigDecimal lifetimePayouts;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    static VendorWalletEntity fromDomain(VendorWallet wallet) {
        return new VendorWalletEntity(
            wallet.getVendorId(),
            wallet.getPendingBalance(),
            wallet.getAvailableBalance(),
            wallet.getLifetimeEarnings(),
            wallet.getLifetimePayouts(),
            wallet.getCreatedAt(),
            wallet.getUpdatedAt(),
            null // assigned by Hibernate on persist
        );
    }

    VendorWallet toDomain() {
        return new VendorWallet(
            vendorId,
            pendingBalance,
            availableBalance,
            lifetimeEarnings,
            lifetimePayouts,
            createdAt,
            updatedAt,
            version
        );
    }

    void updateFromDomain(VendorWallet wallet) {
        this.pendingBalance = wallet.getPendingBalance();
        this.availableBalance = wallet.getAvailableBalance();
        this.lifetimeEarnings = wallet.getLifetimeEarnings();
        this.lifetimePayouts = wallet.getLifetimePayouts();
        this.updatedAt = wallet.getUpdatedAt();
    }
}
