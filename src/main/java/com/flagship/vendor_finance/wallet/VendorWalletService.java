package com.flagship.vendor_finance.wallet;

import com.flagship.vendor_finance.observability.FinanceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Provisions and reads vendor wallets.
 *
 * A wallet must be provisioned before the first ledger entry for the vendor;
 * ledger postings never create wallets on their own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VendorWalletService {

    private final VendorWalletStore walletStore;
    private final Clock clock;
    private final FinanceMetrics metrics;

    /**
     * Creates an empty wallet for the vendor, or returns the existing one.
     * Safe to call concurrently: the losing insert falls back to reading the winner's wallet.
     */
    public VendorWallet provisionWallet(UUID vendorId) {
        if (vendorId == null) {
            throw new IllegalArgumentException("Vendor ID cannot be null");
        }
        return walletStore.findByVendorId(vendorId).orElseGet(() -> insertNew(vendorId));
    }

    public VendorWallet getWallet(UUID vendorId) {
        return walletStore.findByVendorId(vendorId)
            .orElseThrow(() -> new WalletNotFoundException(vendorId));
    }

    private VendorWallet insertNew(UUID vendorId) {
        try {
            VendorWallet wallet = walletStore.insert(VendorWallet.open(vendorId, clock.instant()));
            metrics.recordWalletProvisioned();
            log.info("Provisioned wallet for vendor {}", vendorId);
            return wallet;
        } catch (DataIntegrityViolationException e) {
            log.debug("Wallet for vendor {} was provisioned concurrently", vendorId);
            return getWallet(vendorId);
        }
    }
}
