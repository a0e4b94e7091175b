package com.flagship.vendor_finance.wallet;

import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for vendor wallets.
 */
public interface VendorWalletStore {

    Optional<VendorWallet> findByVendorId(UUID vendorId);

    /**
     * Stores a new wallet.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if the vendor already has one
     */
    VendorWallet insert(VendorWallet wallet);

    /**
     * Writes new balances if the stored version still equals {@code wallet.getVersion()}.
     *
     * @return the stored wallet carrying its new version
     * @throws org.springframework.dao.OptimisticLockingFailureException if another writer got there first
     * @throws WalletNotFoundException if the wallet does not exist
     */
    VendorWallet update(VendorWallet wallet);
}
