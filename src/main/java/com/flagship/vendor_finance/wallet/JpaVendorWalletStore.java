package com.flagship.vendor_finance.wallet;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link VendorWalletStore} on top of Spring Data JPA.
 *
 * {@link #update} flushes immediately so a stale version surfaces inside the caller's
 * retry loop rather than at commit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaVendorWalletStore implements VendorWalletStore {

    private final VendorWalletRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<VendorWallet> findByVendorId(UUID vendorId) {
        return repository.findById(vendorId).map(VendorWalletEntity::toDomain);
    }

    @Override
    @Transactional
    public VendorWallet insert(VendorWallet wallet) {
        VendorWalletEntity saved = repository.saveAndFlush(VendorWalletEntity.fromDomain(wallet));
        log.debug("Inserted wallet for vendor {}", saved.getVendorId());
        return saved.toDomain();
    }

    @Override
    @Transactional
    public VendorWallet update(VendorWallet wallet) {
        VendorWalletEntity existing = repository.findById(wallet.getVendorId())
            .orElseThrow(() -> new WalletNotFoundException(wallet.getVendorId()));

        if (!Objects.equals(existing.getVersion(), wallet.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(VendorWalletEntity.class, wallet.getVendorId());
        }

        existing.updateFromDomain(wallet);
        VendorWalletEntity saved = repository.saveAndFlush(existing);
        log.debug("Updated wallet for vendor {} to version {}", saved.getVendorId(), saved.getVersion());
        return saved.toDomain();
    }
}
