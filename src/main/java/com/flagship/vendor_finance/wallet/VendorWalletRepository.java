package com.flagship.vendor_finance.wallet;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface VendorWalletRepository extends JpaRepository<VendorWalletEntity, UUID> {
}
