package com.flagship.vendor_finance.wallet;

import com.flagship.vendor_finance.common.ErrorCategory;
import com.flagship.vendor_finance.support.LedgerFixture;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class VendorWalletServiceTest {

    private final LedgerFixture fixture = new LedgerFixture();
    private final VendorWalletService service =
        new VendorWalletService(fixture.walletStore, fixture.clock, fixture.metrics);

    @Test
    void provisionsEmptyWallet() {
        UUID vendorId = UUID.randomUUID();

        VendorWallet wallet = service.provisionWallet(vendorId);

        assertEquals(vendorId, wallet.getVendorId());
        assertEquals(0L, wallet.getVersion());
        assertEquals(0, wallet.getTotalBalance().signum());
        assertEquals(1.0, fixture.counter("wallets.provisioned"));
    }

    @Test
    void provisioningTwiceReturnsTheSameWallet() {
        UUID vendorId = UUID.randomUUID();
        VendorWallet first = service.provisionWallet(vendorId);

        VendorWallet second = service.provisionWallet(vendorId);

        assertEquals(first, second);
        assertEquals(1.0, fixture.counter("wallets.provisioned"));
    }

    @Test
    void getWalletFailsForUnknownVendor() {
        UUID vendorId = UUID.randomUUID();

        WalletNotFoundException ex = assertThrows(WalletNotFoundException.class, () -> service.getWallet(vendorId));
        assertEquals(vendorId, ex.getVendorId());
        assertEquals(ErrorCategory.NOT_FOUND, ex.getCategory());
    }
}
