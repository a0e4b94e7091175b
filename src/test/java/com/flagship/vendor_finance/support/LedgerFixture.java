package com.flagship.vendor_finance.support;

import com.flagship.vendor_finance.config.FinancePolicyProperties;
import com.flagship.vendor_finance.ledger.LedgerAccountant;
import com.flagship.vendor_finance.ledger.LedgerIdempotencyService;
import com.flagship.vendor_finance.observability.FinanceMetrics;
import com.flagship.vendor_finance.outbox.OutboxService;
import com.flagship.vendor_finance.wallet.VendorWallet;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.Mockito.mock;

/**
 * Wires a {@link LedgerAccountant} over in-memory stores, a fixed clock and a mocked outbox.
 */
public class LedgerFixture {

    public static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    public final FinancePolicyProperties policy = new FinancePolicyProperties();
    public final InMemoryVendorWalletStore walletStore = new InMemoryVendorWalletStore();
    public final InMemoryLedgerEntryStore entryStore = new InMemoryLedgerEntryStore();
    public final OutboxService outboxService = mock(OutboxService.class);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final FinanceMetrics metrics = new FinanceMetrics(meterRegistry);
    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    public final LedgerIdempotencyService idempotency = new LedgerIdempotencyService(entryStore, Optional.empty());
    public final LedgerAccountant accountant = new LedgerAccountant(walletStore, entryStore, idempotency,
        outboxService, TransactionOperations.withoutTransaction(), metrics, policy, clock);

    public VendorWallet openWallet(UUID vendorId) {
        return walletStore.insert(VendorWallet.open(vendorId, NOW));
    }

    public VendorWallet wallet(UUID vendorId) {
        return walletStore.findByVendorId(vendorId).orElseThrow();
    }

    public double counter(String name, String... tags) {
        var counter = meterRegistry.find(name).tags(tags).counter();
        return counter == null ? 0 : counter.count();
    }
}
