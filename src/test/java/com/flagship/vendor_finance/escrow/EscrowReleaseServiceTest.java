package com.flagship.vendor_finance.escrow;

import com.flagship.vendor_finance.ledger.BalanceStatus;
import com.flagship.vendor_finance.ledger.LedgerEntryDraft;
import com.flagship.vendor_finance.ledger.LedgerPosting;
import com.flagship.vendor_finance.ledger.TransactionType;
import com.flagship.vendor_finance.support.LedgerFixture;
import com.flagship.vendor_finance.wallet.VendorWallet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EscrowReleaseServiceTest {

    private LedgerFixture fixture;
    private EscrowReleaseService service;
    private UUID vendorId;
    private UUID orderId;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        service = new EscrowReleaseService(new EscrowScheduler(fixture.clock, fixture.policy),
            fixture.accountant, fixture.entryStore, fixture.metrics);
        vendorId = UUID.randomUUID();
        orderId = UUID.randomUUID();
        fixture.openWallet(vendorId);
        pendingSale(orderId, "250");
    }

    private void pendingSale(UUID order, String amount) {
        fixture.accountant.applyEntry(vendorId, LedgerEntryDraft.builder()
            .orderId(order)
            .transactionType(TransactionType.SALE)
            .balanceStatus(BalanceStatus.PENDING)
            .amount(new BigDecimal(amount))
            .vendorAmount(new BigDecimal(amount))
            .description("sale held in escrow")
            .build());
    }

    private static Instant daysAgo(long days) {
        return LedgerFixture.NOW.minus(Duration.ofDays(days));
    }

    @Test
    @DisplayName("Funds stay pending while the hold is running")
    void keepsFundsOnHold() {
        Optional<LedgerPosting> result = service.releaseIfEligible(vendorId, orderId, new BigDecimal("250"), daysAgo(13));

        assertTrue(result.isEmpty());
        assertEquals(0, new BigDecimal("250").compareTo(fixture.wallet(vendorId).getPendingBalance()));
    }

    @Test
    @DisplayName("After 14 days the funds move to available")
    void releasesAfterHold() {
        LedgerPosting posting = service.releaseIfEligible(vendorId, orderId, new BigDecimal("250"), daysAgo(14))
            .orElseThrow();

        assertEquals(TransactionType.ESCROW_RELEASE, posting.getEntry().getTransactionType());
        assertEquals(orderId, posting.getEntry().getOrderId());
        assertEquals("escrow-release:" + orderId, posting.getEntry().getIdempotencyKey());
        VendorWallet wallet = fixture.wallet(vendorId);
        assertEquals(0, wallet.getPendingBalance().signum());
        assertEquals(0, new BigDecimal("250").compareTo(wallet.getAvailableBalance()));
        assertEquals(0, new BigDecimal("250").compareTo(wallet.getLifetimeEarnings()));
        assertEquals(1.0, fixture.counter("escrow.releases"));
    }

    @Test
    void releasesAnOrderOnlyOnce() {
        service.releaseIfEligible(vendorId, orderId, new BigDecimal("250"), daysAgo(20));
        LedgerPosting again = service.releaseIfEligible(vendorId, orderId, new BigDecimal("250"), daysAgo(20))
            .orElseThrow();

        assertTrue(again.isReplayed());
        assertEquals(0, new BigDecimal("250").compareTo(fixture.wallet(vendorId).getAvailableBalance()));
        assertEquals(1.0, fixture.counter("escrow.releases"));
    }

    @Nested
    @DisplayName("Release is limited to the order's own escrow")
    class OrderScope {

        @Test
        void cannotReleaseMoreThanTheOrderHolds() {
            EscrowAmountExceededException e = assertThrows(EscrowAmountExceededException.class,
                () -> service.releaseIfEligible(vendorId, orderId, new BigDecimal("300"), daysAgo(15)));

            assertEquals(0, new BigDecimal("250").compareTo(e.getHeldAmount()));
            assertEquals(0, new BigDecimal("250").compareTo(fixture.wallet(vendorId).getPendingBalance()));
        }

        @Test
        @DisplayName("A matured order cannot pull a newer order's held funds")
        void doesNotTouchOtherOrders() {
            pendingSale(UUID.randomUUID(), "900");

            assertThrows(EscrowAmountExceededException.class,
                () -> service.releaseIfEligible(vendorId, orderId, new BigDecimal("1000"), daysAgo(15)));

            VendorWallet wallet = fixture.wallet(vendorId);
            assertEquals(0, new BigDecimal("1150").compareTo(wallet.getPendingBalance()));
            assertEquals(0, wallet.getAvailableBalance().signum());
        }

        @Test
        void orderWithoutSalesReleasesNothing() {
            pendingSale(UUID.randomUUID(), "900");

            assertThrows(EscrowAmountExceededException.class,
                () -> service.releaseIfEligible(vendorId, UUID.randomUUID(), new BigDecimal("150"), daysAgo(15)));
            assertEquals(0, fixture.wallet(vendorId).getAvailableBalance().signum());
        }

        @Test
        void reversalsReduceWhatCanBeReleased() {
            fixture.accountant.applyEntry(vendorId, LedgerEntryDraft.builder()
                .orderId(orderId)
                .transactionType(TransactionType.REFUND)
                .balanceStatus(BalanceStatus.PENDING)
                .amount(new BigDecimal("-100"))
                .vendorAmount(new BigDecimal("-100"))
                .description("partial refund")
                .build());

            assertThrows(EscrowAmountExceededException.class,
                () -> service.releaseIfEligible(vendorId, orderId, new BigDecimal("250"), daysAgo(15)));
            assertTrue(service.releaseIfEligible(vendorId, orderId, new BigDecimal("150"), daysAgo(15)).isPresent());
            assertEquals(0, fixture.wallet(vendorId).getPendingBalance().signum());
        }

        @Test
        void salesOfOtherVendorsDoNotCount() {
            UUID otherVendor = UUID.randomUUID();
            fixture.openWallet(otherVendor);
            fixture.accountant.applyEntry(otherVendor, LedgerEntryDraft.builder()
                .orderId(orderId)
                .transactionType(TransactionType.SALE)
                .balanceStatus(BalanceStatus.PENDING)
                .amount(new BigDecimal("500"))
                .vendorAmount(new BigDecimal("500"))
                .description("same order, other vendor")
                .build());

            assertThrows(EscrowAmountExceededException.class,
                () -> service.releaseIfEligible(vendorId, orderId, new BigDecimal("400"), daysAgo(15)));
        }
    }
}
