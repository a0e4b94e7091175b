package com.flagship.vendor_finance;

import com.flagship.vendor_finance.escrow.EscrowReleaseService;
import com.flagship.vendor_finance.ledger.BalanceStatus;
import com.flagship.vendor_finance.ledger.LedgerAccountant;
import com.flagship.vendor_finance.ledger.LedgerEntry;
import com.flagship.vendor_finance.ledger.LedgerEntryDraft;
import com.flagship.vendor_finance.ledger.LedgerEntryFilter;
import com.flagship.vendor_finance.ledger.LedgerQueryService;
import com.flagship.vendor_finance.ledger.TransactionType;
import com.flagship.vendor_finance.ledger.event.LedgerEntryRecordedEvent;
import com.flagship.vendor_finance.ledger.event.VendorPayoutProcessedEvent;
import com.flagship.vendor_finance.outbox.OutboxEvent;
import com.flagship.vendor_finance.outbox.OutboxService;
import com.flagship.vendor_finance.payout.InsufficientBalanceException;
import com.flagship.vendor_finance.payout.PayoutProcessor;
import com.flagship.vendor_finance.wallet.VendorWallet;
import com.flagship.vendor_finance.wallet.VendorWalletService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.Page;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Runs the ledger against PostgreSQL: optimistic locking, unique idempotency keys,
 * the append-only rules and the outbox all come from the real schema here.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class VendorFinanceIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
        .withDatabaseName("vendor_finance_test")
        .withUsername("test")
        .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private VendorWalletService walletService;

    @Autowired
    private LedgerAccountant ledgerAccountant;

    @Autowired
    private PayoutProcessor payoutProcessor;

    @Autowired
    private EscrowReleaseService escrowReleaseService;

    @Autowired
    private LedgerQueryService queryService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    private UUID vendorId;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        vendorId = UUID.randomUUID();
        walletService.provisionWallet(vendorId);
    }

    private LedgerEntry sale(String amount, BalanceStatus status, String key) {
        return ledgerAccountant.applyEntry(vendorId, LedgerEntryDraft.builder()
            .orderId(UUID.randomUUID())
            .transactionType(TransactionType.SALE)
            .balanceStatus(status)
            .amount(new BigDecimal(amount))
            .vendorAmount(new BigDecimal(amount))
            .commissionAmount(new BigDecimal("12.50"))
            .vatAmount(new BigDecimal("3.50"))
            .description("Order sale")
            .idempotencyKey(key)
            .build());
    }

    @Test
    void provisioningTwiceReturnsTheSameWallet() {
        VendorWallet again = walletService.provisionWallet(vendorId);

        assertEquals(vendorId, again.getVendorId());
        assertEquals(0, again.getTotalBalance().signum());
    }

    @Test
    @DisplayName("Sale, escrow release and payout keep the wallet and ledger in step")
    void fullLifecycle() {
        UUID orderId = UUID.randomUUID();
        ledgerAccountant.applyEntry(vendorId, LedgerEntryDraft.builder()
            .orderId(orderId)
            .transactionType(TransactionType.SALE)
            .balanceStatus(BalanceStatus.PENDING)
            .amount(new BigDecimal("800.00"))
            .vendorAmount(new BigDecimal("800.00"))
            .description("Order sale")
            .build());
        escrowReleaseService.releaseIfEligible(vendorId, orderId, new BigDecimal("800.00"),
            Instant.now().minus(Duration.ofDays(15)));
        payoutProcessor.payout(vendorId, new BigDecimal("600"), null);

        VendorWallet wallet = walletService.getWallet(vendorId);
        assertEquals(0, wallet.getPendingBalance().signum());
        assertEquals(0, new BigDecimal("200.00").compareTo(wallet.getAvailableBalance()));
        assertEquals(0, new BigDecimal("800.00").compareTo(wallet.getLifetimeEarnings()));
        assertEquals(0, new BigDecimal("600.00").compareTo(wallet.getLifetimePayouts()));

        Page<LedgerEntry> entries = queryService.findEntries(vendorId, LedgerEntryFilter.none(), 0, 10);
        assertEquals(3, entries.getTotalElements());
        assertEquals(TransactionType.PAYOUT, entries.getContent().get(0).getTransactionType());

        List<OutboxEvent> events = outboxService.eventsForVendor(vendorId);
        assertEquals(List.of(
                LedgerEntryRecordedEvent.EVENT_TYPE,
                LedgerEntryRecordedEvent.EVENT_TYPE,
                LedgerEntryRecordedEvent.EVENT_TYPE,
                VendorPayoutProcessedEvent.EVENT_TYPE),
            events.stream().map(OutboxEvent::getEventType).toList());
    }

    @Test
    void replayedKeyWritesOneEntry() {
        String key = "sale-" + UUID.randomUUID();
        LedgerEntry first = sale("150.00", BalanceStatus.AVAILABLE, key);
        LedgerEntry second = sale("150.00", BalanceStatus.AVAILABLE, key);

        assertEquals(first.getId(), second.getId());
        assertEquals(0, new BigDecimal("150.00").compareTo(walletService.getWallet(vendorId).getAvailableBalance()));
        assertEquals(1, queryService.findEntries(vendorId, null, 0, 10).getTotalElements());
    }

    @Test
    @DisplayName("Ledger rows cannot be changed or removed")
    void ledgerIsAppendOnly() {
        LedgerEntry entry = sale("90.00", BalanceStatus.AVAILABLE, null);

        int deleted = jdbcTemplate.update("DELETE FROM ledger_entries WHERE id = ?", entry.getId());
        int updated = jdbcTemplate.update("UPDATE ledger_entries SET amount = 1 WHERE id = ?", entry.getId());

        assertEquals(0, deleted);
        assertEquals(0, updated);
        assertEquals(0, new BigDecimal("90.00").compareTo(queryService.findEntry(entry.getId()).orElseThrow().getAmount()));
    }

    @Test
    @DisplayName("Concurrent payouts cannot overdraw the wallet")
    void concurrentPayouts() throws Exception {
        sale("900.00", BalanceStatus.AVAILABLE, null);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger rejected = new AtomicInteger();
        try {
            List<Future<Boolean>> results = List.of(
                executor.submit(() -> payOut(start, rejected)),
                executor.submit(() -> payOut(start, rejected)));
            start.countDown();

            int succeeded = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    succeeded++;
                }
            }
            assertEquals(1, succeeded);
            assertEquals(1, rejected.get());
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, new BigDecimal("300.00").compareTo(walletService.getWallet(vendorId).getAvailableBalance()));
    }

    @Test
    @DisplayName("Postings inside a caller's transaction retry and commit on their own")
    void postingInsideCallerTransaction() {
        TransactionTemplate callerTransaction = new TransactionTemplate(transactionManager);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            callerTransaction.executeWithoutResult(status -> {
                // loads the wallet into the caller's persistence context
                walletService.getWallet(vendorId);
                try {
                    executor.submit(() -> sale("100.00", BalanceStatus.AVAILABLE, null)).get(30, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
                sale("50.00", BalanceStatus.AVAILABLE, null);
                status.setRollbackOnly();
            });
        } finally {
            executor.shutdownNow();
        }

        VendorWallet wallet = walletService.getWallet(vendorId);
        assertEquals(0, new BigDecimal("150.00").compareTo(wallet.getAvailableBalance()));
        assertEquals(2, queryService.findEntries(vendorId, null, 0, 10).getTotalElements());
    }

    private boolean payOut(CountDownLatch start, AtomicInteger rejected) throws InterruptedException {
        start.await();
        try {
            payoutProcessor.payout(vendorId, new BigDecimal("600"), "concurrent");
            return true;
        } catch (InsufficientBalanceException e) {
            rejected.incrementAndGet();
            return false;
        }
    }
}
