package com.flagship.vendor_finance.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Micrometer meters for wallet mutations.
 *
 * <ul>
 *   <li>{@code ledger.entries.applied} by type and status</li>
 *   <li>{@code ledger.idempotent.replays}</li>
 *   <li>{@code ledger.optimistic.conflicts}</li>
 *   <li>{@code ledger.invariant.violations} by exception</li>
 *   <li>{@code payouts} by outcome</li>
 *   <li>{@code escrow.releases}</li>
 *   <li>{@code wallets.provisioned}</li>
 *   <li>{@code ledger.posting.duration}, {@code payout.duration}</li>
 * </ul>
 */
@Component
public class FinanceMetrics {

    private final MeterRegistry registry;
    private final Timer postingTimer;
    private final Timer payoutTimer;

    public FinanceMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.postingTimer = Timer.builder("ledger.posting.duration")
            .description("Time to apply one ledger entry, retries included")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
        this.payoutTimer = Timer.builder("payout.duration")
            .description("Time to validate and execute a payout")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    public void recordEntryApplied(String transactionType, String balanceStatus) {
        registry.counter("ledger.entries.applied",
            "type", sanitizeTag(transactionType),
            "status", sanitizeTag(balanceStatus)
        ).increment();
    }

    public void recordIdempotentReplay() {
        registry.counter("ledger.idempotent.replays").increment();
    }

    public void recordOptimisticConflict() {
        registry.counter("ledger.optimistic.conflicts").increment();
    }

    public void recordInvariantViolation(String violation) {
        registry.counter("ledger.invariant.violations", "violation", sanitizeTag(violation)).increment();
    }

    public void recordPayout(String outcome) {
        registry.counter("payouts", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordEscrowRelease() {
        registry.counter("escrow.releases").increment();
    }

    public void recordWalletProvisioned() {
        registry.counter("wallets.provisioned").increment();
    }

    public <T> T timePosting(Supplier<T> operation) {
        return postingTimer.record(operation);
    }

    public <T> T timePayout(Supplier<T> operation) {
        return payoutTimer.record(operation);
    }

    // keeps tag cardinality bounded
    private static String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
