package com.flagship.vendor_finance.escrow;

import com.flagship.vendor_finance.config.FinancePolicyProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Computes when funds for a delivered order leave escrow.
 *
 * Release date is delivery plus {@code escrowHoldDays}. Eligibility is evaluated
 * against the injected {@link Clock} on every call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EscrowScheduler {

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final Clock clock;
    private final FinancePolicyProperties policy;

    public EscrowResult computeRelease(Instant deliveryDate) {
        if (deliveryDate == null) {
            throw new IllegalArgumentException("Delivery date cannot be null");
        }
        int holdDays = policy.getEscrowHoldDays();
        Instant releaseDate = deliveryDate.plus(Duration.ofDays(holdDays));
        Instant now = clock.instant();

        boolean released = !now.isBefore(releaseDate);
        long daysRemaining = released ? 0 : ceilDays(Duration.between(now, releaseDate));

        log.debug("Escrow delivered={} release={} released={} daysRemaining={}",
            deliveryDate, releaseDate, released, daysRemaining);
        return new EscrowResult(deliveryDate, releaseDate, holdDays, released, daysRemaining);
    }

    private static long ceilDays(Duration remaining) {
        long millis = remaining.toMillis();
        return (millis + MILLIS_PER_DAY - 1) / MILLIS_PER_DAY;
    }
}
