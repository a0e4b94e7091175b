package com.flagship.vendor_finance.escrow;

import lombok.Value;

import java.time.Instant;

/**
 * Escrow timing for one delivered order.
 *
 * {@code released} and {@code daysRemaining} describe the moment the result was computed.
 * They are never persisted; use {@link #isReleasedAt(Instant)} or recompute through
 * {@link EscrowScheduler} before promoting funds.
 */
@Value
public class EscrowResult {
    Instant deliveryDate;
    Instant releaseDate;
    int holdDays;
    boolean released;
    long daysRemaining;

    public boolean isReleasedAt(Instant now) {
        return !now.isBefore(releaseDate);
    }
}
