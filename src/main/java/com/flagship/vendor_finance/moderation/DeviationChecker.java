package com.flagship.vendor_finance.moderation;

import com.flagship.vendor_finance.common.Money;
import com.flagship.vendor_finance.config.FinancePolicyProperties;
import com.flagship.vendor_finance.pricing.InvalidPricingInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Flags listing prices that stray too far from the category average.
 *
 * {@code deviation = |price - benchmark| / benchmark}, flagged when strictly greater
 * than the threshold. The comparison uses the unrounded deviation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeviationChecker {

    private static final int DEVIATION_SCALE = 4;

    private final FinancePolicyProperties policy;

    public PriceDeviationResult check(BigDecimal price, BigDecimal benchmark) {
        return check(price, benchmark, policy.getDefaultDeviationThreshold());
    }

    public PriceDeviationResult check(BigDecimal price, BigDecimal benchmark, BigDecimal threshold) {
        if (benchmark == null || benchmark.signum() <= 0) {
            throw new InvalidBenchmarkException(benchmark);
        }
        if (price == null || price.signum() < 0) {
            throw new InvalidPricingInputException("price", "must be zero or positive");
        }
        if (threshold == null || threshold.signum() < 0) {
            throw new InvalidPricingInputException("threshold", "must be zero or positive");
        }

        BigDecimal difference = price.subtract(benchmark);
        BigDecimal deviation = difference.abs().divide(benchmark, Money.DIVISION_SCALE, Money.ROUNDING);
        boolean flagged = deviation.compareTo(threshold) > 0;

        DeviationDirection direction = DeviationDirection.WITHIN;
        if (flagged) {
            direction = difference.signum() > 0 ? DeviationDirection.ABOVE : DeviationDirection.BELOW;
        }

        if (flagged) {
            log.debug("Price {} deviates {} from benchmark {} ({})", price, deviation, benchmark, direction);
        }
        return new PriceDeviationResult(price, benchmark,
            deviation.setScale(DEVIATION_SCALE, RoundingMode.HALF_UP), threshold, flagged, direction);
    }
}
