package com.flagship.vendor_finance.pricing;

import com.flagship.vendor_finance.common.Money;
import com.flagship.vendor_finance.config.FinancePolicyProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns a vendor's quoted price into a customer-facing price split into four buckets.
 *
 * Uplift is always additive: nothing is ever deducted from the vendor's quoted price.
 * The cooperative fee of a non-legalized vendor is billed on top and counted as
 * platform revenue, so the vendor net payout is {@code A + B}.
 *
 * Rounding (HALF_UP, 2 places) is applied when a bucket is formed, not on the
 * components feeding it. Component amounts in the breakdown are rounded for display only.
 *
 * Stateless and thread-safe.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PricingCalculator {

    private final FinancePolicyProperties policy;
    private final CategoryLookup categoryLookup;

    /**
     * Prices a single line item.
     *
     * @throws InvalidPricingInputException if the base price is not positive, the category
     *         is unknown or the uplift descriptor is malformed
     */
    public PricingBreakdown calculate(PricingInput input) {
        BigDecimal commissionRate = validateAndResolveRate(input);
        BigDecimal vatRate = policy.getVatRate();
        BigDecimal basePrice = input.getVendorBasePrice();

        BigDecimal cooperativeFee = input.isVendorLegalized()
            ? BigDecimal.ZERO
            : basePrice.multiply(policy.getCooperativeFeeRate());
        BigDecimal parentUplift = parentUpliftAmount(basePrice, input.getParentUplift());
        BigDecimal marketplaceUplift = basePrice.add(parentUplift).multiply(commissionRate);
        BigDecimal logisticsSurcharge = policy.getLogisticsSurcharge();

        BigDecimal vendorRevenue = Money.round(basePrice.add(parentUplift));
        BigDecimal vendorVat = input.isVendorVatRegistered()
            ? Money.round(vendorRevenue.multiply(vatRate))
            : Money.ZERO;
        BigDecimal platformRevenue = Money.round(cooperativeFee.add(marketplaceUplift).add(logisticsSurcharge));
        BigDecimal platformVat = Money.round(platformRevenue.multiply(vatRate));

        BigDecimal finalPrice = vendorRevenue.add(vendorVat).add(platformRevenue).add(platformVat);

        PricingBreakdown breakdown = PricingBreakdown.builder()
            .vendorBasePrice(Money.round(basePrice))
            .cooperativeFee(Money.round(cooperativeFee))
            .parentUpliftAmount(Money.round(parentUplift))
            .marketplaceUplift(Money.round(marketplaceUplift))
            .logisticsSurcharge(Money.round(logisticsSurcharge))
            .vendorRevenue(vendorRevenue)
            .vendorVat(vendorVat)
            .platformRevenue(platformRevenue)
            .platformVat(platformVat)
            .finalPrice(finalPrice)
            .vendorNetPayout(vendorRevenue.add(vendorVat))
            .commissionRate(commissionRate)
            .vatRate(vatRate)
            .totalVat(vendorVat.add(platformVat))
            .platformMargin(platformRevenue)
            .marginPercent(Money.percentOf(platformRevenue, finalPrice))
            .build();

        log.debug("Priced category={} base={} final={} (A={}, B={}, C={}, D={})",
            input.getCategoryId(), basePrice, finalPrice,
            vendorRevenue, vendorVat, platformRevenue, platformVat);
        return breakdown;
    }

    /**
     * Rounds a price up to the next multiple of the configured friendly step.
     * Prices already on a step are returned unchanged (at scale 2).
     */
    public BigDecimal roundToFriendlyPrice(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new InvalidPricingInputException("price", "must be zero or positive");
        }
        BigDecimal step = policy.getFriendlyPriceStep();
        BigDecimal steps = price.divide(step, 0, RoundingMode.CEILING);
        return Money.round(steps.multiply(step));
    }

    private BigDecimal validateAndResolveRate(PricingInput input) {
        if (input == null) {
            throw new InvalidPricingInputException("input", "must not be null");
        }
        if (!Money.isPositive(input.getVendorBasePrice())) {
            throw new InvalidPricingInputException("vendorBasePrice", "must be greater than zero");
        }
        if (input.getCategoryId() == null || input.getCategoryId().isBlank()) {
            throw new InvalidPricingInputException("categoryId", "must not be blank");
        }
        Category category = categoryLookup.findById(input.getCategoryId())
            .orElseThrow(() -> new InvalidPricingInputException("categoryId",
                "unknown category " + input.getCategoryId()));

        ParentUplift uplift = input.getParentUplift();
        if (uplift != null) {
            if (uplift.getKind() == null) {
                throw new InvalidPricingInputException("parentUplift.kind", "must not be null");
            }
            if (uplift.getValue() == null || uplift.getValue().signum() < 0) {
                throw new InvalidPricingInputException("parentUplift.value", "must be zero or positive");
            }
        }

        if (input.getUpliftOverride() != null) {
            if (input.getUpliftOverride().signum() < 0) {
                throw new InvalidPricingInputException("upliftOverride", "must be zero or positive");
            }
            return input.getUpliftOverride();
        }
        if (category.getDefaultUpliftRate() == null) {
            throw new InvalidPricingInputException("categoryId",
                "category " + category.getId() + " has no default uplift rate");
        }
        return category.getDefaultUpliftRate();
    }

    private static BigDecimal parentUpliftAmount(BigDecimal basePrice, ParentUplift uplift) {
        if (uplift == null) {
            return BigDecimal.ZERO;
        }
        switch (uplift.getKind()) {
            case FIXED_AMOUNT:
                return uplift.getValue();
            case PERCENTAGE:
                return basePrice.multiply(uplift.getValue());
            default:
                throw new IllegalStateException("Unhandled uplift kind: " + uplift.getKind());
        }
    }
}
