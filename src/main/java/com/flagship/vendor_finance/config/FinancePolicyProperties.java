package com.flagship.vendor_finance.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Business policy constants for pricing, escrow and payouts.
 *
 * Every rate and threshold the finance core uses is read from here, never from
 * literals at the call site. Values are bound from {@code finance.policy.*} and can
 * be overridden per deployment through the usual Spring property sources.
 *
 * The field initialisers are the production defaults, so {@code new FinancePolicyProperties()}
 * is a valid policy on its own (tests rely on this).
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "finance.policy")
public class FinancePolicyProperties {

    /** VAT rate applied to vendor and platform buckets. */
    @NotNull
    @DecimalMin("0.00")
    @DecimalMax("1.00")
    private BigDecimal vatRate = new BigDecimal("0.14");

    /** Fee charged on top of a non-legalized vendor's price. */
    @NotNull
    @DecimalMin("0.00")
    @DecimalMax("1.00")
    private BigDecimal cooperativeFeeRate = new BigDecimal("0.05");

    /** Flat logistics surcharge added to every line item. */
    @NotNull
    @DecimalMin("0.00")
    private BigDecimal logisticsSurcharge = new BigDecimal("10");

    @Min(0)
    private int escrowHoldDays = 14;

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal minimumPayoutThreshold = new BigDecimal("500");

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal defaultDeviationThreshold = new BigDecimal("0.20");

    @NotBlank
    private String currency = "EGP";

    /** Step used by friendly price rounding (next multiple of this value). */
    @NotNull
    @DecimalMin("0.01")
    private BigDecimal friendlyPriceStep = new BigDecimal("5");

    /** How many times a wallet mutation is attempted before giving up on version conflicts. */
    @Min(1)
    private int maxWalletUpdateAttempts = 3;

    @Valid
    private Shipping shipping = new Shipping();

    /** Category id to uplift configuration. */
    @Valid
    private Map<String, CategoryRates> categories = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Shipping {

        @NotNull
        @DecimalMin("1")
        private BigDecimal volumetricDivisor = new BigDecimal("5000");

        @NotNull
        @DecimalMin("0.00")
        private BigDecimal baseFee = new BigDecimal("30");

        /** Weight covered by the base fee. */
        @NotNull
        @DecimalMin("0.00")
        private BigDecimal includedWeightKg = BigDecimal.ONE;

        @NotNull
        @DecimalMin("0.00")
        private BigDecimal perKgFee = new BigDecimal("10");

        /** Upper bound on the share of the fee the platform absorbs. */
        @NotNull
        @DecimalMin("0.00")
        @DecimalMax("1.00")
        private BigDecimal maxSubsidyShare = new BigDecimal("0.25");
    }

    @Getter
    @Setter
    public static class CategoryRates {

        @NotNull
        @DecimalMin("0.00")
        private BigDecimal defaultUpliftRate;

        public CategoryRates() {
        }

        public CategoryRates(BigDecimal defaultUpliftRate) {
            this.defaultUpliftRate = defaultUpliftRate;
        }
    }
}
