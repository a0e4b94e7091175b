package com.flagship.vendor_finance.pricing;

import com.flagship.vendor_finance.common.Money;
import com.flagship.vendor_finance.config.FinancePolicyProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Prices delivery from actual vs volumetric weight.
 *
 * The fee covers the first {@code includedWeightKg} at {@code baseFee}, then
 * {@code perKgFee} for every additional chargeable kilogram. Part of the fee is absorbed
 * by the platform: the logistics surcharge already collected in bucket C, capped at
 * {@code maxSubsidyShare} of the fee.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ShippingFeeCalculator {

    private final FinancePolicyProperties policy;

    public ShippingFeeResult calculate(ShippingFeeInput input) {
        validate(input);
        FinancePolicyProperties.Shipping shipping = policy.getShipping();

        BigDecimal volume = input.getLengthCm().multiply(input.getWidthCm()).multiply(input.getHeightCm());
        BigDecimal volumetricWeight = Money.round(
            volume.divide(shipping.getVolumetricDivisor(), Money.DIVISION_SCALE, Money.ROUNDING));
        BigDecimal chargeableWeight = input.getActualWeightKg().max(volumetricWeight);

        BigDecimal extraWeight = chargeableWeight.subtract(shipping.getIncludedWeightKg()).max(BigDecimal.ZERO);
        BigDecimal baseFee = Money.round(shipping.getBaseFee());
        BigDecimal extraWeightFee = Money.round(extraWeight.multiply(shipping.getPerKgFee()));
        BigDecimal totalFee = baseFee.add(extraWeightFee);

        BigDecimal minimumCustomerShare = totalFee.multiply(BigDecimal.ONE.subtract(shipping.getMaxSubsidyShare()));
        BigDecimal customerFee = Money.round(totalFee.subtract(policy.getLogisticsSurcharge()).max(minimumCustomerShare));
        BigDecimal subsidy = totalFee.subtract(customerFee);

        log.debug("Shipping chargeable={}kg total={} customer={} subsidy={}",
            chargeableWeight, totalFee, customerFee, subsidy);

        return ShippingFeeResult.builder()
            .actualWeightKg(input.getActualWeightKg())
            .volumetricWeightKg(volumetricWeight)
            .chargeableWeightKg(chargeableWeight)
            .baseFee(baseFee)
            .extraWeightFee(extraWeightFee)
            .totalShippingFee(totalFee)
            .platformSubsidy(subsidy)
            .customerShippingFee(customerFee)
            .build();
    }

    private static void validate(ShippingFeeInput input) {
        if (input == null) {
            throw new InvalidPricingInputException("input", "must not be null");
        }
        if (input.getActualWeightKg() == null || input.getActualWeightKg().signum() < 0) {
            throw new InvalidPricingInputException("actualWeightKg", "must be zero or positive");
        }
        requirePositive("lengthCm", input.getLengthCm());
        requirePositive("widthCm", input.getWidthCm());
        requirePositive("heightCm", input.getHeightCm());
    }

    private static void requirePositive(String field, BigDecimal value) {
        if (!Money.isPositive(value)) {
            throw new InvalidPricingInputException(field, "must be greater than zero");
        }
    }
}
