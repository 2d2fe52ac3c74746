package org.evgrid.catalog;

import lombok.Builder;
import lombok.Value;
import org.evgrid.core.StationCoreException;

/**
 * Published pricing of a station.
 *
 * <p>Prices are in the catalog's currency (HUF in the reference data set) and
 * non-negative when present. The {@link #model()} is derived, never stored.</p>
 */
@Value
@Builder(buildMethodName = "buildUnchecked")
public class Pricing {
    boolean free;
    boolean paidUnspecified;
    /** AC price per kWh, or null. */
    Double acPricePerKwh;
    /** DC price per kWh, or null. */
    Double dcPricePerKwh;
    /** Time-based price per minute, or null. */
    Double pricePerMinute;
    String additionalFees;
    /** Raw usage-cost text as published by the operator. */
    String usageCost;

    /**
     * Pricing scheme, evaluated in order: AC only, minute only, both, free flag, otherwise unknown.
     */
    public PricingModel model() {
        if (acPricePerKwh != null && pricePerMinute == null) {
            return PricingModel.PER_KWH;
        }
        if (pricePerMinute != null && acPricePerKwh == null) {
            return PricingModel.PER_MINUTE;
        }
        if (acPricePerKwh != null) {
            return PricingModel.HYBRID;
        }
        if (free) {
            return PricingModel.FREE;
        }
        return PricingModel.UNKNOWN;
    }

    public boolean hasAcPrice() {
        return acPricePerKwh != null;
    }

    public boolean hasUsageCost() {
        return usageCost != null;
    }

    public static Pricing unspecified() {
        return Pricing.builder().buildUnchecked();
    }

    public static Pricing freeOfCharge() {
        return Pricing.builder().free(true).buildUnchecked();
    }

    public static Pricing perKwh(double acPrice) {
        return Pricing.builder().acPricePerKwh(acPrice).build();
    }

    /**
     * Builder with validation on {@link PricingBuilder#build()}.
     */
    public static class PricingBuilder {
        /**
         * Builds and validates the pricing.
         *
         * @throws StationCoreException with {@code MALFORMED_RECORD} on a negative or
         *                              non-finite price, or an impossible flag combination.
         */
        public Pricing build() {
            Pricing pricing = buildUnchecked();
            pricing.validate();
            return pricing;
        }
    }

    void validate() {
        requirePrice("acPricePerKwh", acPricePerKwh);
        requirePrice("dcPricePerKwh", dcPricePerKwh);
        requirePrice("pricePerMinute", pricePerMinute);
        if (free && paidUnspecified) {
            throw malformed("station cannot be both free and paid-unspecified");
        }
        if (free && (isPositive(acPricePerKwh) || isPositive(dcPricePerKwh) || isPositive(pricePerMinute))) {
            throw malformed("free station cannot publish a positive price");
        }
    }

    private static void requirePrice(String field, Double value) {
        if (value == null) {
            return;
        }
        if (!Double.isFinite(value) || value < 0.0d) {
            throw malformed(field + " must be finite and >= 0, got " + value);
        }
    }

    private static boolean isPositive(Double value) {
        return value != null && value > 0.0d;
    }

    private static StationCoreException malformed(String message) {
        return new StationCoreException(StationCoreException.REASON_MALFORMED_RECORD, message);
    }
}
