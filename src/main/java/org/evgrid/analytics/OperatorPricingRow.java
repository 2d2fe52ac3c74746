package org.evgrid.analytics;

import lombok.Builder;
import lombok.Value;

/**
 * Pricing strategy mix of one operator, over its operational stations.
 */
@Value
@Builder
public class OperatorPricingRow {
    String operator;
    long totalStations;
    double kwhModelPercent;
    double minuteModelPercent;
    double freeModelPercent;
    /** 0 decimals; null when the operator publishes no AC price. */
    Double averageKwhPrice;
    /** Sample standard deviation of AC price, 1 decimal; null for fewer than two prices. */
    Double priceConsistencyScore;
}
