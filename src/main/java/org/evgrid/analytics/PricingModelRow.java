package org.evgrid.analytics;

import lombok.Builder;
import lombok.Value;
import org.evgrid.catalog.PricingModel;

/**
 * Effectiveness of one pricing model within one location type, over operational stations.
 */
@Value
@Builder
public class PricingModelRow {
    PricingModel pricingModel;
    LocationType locationType;
    long stationCount;
    /** Mean charging points, 1 decimal; null when no station states capacity. */
    Double averageChargingPoints;
    /** Mean AC price per kWh, 0 decimals; null when none published. */
    Double averageKwhPrice;
    /** Mean price per minute, 1 decimal; null when none published. */
    Double averageMinutePrice;
    /** Share of all operational stations, 1 decimal. */
    double marketSharePercent;
}
