package org.evgrid.analytics;

import lombok.Builder;
import lombok.Value;

/**
 * Pricing competition summary of one city.
 */
@Value
@Builder
public class CompetitionRow {
    String city;
    long stationCount;
    /** Distinct non-null operators. */
    int operatorCount;
    double averagePrice;
    double minPrice;
    double maxPrice;
    /** {@code maxPrice - minPrice}. */
    double priceSpread;
    CompetitionLevel level;
}
