package org.evgrid.analytics;

import lombok.Builder;
import lombok.Value;

/**
 * AC price-per-kWh statistics of one group over paid stations with a published price.
 *
 * @param <K> grouping key type.
 */
@Value
@Builder
public class PriceStatisticsRow<K> {
    K key;
    long count;
    double mean;
    double min;
    double max;
    /** Sample variance; null for a single price. */
    Double variance;
    /** Sample standard deviation; null for a single price. */
    Double standardDeviation;
}
