package org.evgrid.analytics;

import lombok.Value;

/**
 * One group of a share-of-total view.
 *
 * @param <K> grouping key type.
 */
@Value
public class ShareRow<K> {
    K key;
    long count;
    /** Percentage of the chosen population, rounded to 2 decimals. */
    double sharePercent;
}
