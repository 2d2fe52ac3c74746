package org.evgrid.analytics;

import lombok.Value;

/**
 * One group of a counting view.
 *
 * @param <K> grouping key type.
 */
@Value
public class CountRow<K> {
    K key;
    long count;
}
