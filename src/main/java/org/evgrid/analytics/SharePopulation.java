package org.evgrid.analytics;

/**
 * Denominator used by share-of-total views.
 */
public enum SharePopulation {
    /** Only stations whose grouping key is non-null; shares sum to 100. */
    NON_NULL_KEYS,
    /** Every station in the snapshot; null-key stations count in the denominator only. */
    ALL_STATIONS
}
