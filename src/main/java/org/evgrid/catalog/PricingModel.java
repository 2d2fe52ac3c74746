package org.evgrid.catalog;

/**
 * Pricing scheme derived from which prices a station publishes.
 */
public enum PricingModel {
    PER_KWH,
    PER_MINUTE,
    HYBRID,
    FREE,
    UNKNOWN
}
