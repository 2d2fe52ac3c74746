package org.evgrid.quality;

/**
 * Data-quality problem reported for a station, in rule priority order.
 */
public enum IssueKind {
    MISSING_PRICE,
    MISSING_OPERATIONAL_STATUS,
    MISSING_CAPACITY,
    VERIFICATION_BEFORE_CREATION
}
