package org.evgrid.analytics;

/**
 * Market competition intensity of a location.
 */
public enum CompetitionLevel {
    HIGH,
    MODERATE,
    LOW
}
