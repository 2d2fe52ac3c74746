package org.evgrid.analytics;

import lombok.Value;

/**
 * Station density of one county.
 */
@Value
public class DensityRow {
    String county;
    long stationCount;
    /**
     * Proxy view: share of all stations times the scale factor, 0 decimals.
     * Area view: stations per 1000 km², 2 decimals.
     */
    double density;
    /** County area in km² for the area view; null for the proxy view. */
    Double areaKm2;
}
