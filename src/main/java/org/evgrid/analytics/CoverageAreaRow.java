package org.evgrid.analytics;

import lombok.Value;
import org.evgrid.geometry.Polygon;

/**
 * Convex coverage area of one city's operational stations.
 */
@Value
public class CoverageAreaRow {
    String city;
    long stationCount;
    /** Hull in planar meters; degenerate when the stations are collinear or co-located. */
    Polygon hull;
    /** Hull area in km², 2 decimals. */
    double areaKm2;
}
