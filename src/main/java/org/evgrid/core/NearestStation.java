package org.evgrid.core;

import lombok.Value;
import org.evgrid.catalog.Station;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Nearest-station report row: the station and its planar distance in km, 2 decimals.
 */
@Value
public class NearestStation {
    Station station;
    double distanceKm;

    static NearestStation of(Station station, double distanceMeters) {
        double km = BigDecimal.valueOf(distanceMeters / 1000.0d).setScale(2, RoundingMode.HALF_UP).doubleValue();
        return new NearestStation(station, km);
    }
}
