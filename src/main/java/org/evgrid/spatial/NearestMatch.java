package org.evgrid.spatial;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Immutable nearest-neighbor match result for spatial queries.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public final class NearestMatch {
    private final long stationId;
    private final double distanceMeters;

    public double distanceKm() {
        return distanceMeters / 1000.0d;
    }
}
