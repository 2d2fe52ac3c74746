package org.evgrid.geometry;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Point in the metric plane (EPSG:3857 meters).
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public final class PlanarPoint {
    private final double x;
    private final double y;

    /**
     * Euclidean distance to another planar point, in meters.
     */
    public double distanceTo(PlanarPoint other) {
        return GeometryDistance.euclideanDistance(x, y, other.x, other.y);
    }
}
