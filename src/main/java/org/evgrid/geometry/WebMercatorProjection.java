package org.evgrid.geometry;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Spherical Web Mercator projection (EPSG:4326 degrees to EPSG:3857 meters).
 *
 * <p>The forward transform is a pure function of the geographic coordinate, so a
 * station's planar point can always be recomputed from its latitude/longitude.
 * Latitudes beyond the Mercator limit are clamped to it before projecting.</p>
 */
@UtilityClass
public final class WebMercatorProjection {
    public static final double SPHERE_RADIUS_METERS = 6_378_137.0d;
    public static final double MAX_MERCATOR_LATITUDE = 85.05112877980659d;

    /**
     * Projects a geographic point into the metric plane.
     */
    public static PlanarPoint project(GeoPoint point) {
        Objects.requireNonNull(point, "point");
        double latitude = Math.max(-MAX_MERCATOR_LATITUDE, Math.min(MAX_MERCATOR_LATITUDE, point.latitude()));
        double x = SPHERE_RADIUS_METERS * Math.toRadians(point.longitude());
        double y = SPHERE_RADIUS_METERS * Math.log(Math.tan(Math.PI / 4.0d + Math.toRadians(latitude) / 2.0d));
        return new PlanarPoint(x, y);
    }

    /**
     * Projects raw degrees; validates the range first.
     */
    public static PlanarPoint project(double latitude, double longitude) {
        return project(GeoPoint.of(latitude, longitude));
    }

    /**
     * Inverse transform from planar meters back to degrees.
     */
    public static GeoPoint unproject(PlanarPoint point) {
        Objects.requireNonNull(point, "point");
        double longitude = Math.toDegrees(point.x() / SPHERE_RADIUS_METERS);
        double latitude = Math.toDegrees(2.0d * Math.atan(Math.exp(point.y() / SPHERE_RADIUS_METERS)) - Math.PI / 2.0d);
        return GeoPoint.of(latitude, longitude);
    }
}
