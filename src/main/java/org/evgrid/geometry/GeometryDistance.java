package org.evgrid.geometry;

import lombok.experimental.UtilityClass;

/**
 * Numeric helpers for station distance computations.
 */
@UtilityClass
public final class GeometryDistance {
    private static final double EARTH_MEAN_RADIUS_METERS = 6_371_008.8d;

    /**
     * Computes Euclidean distance in projected coordinate space.
     */
    public static double euclideanDistance(double x1, double y1, double x2, double y2) {
        return Math.hypot(x2 - x1, y2 - y1);
    }

    /**
     * Squared Euclidean distance; avoids the square root on hot comparison paths.
     */
    public static double squaredDistance(double x1, double y1, double x2, double y2) {
        double dx = x2 - x1;
        double dy = y2 - y1;
        return dx * dx + dy * dy;
    }

    /**
     * Planar distance between two stations' projected points, in meters.
     */
    public static double distanceMeters(PlanarPoint a, PlanarPoint b) {
        return euclideanDistance(a.x(), a.y(), b.x(), b.y());
    }

    /**
     * Planar distance in kilometers.
     */
    public static double distanceKm(PlanarPoint a, PlanarPoint b) {
        return distanceMeters(a, b) / 1000.0d;
    }

    /**
     * Computes great-circle distance in meters using haversine formulation.
     *
     * <p>Not used by index queries; available for comparing the planar
     * approximation against true ground distance.</p>
     */
    public static double greatCircleDistanceMeters(GeoPoint a, GeoPoint b) {
        double lat1Rad = Math.toRadians(a.latitude());
        double lat2Rad = Math.toRadians(b.latitude());
        double deltaLatRad = Math.toRadians(b.latitude() - a.latitude());
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(b.longitude() - a.longitude()));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double h = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double c = 2.0d * Math.asin(Math.sqrt(clamp(h, 0.0d, 1.0d)));
        return EARTH_MEAN_RADIUS_METERS * c;
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
