package org.evgrid.geometry;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.evgrid.core.StationCoreException;

/**
 * WGS84 geographic coordinate in degrees (EPSG:4326).
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class GeoPoint {
    public static final double MIN_LATITUDE = -90.0d;
    public static final double MAX_LATITUDE = 90.0d;
    public static final double MIN_LONGITUDE = -180.0d;
    public static final double MAX_LONGITUDE = 180.0d;

    private final double latitude;
    private final double longitude;

    /**
     * Creates a validated geographic point.
     *
     * @throws StationCoreException with {@code INVALID_COORDINATE} when a value is
     *                              non-finite or outside [-90,90] / [-180,180].
     */
    public static GeoPoint of(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            throw new StationCoreException(
                    StationCoreException.REASON_INVALID_COORDINATE,
                    "coordinates must be finite: (" + latitude + ", " + longitude + ")"
            );
        }
        if (latitude < MIN_LATITUDE || latitude > MAX_LATITUDE) {
            throw new StationCoreException(
                    StationCoreException.REASON_INVALID_COORDINATE,
                    "latitude out of range [-90,90]: " + latitude
            );
        }
        if (longitude < MIN_LONGITUDE || longitude > MAX_LONGITUDE) {
            throw new StationCoreException(
                    StationCoreException.REASON_INVALID_COORDINATE,
                    "longitude out of range [-180,180]: " + longitude
            );
        }
        // -0.0 and 0.0 describe the same place
        return new GeoPoint(latitude + 0.0d, longitude + 0.0d);
    }
}
