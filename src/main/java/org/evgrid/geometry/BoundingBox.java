package org.evgrid.geometry;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Axis-aligned rectangle in the metric plane, inclusive on all edges.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class BoundingBox {
    private final double minX;
    private final double minY;
    private final double maxX;
    private final double maxY;

    /**
     * Creates a box from its corner coordinates.
     *
     * @throws IllegalArgumentException when a value is non-finite or min exceeds max.
     */
    public BoundingBox(double minX, double minY, double maxX, double maxY) {
        if (!Double.isFinite(minX) || !Double.isFinite(minY) || !Double.isFinite(maxX) || !Double.isFinite(maxY)) {
            throw new IllegalArgumentException("bounding box coordinates must be finite");
        }
        if (minX > maxX || minY > maxY) {
            throw new IllegalArgumentException(
                    "bounding box min must not exceed max: [" + minX + "," + minY + "] [" + maxX + "," + maxY + "]");
        }
        this.minX = minX;
        this.minY = minY;
        this.maxX = maxX;
        this.maxY = maxY;
    }

    /**
     * Degenerate box covering exactly one point.
     */
    public static BoundingBox of(PlanarPoint point) {
        return new BoundingBox(point.x(), point.y(), point.x(), point.y());
    }

    /**
     * Square box of half-width {@code radius} centered on {@code center}.
     */
    public static BoundingBox around(PlanarPoint center, double radius) {
        if (!(radius >= 0.0d)) {
            throw new IllegalArgumentException("radius must be >= 0, got " + radius);
        }
        return new BoundingBox(center.x() - radius, center.y() - radius, center.x() + radius, center.y() + radius);
    }

    /**
     * Box spanning two geographic corners, projected into the plane.
     */
    public static BoundingBox ofGeo(GeoPoint southWest, GeoPoint northEast) {
        PlanarPoint sw = WebMercatorProjection.project(southWest);
        PlanarPoint ne = WebMercatorProjection.project(northEast);
        return new BoundingBox(
                Math.min(sw.x(), ne.x()),
                Math.min(sw.y(), ne.y()),
                Math.max(sw.x(), ne.x()),
                Math.max(sw.y(), ne.y())
        );
    }

    public boolean contains(PlanarPoint point) {
        return contains(point.x(), point.y());
    }

    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    public boolean contains(BoundingBox other) {
        return other.minX >= minX && other.maxX <= maxX && other.minY >= minY && other.maxY <= maxY;
    }

    public boolean intersects(BoundingBox other) {
        return other.minX <= maxX && other.maxX >= minX && other.minY <= maxY && other.maxY >= minY;
    }

    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(
                Math.min(minX, other.minX),
                Math.min(minY, other.minY),
                Math.max(maxX, other.maxX),
                Math.max(maxY, other.maxY)
        );
    }

    public double area() {
        return (maxX - minX) * (maxY - minY);
    }

    /**
     * Area increase needed for this box to also cover {@code other}.
     */
    public double enlargement(BoundingBox other) {
        double width = Math.max(maxX, other.maxX) - Math.min(minX, other.minX);
        double height = Math.max(maxY, other.maxY) - Math.min(minY, other.minY);
        return width * height - area();
    }

    /**
     * Squared distance from a point to the closest point of this box; zero when inside.
     */
    public double minDistanceSquared(double x, double y) {
        double dx = x < minX ? minX - x : (x > maxX ? x - maxX : 0.0d);
        double dy = y < minY ? minY - y : (y > maxY ? y - maxY : 0.0d);
        return dx * dx + dy * dy;
    }

    public double centerX() {
        return (minX + maxX) * 0.5d;
    }

    public double centerY() {
        return (minY + maxY) * 0.5d;
    }
}
