package org.evgrid.geometry;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

/**
 * Immutable convex polygon with counter-clockwise vertices.
 *
 * <p>Hulls of fewer than three distinct or only collinear points are degenerate:
 * zero vertices (empty), one vertex (a point) or two vertices (a segment).</p>
 */
@EqualsAndHashCode
@ToString
public final class Polygon {
    private static final double EPSILON = 1e-6d;
    private static final Polygon EMPTY = new Polygon(List.of());

    private final List<PlanarPoint> vertices;

    Polygon(List<PlanarPoint> vertices) {
        this.vertices = List.copyOf(vertices);
    }

    public static Polygon empty() {
        return EMPTY;
    }

    /**
     * Vertices in counter-clockwise order without repeating the first vertex.
     */
    public List<PlanarPoint> vertices() {
        return vertices;
    }

    public int vertexCount() {
        return vertices.size();
    }

    public boolean isEmpty() {
        return vertices.isEmpty();
    }

    public boolean isDegenerate() {
        return vertices.size() < 3;
    }

    /**
     * Area from the shoelace formula, in square meters. Degenerate polygons have zero area.
     */
    public double areaSquareMeters() {
        if (isDegenerate()) {
            return 0.0d;
        }
        double twiceArea = 0.0d;
        int n = vertices.size();
        for (int i = 0; i < n; i++) {
            PlanarPoint a = vertices.get(i);
            PlanarPoint b = vertices.get((i + 1) % n);
            twiceArea += a.x() * b.y() - b.x() * a.y();
        }
        return Math.abs(twiceArea) * 0.5d;
    }

    public double areaSquareKm() {
        return areaSquareMeters() / 1_000_000.0d;
    }

    /**
     * Point-in-polygon test, inclusive of the boundary.
     */
    public boolean contains(PlanarPoint point) {
        int n = vertices.size();
        if (n == 0) {
            return false;
        }
        if (n == 1) {
            return vertices.get(0).distanceTo(point) <= EPSILON;
        }
        if (n == 2) {
            return onSegment(vertices.get(0), vertices.get(1), point);
        }
        for (int i = 0; i < n; i++) {
            PlanarPoint a = vertices.get(i);
            PlanarPoint b = vertices.get((i + 1) % n);
            double edgeLength = a.distanceTo(b);
            // signed distance of point from edge line, positive on the inner (left) side
            if (ConvexHull.cross(a, b, point) < -EPSILON * Math.max(1.0d, edgeLength)) {
                return false;
            }
        }
        return true;
    }

    private static boolean onSegment(PlanarPoint a, PlanarPoint b, PlanarPoint p) {
        double length = a.distanceTo(b);
        if (Math.abs(ConvexHull.cross(a, b, p)) > EPSILON * Math.max(1.0d, length)) {
            return false;
        }
        return p.x() >= Math.min(a.x(), b.x()) - EPSILON
                && p.x() <= Math.max(a.x(), b.x()) + EPSILON
                && p.y() >= Math.min(a.y(), b.y()) - EPSILON
                && p.y() <= Math.max(a.y(), b.y()) + EPSILON;
    }
}
