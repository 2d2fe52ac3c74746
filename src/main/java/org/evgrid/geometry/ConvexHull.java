package org.evgrid.geometry;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Planar convex hull via Andrew's monotone chain.
 */
@UtilityClass
public final class ConvexHull {

    /**
     * Builds the convex hull of a point set.
     *
     * <p>The result is counter-clockwise, starts at the vertex with the lowest x
     * (then lowest y) and omits collinear boundary points. Duplicate input points
     * are ignored. Inputs with fewer than three distinct or only collinear points
     * produce a degenerate polygon.</p>
     */
    public static Polygon of(Collection<PlanarPoint> points) {
        Objects.requireNonNull(points, "points");
        List<PlanarPoint> sorted = new ArrayList<>(points.size());
        for (PlanarPoint point : points) {
            sorted.add(Objects.requireNonNull(point, "point"));
        }
        sorted.sort(Comparator.comparingDouble(PlanarPoint::x).thenComparingDouble(PlanarPoint::y));
        List<PlanarPoint> distinct = dedupeSorted(sorted);

        int n = distinct.size();
        if (n == 0) {
            return Polygon.empty();
        }
        if (n <= 2) {
            return new Polygon(distinct);
        }

        PlanarPoint[] hull = new PlanarPoint[2 * n];
        int k = 0;
        for (int i = 0; i < n; i++) {
            PlanarPoint p = distinct.get(i);
            while (k >= 2 && cross(hull[k - 2], hull[k - 1], p) <= 0.0d) {
                k--;
            }
            hull[k++] = p;
        }
        int lowerSize = k + 1;
        for (int i = n - 2; i >= 0; i--) {
            PlanarPoint p = distinct.get(i);
            while (k >= lowerSize && cross(hull[k - 2], hull[k - 1], p) <= 0.0d) {
                k--;
            }
            hull[k++] = p;
        }

        // last point repeats the first
        List<PlanarPoint> vertices = new ArrayList<>(k - 1);
        for (int i = 0; i < k - 1; i++) {
            vertices.add(hull[i]);
        }
        if (vertices.size() < 3) {
            // all collinear: keep the two extreme points
            return new Polygon(List.of(distinct.get(0), distinct.get(n - 1)));
        }
        return new Polygon(vertices);
    }

    /**
     * Z-component of {@code (b - a) x (p - a)}; positive when {@code p} lies left of {@code a -> b}.
     */
    static double cross(PlanarPoint a, PlanarPoint b, PlanarPoint p) {
        return (b.x() - a.x()) * (p.y() - a.y()) - (b.y() - a.y()) * (p.x() - a.x());
    }

    private static List<PlanarPoint> dedupeSorted(List<PlanarPoint> sorted) {
        List<PlanarPoint> distinct = new ArrayList<>(sorted.size());
        PlanarPoint previous = null;
        for (PlanarPoint point : sorted) {
            if (previous == null || point.x() != previous.x() || point.y() != previous.y()) {
                distinct.add(point);
                previous = point;
            }
        }
        return distinct;
    }
}
