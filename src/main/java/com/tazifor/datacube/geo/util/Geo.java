package com.tazifor.datacube.geo.util;

import com.tazifor.datacube.geo.model.Point;
import com.tazifor.datacube.geo.model.Polygon;

import java.util.List;

/**
 * Planar geometry helpers used by masking and zonal statistics.
 */
public final class Geo {

    /** Distance under which a point counts as lying on a polygon edge. */
    private static final double EDGE_TOLERANCE = 1e-10;

    private Geo() {}

    /**
     * Even-odd containment test for a pixel center or any other point.
     * <p>
     * Points on an edge or a vertex are inside, so pixels whose centers sit
     * exactly on a mask boundary are kept. Otherwise a ray is cast towards
     * {@code +x} and the edges it crosses are counted:
     * </p>
     * <pre>
     *        •───────•
     *        │       │
     *   p ●──┼───────┼──▶   2 crossings: outside
     *        │   q ●─┼──▶   1 crossing: inside
     *        •───────•
     * </pre>
     * The polygon is implicitly closed: the last vertex connects back to the
     * first.
     */
    public static boolean pointInPolygon(Point p, Polygon polygon) {
        List<Point> ring = polygon.points();
        if (onBoundary(p, ring)) return true;
        return crossings(p, ring) % 2 == 1;
    }

    private static boolean onBoundary(Point p, List<Point> ring) {
        int n = ring.size();
        for (int i = 0, j = n - 1; i < n; j = i++) {
            Point a = ring.get(j), b = ring.get(i);
            boolean withinBox = p.x() >= Math.min(a.x(), b.x()) - EDGE_TOLERANCE
                && p.x() <= Math.max(a.x(), b.x()) + EDGE_TOLERANCE
                && p.y() >= Math.min(a.y(), b.y()) - EDGE_TOLERANCE
                && p.y() <= Math.max(a.y(), b.y()) + EDGE_TOLERANCE;
            if (!withinBox) continue;
            double cross = (b.x() - a.x()) * (p.y() - a.y()) - (b.y() - a.y()) * (p.x() - a.x());
            if (Math.abs(cross) < EDGE_TOLERANCE) return true;
        }
        return false;
    }

    private static int crossings(Point p, List<Point> ring) {
        int n = ring.size();
        int count = 0;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            Point a = ring.get(j), b = ring.get(i);
            if ((a.y() > p.y()) == (b.y() > p.y())) continue;
            double xAtRay = a.x() + (p.y() - a.y()) * (b.x() - a.x()) / (b.y() - a.y());
            if (p.x() < xAtRay) count++;
        }
        return count;
    }
}
