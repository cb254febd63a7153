package com.tazifor.datacube.geo.model;

import java.util.List;

/**
 * Represents a polygon as an <b>ordered list of x/y vertices</b> in the
 * layer's coordinate reference system.
 * <p>
 * Each vertex {@code i} is connected to {@code i+1} and the last vertex
 * connects back to the first, so the ring must not repeat its first point.
 * Vertices may be listed clockwise or counter-clockwise.
 * </p>
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Polygon field = new Polygon(List.of(
 *     Point.of(4.0, 51.0),   // south-west
 *     Point.of(4.2, 51.0),   // south-east
 *     Point.of(4.2, 51.1),   // north-east
 *     Point.of(4.0, 51.1)    // north-west
 * ));
 * }</pre>
 */
public record Polygon(List<Point> points) {

    public Polygon {
        if (points == null || points.size() < 3)
            throw new IllegalArgumentException("a polygon needs at least 3 vertices");
        points = List.copyOf(points);
    }

    /**
     * Computes the bounding box that fully encloses this polygon.
     */
    public Extent bounds() {
        double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;

        for (Point pt : points) {
            minX = Math.min(minX, pt.x());
            minY = Math.min(minY, pt.y());
            maxX = Math.max(maxX, pt.x());
            maxY = Math.max(maxY, pt.y());
        }
        return new Extent(minX, minY, maxX, maxY);
    }

    /** Axis-aligned rectangle polygon, handy for crop boxes and tests. */
    public static Polygon rectangle(Extent e) {
        return new Polygon(List.of(
            Point.of(e.xmin(), e.ymin()), Point.of(e.xmax(), e.ymin()),
            Point.of(e.xmax(), e.ymax()), Point.of(e.xmin(), e.ymax())
        ));
    }
}
