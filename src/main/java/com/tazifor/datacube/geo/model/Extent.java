package com.tazifor.datacube.geo.model;

/**
 * Axis-aligned bounding box in the layer's coordinate reference system.
 * Geographic y grows upward, so {@code ymax} is the top edge.
 */
public record Extent(double xmin, double ymin, double xmax, double ymax) {

    public double width() { return xmax - xmin; }

    public double height() { return ymax - ymin; }

    public boolean contains(Point p) {
        return p.x() >= xmin && p.x() <= xmax && p.y() >= ymin && p.y() <= ymax;
    }

    /** Open intersection: extents that only share an edge do not intersect. */
    public boolean intersects(Extent other) {
        return other.xmin < xmax && other.xmax > xmin && other.ymin < ymax && other.ymax > ymin;
    }

    public Point center() {
        return new Point((xmin + xmax) / 2, (ymin + ymax) / 2);
    }

    public Extent buffer(double dx, double dy) {
        return new Extent(xmin - dx, ymin - dy, xmax + dx, ymax + dy);
    }
}
