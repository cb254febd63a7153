package com.tazifor.datacube.geo.spi;

import com.tazifor.datacube.geo.model.*;
import com.tazifor.datacube.geo.util.Geo;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * {@code LayoutTiler} maps tile keys of a {@link LayoutDefinition} to map
 * extents and back.
 * <p>
 * The layout divides its extent into {@code layoutCols × layoutRows} tiles of
 * equal size. Keys count columns from the left edge and rows from the
 * <b>top</b> edge, while map y grows upward. Every conversion between the
 * two goes through this class.
 * </p>
 *
 * <h3>Key space vs map space</h3>
 * <pre>
 *        key space (rows grow down)          map space (y grows up)
 *
 *        col 0     col 1                      ymax ┌─────┬─────┐
 *      ┌─────────┬─────────┐ row 0                 │ 0,0 │ 1,0 │
 *      │  (0,0)  │  (1,0)  │                       ├─────┼─────┤
 *      ├─────────┼─────────┤ row 1                 │ 0,1 │ 1,1 │
 *      │  (0,1)  │  (1,1)  │                  ymin └─────┴─────┘
 *      └─────────┴─────────┘                      xmin        xmax
 * </pre>
 *
 * <h3>Stitching space</h3>
 * Contiguous arrays produced by stitching put pixel {@code (0,0)} at the
 * <b>bottom-left</b> corner of the layout so that array y follows map y.
 * {@link #pixelWindowOf(TileKey)} converts a key into that space by flipping
 * its row: {@code y = (layoutRows - 1 - row) * tileRows}.
 *
 * @see Tiler
 */
public class LayoutTiler implements Tiler {

    /** Tolerance used when snapping map coordinates onto pixel boundaries. */
    private static final double EPSILON = 1e-9;

    private final LayoutDefinition layout;

    public LayoutTiler(LayoutDefinition layout) {
        if (layout == null)
            throw new IllegalArgumentException("layout must not be null");
        this.layout = layout;
    }

    public LayoutDefinition layout() {
        return layout;
    }

    /**
     * Converts an x coordinate into a zero-based column index.
     */
    private int col(double x) {
        return (int) Math.floor((x - layout.extent().xmin()) / layout.tileWidth());
    }

    /**
     * Converts a y coordinate into a zero-based row index, counting down
     * from the top edge of the layout.
     */
    private int row(double y) {
        return (int) Math.floor((layout.extent().ymax() - y) / layout.tileHeight());
    }

    /**
     * Returns the key of the tile containing {@code p}. Points on the right
     * or bottom edge of the layout are assigned to the last column or row.
     */
    @Override
    public TileKey keyOf(Point p) {
        TileLayout tl = layout.tileLayout();
        int c = col(p.x());
        int r = row(p.y());
        if (c == tl.layoutCols() && p.x() <= layout.extent().xmax()) c--;
        if (r == tl.layoutRows() && p.y() >= layout.extent().ymin()) r--;
        return TileKey.of(c, r);
    }

    /**
     * Computes the extent of a tile: the inverse of {@link #keyOf(Point)}.
     */
    @Override
    public Extent extentOf(TileKey key) {
        Extent ex = layout.extent();
        double tw = layout.tileWidth();
        double th = layout.tileHeight();

        double top = ex.ymax() - th * key.row();
        double left = ex.xmin() + tw * key.col();
        return new Extent(left, top - th, left + tw, top);
    }

    /**
     * Enumerates all keys of the layout whose tiles intersect {@code extent}.
     */
    @Override
    public Set<TileKey> keysCovering(Extent extent) {
        Extent ex = layout.extent();
        TileLayout tl = layout.tileLayout();

        int c0 = Math.max(0, (int) Math.floor((extent.xmin() - ex.xmin()) / layout.tileWidth() + EPSILON));
        int c1 = Math.min(tl.layoutCols() - 1, (int) Math.ceil((extent.xmax() - ex.xmin()) / layout.tileWidth() - EPSILON) - 1);
        int r0 = Math.max(0, (int) Math.floor((ex.ymax() - extent.ymax()) / layout.tileHeight() + EPSILON));
        int r1 = Math.min(tl.layoutRows() - 1, (int) Math.ceil((ex.ymax() - extent.ymin()) / layout.tileHeight() - EPSILON) - 1);

        Set<TileKey> out = new LinkedHashSet<>();
        for (int r = r0; r <= r1; r++) {
            for (int c = c0; c <= c1; c++) {
                out.add(TileKey.of(c, r));
            }
        }
        return out;
    }

    /**
     * Approximates which tiles fall within a polygon.
     * <p>
     * Each candidate tile (from the polygon's bounding box) is sampled at
     * five points: its center and four corners. The percentage of points
     * inside the polygon decides inclusion.
     * </p>
     */
    @Override
    public Set<TileKey> keysForPolygon(Polygon poly, double coverageThresholdPercent) {
        Set<TileKey> out = new LinkedHashSet<>();

        for (TileKey k : keysCovering(poly.bounds())) {
            Extent tb = extentOf(k);
            Point[] samples = {
                tb.center(),
                new Point(tb.xmin(), tb.ymin()),
                new Point(tb.xmax(), tb.ymin()),
                new Point(tb.xmin(), tb.ymax()),
                new Point(tb.xmax(), tb.ymax())
            };

            int inside = 0;
            for (Point s : samples)
                if (Geo.pointInPolygon(s, poly)) inside++;

            double pct = (inside / (double) samples.length) * 100.0;
            if (pct >= coverageThresholdPercent)
                out.add(k);
        }
        return out;
    }

    /**
     * Returns the pixel window of a tile in stitching space (origin at the
     * bottom-left pixel of the layout).
     */
    public PixelWindow pixelWindowOf(TileKey key) {
        TileLayout tl = layout.tileLayout();
        int flippedRow = tl.layoutRows() - 1 - key.row();
        return new PixelWindow(key.col() * tl.tileCols(), flippedRow * tl.tileRows(), tl.tileCols(), tl.tileRows());
    }

    /**
     * Converts a map extent into a pixel window in stitching space,
     * rounding outward (floor for the lower bounds, ceil for the upper).
     */
    public PixelWindow pixelWindowOf(Extent extent) {
        Extent ex = layout.extent();
        double xres = layout.cellWidth();
        double yres = layout.cellHeight();

        int xmin = (int) Math.floor((extent.xmin() - ex.xmin()) / xres + EPSILON);
        int ymin = (int) Math.floor((extent.ymin() - ex.ymin()) / yres + EPSILON);
        int xmax = (int) Math.ceil((extent.xmax() - ex.xmin()) / xres - EPSILON);
        int ymax = (int) Math.ceil((extent.ymax() - ex.ymin()) / yres - EPSILON);
        return new PixelWindow(xmin, ymin, xmax - xmin, ymax - ymin);
    }

    /**
     * Returns the key of the tile holding pixel {@code (px, py)} of
     * stitching space: the inverse of {@link #pixelWindowOf(TileKey)}.
     */
    public TileKey keyAtPixel(int px, int py) {
        TileLayout tl = layout.tileLayout();
        int c = Math.floorDiv(px, tl.tileCols());
        int r = tl.layoutRows() - 1 - Math.floorDiv(py, tl.tileRows());
        return TileKey.of(c, r);
    }

    /** Map extent of a pixel window in stitching space. */
    public Extent extentOf(PixelWindow window) {
        Extent ex = layout.extent();
        double xres = layout.cellWidth();
        double yres = layout.cellHeight();
        return new Extent(
            ex.xmin() + window.x() * xres,
            ex.ymin() + window.y() * yres,
            ex.xmin() + window.xEnd() * xres,
            ex.ymin() + window.yEnd() * yres);
    }

    /** Returns a descriptive name, e.g. "layout-4x4@256x256". */
    @Override
    public String name() {
        TileLayout tl = layout.tileLayout();
        return "layout-" + tl.layoutCols() + "x" + tl.layoutRows() + "@" + tl.tileCols() + "x" + tl.tileRows();
    }
}
