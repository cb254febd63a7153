package com.tazifor.datacube.store;

import com.tazifor.datacube.geo.model.Extent;
import com.tazifor.datacube.geo.model.LayoutDefinition;
import com.tazifor.datacube.geo.model.TileKey;
import com.tazifor.datacube.geo.model.TileLayout;
import com.tazifor.datacube.model.Tile;

import java.util.HashMap;
import java.util.Map;

/**
 * Reads single pixels across tile boundaries of one instant of a level.
 * <p>
 * Global pixel coordinates count columns from the left edge of the layout
 * and rows from its top edge, matching key space. Pixels of missing tiles,
 * pixels outside the layout and nodata cells all read as {@code NaN}.
 * Tile buffers are skipped: pixel {@code (0,0)} of a key is the first
 * pixel inside its buffer.
 * </p>
 */
public class LevelSampler {

    private final LayoutDefinition layout;
    private final Map<TileKey, Tile> tiles;
    private final int bufferX;
    private final int bufferY;

    public LevelSampler(LayoutDefinition layout, Map<TileKey, Tile> tiles, int bufferX, int bufferY) {
        this.layout = layout;
        this.tiles = new HashMap<>();
        tiles.forEach((k, t) -> this.tiles.put(k.spatialKey(), t));
        this.bufferX = bufferX;
        this.bufferY = bufferY;
    }

    /** Whether pixel {@code (gx, gy)} lies on a tile of this instant. */
    public boolean covers(int gx, int gy) {
        TileLayout tl = layout.tileLayout();
        return tiles.containsKey(TileKey.of(Math.floorDiv(gx, tl.tileCols()), Math.floorDiv(gy, tl.tileRows())));
    }

    public double sample(int band, int gx, int gy) {
        TileLayout tl = layout.tileLayout();
        int col = Math.floorDiv(gx, tl.tileCols());
        int row = Math.floorDiv(gy, tl.tileRows());
        Tile t = tiles.get(TileKey.of(col, row));
        if (t == null) return Double.NaN;
        int px = gx - col * tl.tileCols() + bufferX;
        int py = gy - row * tl.tileRows() + bufferY;
        double v = t.get(band, px, py);
        return t.isNoData(v) ? Double.NaN : v;
    }

    /** Value of the pixel whose area contains map point {@code (x, y)}. */
    public double nearest(int band, double x, double y) {
        Extent ex = layout.extent();
        int gx = (int) Math.floor((x - ex.xmin()) / layout.cellWidth());
        int gy = (int) Math.floor((ex.ymax() - y) / layout.cellHeight());
        return sample(band, gx, gy);
    }

    /**
     * Bilinear interpolation between the four pixel centers around
     * {@code (x, y)}. Missing neighbours are left out and the remaining
     * weights renormalized.
     */
    public double bilinear(int band, double x, double y) {
        Extent ex = layout.extent();
        double fx = (x - ex.xmin()) / layout.cellWidth() - 0.5;
        double fy = (ex.ymax() - y) / layout.cellHeight() - 0.5;
        int x0 = (int) Math.floor(fx);
        int y0 = (int) Math.floor(fy);
        double dx = fx - x0;
        double dy = fy - y0;

        double sum = 0, weight = 0;
        for (int j = 0; j <= 1; j++) {
            for (int i = 0; i <= 1; i++) {
                double w = (i == 0 ? 1 - dx : dx) * (j == 0 ? 1 - dy : dy);
                if (w == 0) continue;
                double v = sample(band, x0 + i, y0 + j);
                if (Double.isNaN(v)) continue;
                sum += v * w;
                weight += w;
            }
        }
        return weight == 0 ? Double.NaN : sum / weight;
    }
}
