package com.tazifor.datacube;

import com.tazifor.datacube.geo.model.Extent;
import com.tazifor.datacube.geo.model.LayoutDefinition;
import com.tazifor.datacube.geo.model.TileKey;
import com.tazifor.datacube.geo.model.TileLayout;
import com.tazifor.datacube.model.CellType;
import com.tazifor.datacube.model.LayerType;
import com.tazifor.datacube.model.Level;
import com.tazifor.datacube.model.Tile;
import com.tazifor.datacube.store.TileWorkerPool;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Shared builders for tests. Layouts use one map unit per pixel with the
 * origin at (0, 0) unless stated otherwise.
 */
public final class Fixtures {

    private static final ExecutorService EXECUTOR = Executors.newFixedThreadPool(4, r -> {
        Thread t = new Thread(r, "test-tile-worker");
        t.setDaemon(true);
        return t;
    });

    private Fixtures() {
    }

    public static TileWorkerPool workers() {
        return new TileWorkerPool(EXECUTOR);
    }

    public static LayoutDefinition layout(int layoutCols, int layoutRows, int tileCols, int tileRows) {
        return new LayoutDefinition(new Extent(0, 0, layoutCols * tileCols, layoutRows * tileRows),
            new TileLayout(layoutCols, layoutRows, tileCols, tileRows));
    }

    public static Instant day(int dayOfMonth) {
        return Instant.parse(String.format("2021-01-%02dT00:00:00Z", dayOfMonth));
    }

    /** Single-band float tile holding {@code value} everywhere. */
    public static Tile filled(int cols, int rows, double value) {
        return Tile.filled(cols, rows, 1, value, CellType.FLOAT32, Double.NaN);
    }

    /** Single-band float tile with cell (c, r) = base + r * cols + c. */
    public static Tile ramp(int cols, int rows, double base) {
        double[] cells = new double[cols * rows];
        for (int i = 0; i < cells.length; i++) cells[i] = base + i;
        return Tile.of(cols, rows, CellType.FLOAT32, Double.NaN, cells);
    }

    public static Level spatial(LayoutDefinition layout, Map<TileKey, Tile> tiles) {
        return Level.builder().layout(layout).type(LayerType.SPATIAL).cellType(CellType.FLOAT32)
            .noData(Double.NaN).tiles(tiles).build();
    }

    public static Level spacetime(LayoutDefinition layout, Map<TileKey, Tile> tiles) {
        return Level.builder().layout(layout).type(LayerType.SPACETIME).cellType(CellType.FLOAT32)
            .noData(Double.NaN).tiles(tiles).build();
    }
}
