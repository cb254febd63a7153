package com.tazifor.datacube.geo.model;

import java.time.Instant;
import java.util.Comparator;

/**
 * Identifies a tile within a level: a column/row in the layout grid and,
 * for spatiotemporal levels, the acquisition instant.
 * <p>
 * Column 0, row 0 is the upper-left tile of the layout. Rows grow downward.
 * </p>
 */
public record TileKey(int col, int row, Instant instant) {

    /** Spatial order first (row, then column), then instant with spatial-only keys first. */
    public static final Comparator<TileKey> ORDER = Comparator
        .comparingInt(TileKey::row)
        .thenComparingInt(TileKey::col)
        .thenComparing(TileKey::instant, Comparator.nullsFirst(Comparator.naturalOrder()));

    public static TileKey of(int col, int row) {
        return new TileKey(col, row, null);
    }

    public static TileKey of(int col, int row, Instant instant) {
        return new TileKey(col, row, instant);
    }

    public boolean isTemporal() {
        return instant != null;
    }

    public TileKey spatialKey() {
        return instant == null ? this : new TileKey(col, row, null);
    }

    public TileKey withInstant(Instant newInstant) {
        return new TileKey(col, row, newInstant);
    }

    @Override
    public String toString() {
        return instant == null ? "C" + col + "_R" + row : "C" + col + "_R" + row + "@" + instant;
    }
}
