package com.tazifor.datacube.geo.spi;

import com.tazifor.datacube.geo.model.Extent;
import com.tazifor.datacube.geo.model.Point;
import com.tazifor.datacube.geo.model.Polygon;
import com.tazifor.datacube.geo.model.TileKey;

import java.util.Set;

/**
 * Maps between map coordinates and the keys of a tiled raster level.
 * <p>
 * Levels store their pixels as a sparse set of keyed tiles. Code that needs
 * a tile's position (udf georeferencing, masks, stitching, point lookups)
 * asks a tiler rather than repeating the grid arithmetic.
 * </p>
 * <pre>{@code
 * Tiler tiler = level.tiler();
 * Extent bounds = tiler.extentOf(tiler.keyOf(Point.of(4.35, 50.85)));
 * Set<TileKey> field = tiler.keysForPolygon(parcel, 0.0);
 * }</pre>
 *
 * @see LayoutTiler
 */
public interface Tiler {

    /** Spatial key (no instant) of the tile holding {@code p}. */
    TileKey keyOf(Point p);

    /** Map extent of a tile; a key's instant is ignored. */
    Extent extentOf(TileKey key);

    /** Spatial keys of every layout tile that intersects {@code extent}. */
    Set<TileKey> keysCovering(Extent extent);

    /**
     * Spatial keys of the tiles considered inside {@code poly}.
     *
     * @param coverageThresholdPercent share of sample points (0 to 100) that must fall
     *                                 inside the polygon; 0 keeps every tile under its bounding box
     */
    Set<TileKey> keysForPolygon(Polygon poly, double coverageThresholdPercent);

    /** Short description of the grid, for logs. */
    String name();
}
