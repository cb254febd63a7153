package com.tazifor.datacube.model;

import com.tazifor.datacube.geo.model.LayoutDefinition;
import com.tazifor.datacube.geo.model.TileKey;
import com.tazifor.datacube.geo.spi.LayoutTiler;
import lombok.Builder;

import java.time.Instant;
import java.util.*;

/**
 * One resolution of a pyramid: a layout plus an immutable, keyed set of tiles.
 * <p>
 * Invariants checked on construction:
 * <ul>
 *   <li>no two tiles share a key</li>
 *   <li>every tile measures {@code tileCols + 2*bufferX} by {@code tileRows + 2*bufferY}</li>
 *   <li>spacetime levels only hold keys with an instant, spatial levels only keys without</li>
 * </ul>
 * A level is never mutated; transforms build a successor through {@link #toBuilder()}.
 */
public final class Level {

    public static final String DEFAULT_CRS = "EPSG:4326";

    private final LayoutDefinition layout;
    private final LayerType type;
    private final CellType cellType;
    private final Double noData;
    private final String crs;
    private final int bufferX;
    private final int bufferY;
    private final Map<TileKey, Tile> tiles;

    @Builder(toBuilder = true)
    private Level(LayoutDefinition layout, LayerType type, CellType cellType, Double noData, String crs,
                  int bufferX, int bufferY, Map<TileKey, Tile> tiles) {
        if (layout == null) throw new IllegalArgumentException("layout must not be null");
        if (type == null) throw new IllegalArgumentException("layer type must not be null");
        if (bufferX < 0 || bufferY < 0) throw new IllegalArgumentException("buffers must be >= 0");
        this.layout = layout;
        this.type = type;
        this.cellType = cellType == null ? CellType.FLOAT32 : cellType;
        this.noData = noData;
        this.crs = crs == null ? DEFAULT_CRS : crs;
        this.bufferX = bufferX;
        this.bufferY = bufferY;

        TreeMap<TileKey, Tile> sorted = new TreeMap<>(TileKey.ORDER);
        if (tiles != null) sorted.putAll(tiles);
        int expectedCols = layout.tileLayout().tileCols() + 2 * bufferX;
        int expectedRows = layout.tileLayout().tileRows() + 2 * bufferY;
        for (Map.Entry<TileKey, Tile> e : sorted.entrySet()) {
            Tile t = e.getValue();
            if (t.cols() != expectedCols || t.rows() != expectedRows)
                throw new IllegalArgumentException("tile " + e.getKey() + " measures " + t.cols() + "x" + t.rows()
                    + ", level expects " + expectedCols + "x" + expectedRows);
            if (e.getKey().isTemporal() != (type == LayerType.SPACETIME))
                throw new IllegalArgumentException("key " + e.getKey() + " does not fit a " + type + " level");
        }
        this.tiles = Collections.unmodifiableMap(sorted);
    }

    /**
     * Collects tiles into a key map, failing on duplicate keys.
     */
    public static Map<TileKey, Tile> tileMap(Collection<? extends Map.Entry<TileKey, Tile>> entries) {
        Map<TileKey, Tile> out = new LinkedHashMap<>();
        for (Map.Entry<TileKey, Tile> e : entries) {
            if (out.put(e.getKey(), e.getValue()) != null)
                throw new IllegalStateException("duplicate tile key " + e.getKey());
        }
        return out;
    }

    public LayoutDefinition layout() { return layout; }

    public LayoutTiler tiler() { return new LayoutTiler(layout); }

    public LayerType type() { return type; }

    public boolean isSpatial() { return type == LayerType.SPATIAL; }

    public CellType cellType() { return cellType; }

    public Double noData() { return noData; }

    public String crs() { return crs; }

    public int bufferX() { return bufferX; }

    public int bufferY() { return bufferY; }

    /** Tiles ordered by {@link TileKey#ORDER}. */
    public Map<TileKey, Tile> tiles() { return tiles; }

    public List<Map.Entry<TileKey, Tile>> entries() {
        return new ArrayList<>(tiles.entrySet());
    }

    public Tile tile(TileKey key) { return tiles.get(key); }

    public int size() { return tiles.size(); }

    public boolean isEmpty() { return tiles.isEmpty(); }

    /** Bands per tile, 0 for an empty level. */
    public int bandCount() {
        return tiles.isEmpty() ? 0 : tiles.values().iterator().next().bandCount();
    }

    /**
     * Key bounds derived from the tiles present, empty for an empty level.
     */
    public Optional<KeyBounds> keyBounds() {
        if (tiles.isEmpty()) return Optional.empty();
        int minCol = Integer.MAX_VALUE, minRow = Integer.MAX_VALUE;
        int maxCol = Integer.MIN_VALUE, maxRow = Integer.MIN_VALUE;
        Instant minInstant = null, maxInstant = null;
        for (TileKey k : tiles.keySet()) {
            minCol = Math.min(minCol, k.col());
            minRow = Math.min(minRow, k.row());
            maxCol = Math.max(maxCol, k.col());
            maxRow = Math.max(maxRow, k.row());
            if (k.instant() != null) {
                if (minInstant == null || k.instant().isBefore(minInstant)) minInstant = k.instant();
                if (maxInstant == null || k.instant().isAfter(maxInstant)) maxInstant = k.instant();
            }
        }
        return Optional.of(new KeyBounds(minCol, minRow, maxCol, maxRow, minInstant, maxInstant));
    }

    /** Distinct instants present, ascending. Empty for spatial levels. */
    public SortedSet<Instant> instants() {
        SortedSet<Instant> out = new TreeSet<>();
        for (TileKey k : tiles.keySet()) {
            if (k.instant() != null) out.add(k.instant());
        }
        return out;
    }

    public Level withTiles(Map<TileKey, Tile> newTiles) {
        return toBuilder().tiles(newTiles).build();
    }

    @Override
    public String toString() {
        return "Level[" + type + ", " + tiler().name() + ", " + tiles.size() + " tiles, " + cellType.typeName() + "]";
    }
}
