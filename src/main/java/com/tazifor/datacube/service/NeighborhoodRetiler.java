package com.tazifor.datacube.service;

import com.tazifor.datacube.geo.model.Extent;
import com.tazifor.datacube.geo.model.LayoutDefinition;
import com.tazifor.datacube.geo.model.TileKey;
import com.tazifor.datacube.geo.model.TileLayout;
import com.tazifor.datacube.model.Level;
import com.tazifor.datacube.model.Tile;
import com.tazifor.datacube.store.LevelSampler;
import com.tazifor.datacube.store.TileWorkerPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Re-partitions a level into neighborhood windows and back.
 * <p>
 * {@link #retile} lays a grid of {@code sizeX × sizeY} windows over the
 * level, anchored at its top-left corner, and cuts tiles of
 * {@code (sizeX + 2*marginX) × (sizeY + 2*marginY)} pixels whose border is
 * read from the neighbouring tiles. Pixels with no source data become
 * nodata. {@link #removeOverlap} cuts the border off again.
 * </p>
 */
@Slf4j
@Service
public class NeighborhoodRetiler {

    private final TileWorkerPool workers;

    public NeighborhoodRetiler(TileWorkerPool workers) {
        this.workers = workers;
    }

    public Level retile(Level level, int sizeX, int sizeY, int marginX, int marginY) {
        if (sizeX <= 0 || sizeY <= 0)
            throw new IllegalArgumentException("window size must be > 0");
        if (marginX < 0 || marginY < 0)
            throw new IllegalArgumentException("margins must be >= 0");
        if (level.bufferX() != 0 || level.bufferY() != 0)
            throw new IllegalArgumentException("level is already buffered: " + level);

        LayoutDefinition source = level.layout();
        TileLayout stl = source.tileLayout();
        double cw = source.cellWidth(), ch = source.cellHeight();
        int layoutCols = (stl.totalCols() + sizeX - 1) / sizeX;
        int layoutRows = (stl.totalRows() + sizeY - 1) / sizeY;
        Extent se = source.extent();
        Extent extent = new Extent(se.xmin(), se.ymax() - layoutRows * sizeY * ch,
            se.xmin() + layoutCols * sizeX * cw, se.ymax());
        LayoutDefinition target = new LayoutDefinition(extent, new TileLayout(layoutCols, layoutRows, sizeX, sizeY));

        Map<Instant, Map<TileKey, Tile>> byInstant = new TreeMap<>(Comparator.nullsFirst(Comparator.naturalOrder()));
        level.tiles().forEach((k, t) -> byInstant.computeIfAbsent(k.instant(), i -> new HashMap<>()).put(k, t));

        Map<Instant, LevelSampler> samplers = new HashMap<>();
        List<TileKey> windows = new ArrayList<>();
        for (Map.Entry<Instant, Map<TileKey, Tile>> group : byInstant.entrySet()) {
            samplers.put(group.getKey(), new LevelSampler(source, group.getValue(), 0, 0));
            Set<TileKey> keys = new TreeSet<>(TileKey.ORDER);
            for (TileKey k : group.getValue().keySet()) {
                int c0 = k.col() * stl.tileCols() / sizeX;
                int c1 = ((k.col() + 1) * stl.tileCols() - 1) / sizeX;
                int r0 = k.row() * stl.tileRows() / sizeY;
                int r1 = ((k.row() + 1) * stl.tileRows() - 1) / sizeY;
                for (int r = r0; r <= r1; r++) {
                    for (int c = c0; c <= c1; c++) keys.add(TileKey.of(c, r, group.getKey()));
                }
            }
            windows.addAll(keys);
        }

        int cols = sizeX + 2 * marginX, rows = sizeY + 2 * marginY;
        int bands = level.bandCount();
        double fill = level.noData() != null ? level.noData() : level.cellType().defaultNoData();
        Double noData = fill;

        List<Map.Entry<TileKey, Tile>> out = workers.map(windows, key -> {
            LevelSampler sampler = samplers.get(key.instant());
            double[][] cells = new double[bands][cols * rows];
            int gx0 = key.col() * sizeX - marginX;
            int gy0 = key.row() * sizeY - marginY;
            for (int b = 0; b < bands; b++) {
                for (int r = 0; r < rows; r++) {
                    for (int c = 0; c < cols; c++) {
                        double v = sampler.sample(b, gx0 + c, gy0 + r);
                        cells[b][r * cols + c] = Double.isNaN(v) ? fill : v;
                    }
                }
            }
            return Map.entry(key, Tile.wrap(cols, rows, level.cellType(), noData, cells));
        });
        log.debug("retiled {} tiles into {} windows of {}x{} (+{}/{} margin)", level.size(), out.size(),
            sizeX, sizeY, marginX, marginY);
        return level.toBuilder()
            .layout(target)
            .noData(noData)
            .bufferX(marginX)
            .bufferY(marginY)
            .tiles(Level.tileMap(out))
            .build();
    }

    public Level removeOverlap(Level level) {
        int bx = level.bufferX(), by = level.bufferY();
        if (bx == 0 && by == 0) return level;
        TileLayout tl = level.layout().tileLayout();
        List<Map.Entry<TileKey, Tile>> out = workers.map(level.entries(),
            e -> Map.entry(e.getKey(), e.getValue().crop(bx, by, tl.tileCols(), tl.tileRows())));
        return level.toBuilder().bufferX(0).bufferY(0).tiles(Level.tileMap(out)).build();
    }
}
