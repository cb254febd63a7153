package com.tazifor.datacube.service;

import com.tazifor.datacube.geo.model.Extent;
import com.tazifor.datacube.geo.model.LayoutDefinition;
import com.tazifor.datacube.geo.model.PixelWindow;
import com.tazifor.datacube.geo.model.TileKey;
import com.tazifor.datacube.geo.model.TileLayout;
import com.tazifor.datacube.geo.spi.LayoutTiler;
import com.tazifor.datacube.model.CubeMetadata;
import com.tazifor.datacube.model.DataArray;
import com.tazifor.datacube.model.DataCube;
import com.tazifor.datacube.model.KeyBounds;
import com.tazifor.datacube.model.Level;
import com.tazifor.datacube.model.Tile;
import com.tazifor.datacube.store.TileWorkerPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Reassembles the tiles of one level into a single contiguous array.
 * <p>
 * The result has dims {@code (t, bands, x, y)}, where {@code t} only exists
 * for spacetime levels and {@code bands} is dropped when the cube has no
 * band dimension and a single band. Array index {@code (x=0, y=0)} is the
 * bottom-left pixel of the window, so array y follows map y.
 * </p>
 * Pixels not covered by any tile hold the level's nodata value, or 0 when
 * the level declares none.
 */
@Slf4j
@Service
public class TileStitcher {

    private final TileWorkerPool workers;

    public TileStitcher(TileWorkerPool workers) {
        this.workers = workers;
    }

    /** Stitches the highest level of {@code cube}. */
    public DataArray stitch(DataCube cube, Extent crop, Instant from, Instant to) {
        return stitch(cube.highestLevel(), cube.metadata(), crop, from, to);
    }

    /**
     * @param crop map extent to cut out, or {@code null} for the key bounds of the tiles
     * @param from first instant to keep (inclusive), or {@code null}
     * @param to   last instant to keep (inclusive), or {@code null}
     */
    public DataArray stitch(Level level, CubeMetadata metadata, Extent crop, Instant from, Instant to) {
        LayoutTiler tiler = level.tiler();
        LayoutDefinition layout = level.layout();
        TileLayout tl = layout.tileLayout();

        Map<Instant, List<Map.Entry<TileKey, Tile>>> groups = new TreeMap<>(Comparator.nullsFirst(Comparator.naturalOrder()));
        for (Map.Entry<TileKey, Tile> e : level.tiles().entrySet()) {
            Instant instant = e.getKey().instant();
            if (!level.isSpatial() && ((from != null && instant.isBefore(from)) || (to != null && instant.isAfter(to))))
                continue;
            groups.computeIfAbsent(instant, i -> new ArrayList<>()).add(e);
        }

        boolean temporal = !level.isSpatial();
        int bandCount = level.bandCount();
        boolean keepBands = metadata.hasBandDimension() || bandCount > 1;
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("nodata", level.noData());
        attrs.put("crs", level.crs());

        if (groups.isEmpty()) {
            log.warn("nothing to stitch in {}: returning an empty array", level);
            List<String> dims = new ArrayList<>();
            if (temporal) dims.add(CubeMetadata.T);
            if (keepBands) dims.add(CubeMetadata.BANDS);
            dims.add(CubeMetadata.X);
            dims.add(CubeMetadata.Y);
            return new DataArray(dims, new int[dims.size()], new double[0], Map.of(), attrs);
        }

        PixelWindow window;
        if (crop != null) {
            window = tiler.pixelWindowOf(crop);
        } else {
            KeyBounds kb = boundsOf(groups);
            window = new PixelWindow(kb.minCol() * tl.tileCols(), (tl.layoutRows() - 1 - kb.maxRow()) * tl.tileRows(),
                (kb.maxCol() - kb.minCol() + 1) * tl.tileCols(), (kb.maxRow() - kb.minRow() + 1) * tl.tileRows());
        }
        int w = Math.max(window.width(), 0), h = Math.max(window.height(), 0);
        double fill = level.noData() != null ? level.noData() : 0.0;
        int bx = level.bufferX(), by = level.bufferY();
        int sliceSize = arraySize(w, h, bandCount, 1);
        int totalSize = arraySize(w, h, bandCount, groups.size());
        log.debug("stitching {} groups into a {}x{} window at ({}, {})", groups.size(), w, h, window.x(), window.y());

        List<double[]> slices = workers.map(groups.values(), members -> {
            double[] buffer = new double[sliceSize];
            Arrays.fill(buffer, fill);
            for (Map.Entry<TileKey, Tile> m : members) {
                PixelWindow tw = tiler.pixelWindowOf(m.getKey());
                int x0 = Math.max(tw.x(), window.x()), x1 = Math.min(tw.xEnd(), window.x() + w);
                int y0 = Math.max(tw.y(), window.y()), y1 = Math.min(tw.yEnd(), window.y() + h);
                if (x0 >= x1 || y0 >= y1) continue;
                Tile t = m.getValue();
                for (int b = 0; b < bandCount; b++) {
                    for (int px = x0; px < x1; px++) {
                        int col = px - tw.x() + bx;
                        for (int py = y0; py < y1; py++) {
                            // stitching space counts rows up from the bottom, tiles count down from the top
                            int row = tl.tileRows() - 1 - (py - tw.y()) + by;
                            buffer[(b * w + (px - window.x())) * h + (py - window.y())] = t.get(b, col, row);
                        }
                    }
                }
            }
            return buffer;
        });

        double[] values = new double[totalSize];
        for (int i = 0; i < slices.size(); i++) {
            System.arraycopy(slices.get(i), 0, values, i * sliceSize, sliceSize);
        }

        Extent windowExtent = tiler.extentOf(new PixelWindow(window.x(), window.y(), w, h));
        List<Object> xs = new ArrayList<>(w);
        for (int i = 0; i < w; i++) xs.add(windowExtent.xmin() + (i + 0.5) * layout.cellWidth());
        List<Object> ys = new ArrayList<>(h);
        for (int j = 0; j < h; j++) ys.add(windowExtent.ymin() + (j + 0.5) * layout.cellHeight());

        List<String> dims = new ArrayList<>();
        List<Integer> shape = new ArrayList<>();
        Map<String, List<?>> coords = new LinkedHashMap<>();
        if (temporal) {
            dims.add(CubeMetadata.T);
            shape.add(groups.size());
            coords.put(CubeMetadata.T, new ArrayList<>(groups.keySet()));
        }
        if (keepBands) {
            dims.add(CubeMetadata.BANDS);
            shape.add(bandCount);
            coords.put(CubeMetadata.BANDS, bandLabels(metadata, bandCount));
        }
        dims.add(CubeMetadata.X);
        shape.add(w);
        coords.put(CubeMetadata.X, xs);
        dims.add(CubeMetadata.Y);
        shape.add(h);
        coords.put(CubeMetadata.Y, ys);
        attrs.put("extent", Map.of("xmin", windowExtent.xmin(), "ymin", windowExtent.ymin(),
            "xmax", windowExtent.xmax(), "ymax", windowExtent.ymax()));

        return new DataArray(dims, shape.stream().mapToInt(Integer::intValue).toArray(), values, coords, attrs);
    }

    private static List<Object> bandLabels(CubeMetadata metadata, int bandCount) {
        List<String> names = metadata.bandNames();
        if (names.size() == bandCount) return new ArrayList<>(names);
        if (metadata.hasBandDimension())
            log.warn("metadata lists {} bands {} but tiles carry {}: using generated band names",
                names.size(), names, bandCount);
        List<Object> out = new ArrayList<>(bandCount);
        for (int b = 0; b < bandCount; b++) out.add("band_" + b);
        return out;
    }

    private static KeyBounds boundsOf(Map<Instant, List<Map.Entry<TileKey, Tile>>> groups) {
        int minCol = Integer.MAX_VALUE, minRow = Integer.MAX_VALUE;
        int maxCol = Integer.MIN_VALUE, maxRow = Integer.MIN_VALUE;
        for (List<Map.Entry<TileKey, Tile>> members : groups.values()) {
            for (Map.Entry<TileKey, Tile> m : members) {
                TileKey k = m.getKey();
                minCol = Math.min(minCol, k.col());
                minRow = Math.min(minRow, k.row());
                maxCol = Math.max(maxCol, k.col());
                maxRow = Math.max(maxRow, k.row());
            }
        }
        return new KeyBounds(minCol, minRow, maxCol, maxRow, null, null);
    }

    /** Cell count of the stitched array; fails when it does not fit a Java array. */
    private static int arraySize(int w, int h, int bandCount, int slices) {
        try {
            return Math.multiplyExact(Math.multiplyExact(Math.multiplyExact(w, h), bandCount), slices);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("stitch window " + w + "x" + h + " with " + bandCount + " band(s) and "
                + slices + " time step(s) is too large for a single array", e);
        }
    }
}
