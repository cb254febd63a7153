package com.tazifor.datacube.store;

import com.tazifor.datacube.geo.model.*;
import com.tazifor.datacube.geo.spi.LayoutTiler;
import com.tazifor.datacube.geo.util.Geo;
import com.tazifor.datacube.model.CellType;
import com.tazifor.datacube.model.LayerType;
import com.tazifor.datacube.model.Level;
import com.tazifor.datacube.model.Tile;
import com.tazifor.datacube.process.AggregateFunction;
import com.tazifor.datacube.process.BandExpression;
import com.tazifor.datacube.process.ResampleMethod;
import com.tazifor.datacube.process.TemporalInterval;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.*;
import java.util.function.UnaryOperator;

/**
 * In-process {@link TileStore}: every per-tile (or per-key-group) task runs
 * on the shared {@link TileWorkerPool}.
 */
@Slf4j
public class LocalTileStore implements TileStore {

    private static final Comparator<Instant> INSTANT_ORDER = Comparator.nullsFirst(Comparator.naturalOrder());

    private final TileWorkerPool workers;

    public LocalTileStore(TileWorkerPool workers) {
        this.workers = workers;
    }

    @Override
    public Level convertCellType(Level level, CellType cellType) {
        if (level.cellType() == cellType) return level;
        Level converted = mapTiles(level, t -> t.convert(cellType));
        Double noData = cellType.isFloatingPoint() ? Double.valueOf(Double.NaN)
            : level.noData() != null && cellType.canHold(level.noData()) ? level.noData()
            : Double.valueOf(cellType.defaultNoData());
        return converted.toBuilder().cellType(cellType).noData(noData).build();
    }

    @Override
    public Level aggregateByCell(Level level, AggregateFunction function) {
        Map<TileKey, List<Tile>> groups = new TreeMap<>(TileKey.ORDER);
        for (Map.Entry<TileKey, Tile> e : level.tiles().entrySet()) {
            groups.computeIfAbsent(e.getKey().spatialKey(), k -> new ArrayList<>()).add(e.getValue());
        }
        List<Map.Entry<TileKey, Tile>> out = workers.map(groups.entrySet(),
            g -> Map.entry(g.getKey(), reduceCells(g.getValue(), function)));
        return level.toBuilder()
            .type(LayerType.SPATIAL)
            .cellType(CellType.FLOAT32)
            .noData(Double.NaN)
            .tiles(Level.tileMap(out))
            .build();
    }

    @Override
    public Level aggregateTemporal(Level level, List<TemporalInterval> intervals, List<Instant> labels,
                                   AggregateFunction function) {
        if (intervals.size() != labels.size())
            throw new IllegalArgumentException(intervals.size() + " intervals but " + labels.size() + " labels");
        Map<TileKey, List<Tile>> groups = new TreeMap<>(TileKey.ORDER);
        for (Map.Entry<TileKey, Tile> e : level.tiles().entrySet()) {
            Instant instant = e.getKey().instant();
            if (instant == null) continue;
            for (int i = 0; i < intervals.size(); i++) {
                if (intervals.get(i).contains(instant)) {
                    groups.computeIfAbsent(e.getKey().withInstant(labels.get(i)), k -> new ArrayList<>())
                        .add(e.getValue());
                }
            }
        }
        List<Map.Entry<TileKey, Tile>> out = workers.map(groups.entrySet(),
            g -> Map.entry(g.getKey(), reduceCells(g.getValue(), function)));
        return level.toBuilder()
            .cellType(CellType.FLOAT32)
            .noData(Double.NaN)
            .tiles(Level.tileMap(out))
            .build();
    }

    @Override
    public Level mapBands(Level level, List<BandExpression> expressions) {
        if (expressions.isEmpty())
            throw new IllegalArgumentException("at least one band expression is required");
        Level mapped = mapTiles(level, t -> {
            int n = t.cols() * t.rows();
            double[][] out = new double[expressions.size()][n];
            double[] pixel = new double[t.bandCount()];
            for (int i = 0; i < n; i++) {
                int col = i % t.cols(), row = i / t.cols();
                for (int b = 0; b < pixel.length; b++) {
                    double v = t.get(b, col, row);
                    pixel[b] = t.isNoData(v) ? Double.NaN : v;
                }
                for (int e = 0; e < out.length; e++) {
                    out[e][i] = expressions.get(e).evaluate(pixel);
                }
            }
            return Tile.wrap(t.cols(), t.rows(), CellType.FLOAT32, Double.NaN, out);
        });
        return mapped.toBuilder().cellType(CellType.FLOAT32).noData(Double.NaN).build();
    }

    @Override
    public Level mapCells(Level level, BandExpression expression) {
        Level floats = convertCellType(level, CellType.FLOAT32);
        return mapTiles(floats, t -> t.mapCells(v -> {
            double[] cell = {v};
            return expression.evaluate(cell);
        }));
    }

    @Override
    public Level mask(Level level, Polygon polygon) {
        LayoutTiler tiler = level.tiler();
        LayoutDefinition layout = level.layout();
        double cw = layout.cellWidth(), ch = layout.cellHeight();
        Extent bounds = polygon.bounds();
        double noData = level.noData() != null ? level.noData() : level.cellType().defaultNoData();

        List<Map.Entry<TileKey, Tile>> candidates = new ArrayList<>();
        for (Map.Entry<TileKey, Tile> e : level.tiles().entrySet()) {
            Extent tileExtent = tiler.extentOf(e.getKey()).buffer(level.bufferX() * cw, level.bufferY() * ch);
            if (tileExtent.intersects(bounds)) candidates.add(e);
        }
        List<Map.Entry<TileKey, Tile>> out = workers.map(candidates, e -> {
            Tile t = e.getValue();
            Extent tileExtent = tiler.extentOf(e.getKey()).buffer(level.bufferX() * cw, level.bufferY() * ch);
            double[][] cells = new double[t.bandCount()][];
            for (int b = 0; b < cells.length; b++) cells[b] = t.band(b);
            for (int r = 0; r < t.rows(); r++) {
                double y = tileExtent.ymax() - (r + 0.5) * ch;
                for (int c = 0; c < t.cols(); c++) {
                    double x = tileExtent.xmin() + (c + 0.5) * cw;
                    if (!Geo.pointInPolygon(Point.of(x, y), polygon)) {
                        for (double[] band : cells) band[r * t.cols() + c] = noData;
                    }
                }
            }
            return Map.entry(e.getKey(), Tile.wrap(t.cols(), t.rows(), t.cellType(), noData, cells));
        });
        log.debug("mask kept {} of {} tiles", out.size(), level.size());
        return level.toBuilder().noData(noData).tiles(Level.tileMap(out)).build();
    }

    @Override
    public Level filterTemporal(Level level, Instant from, Instant to) {
        if (level.isSpatial()) return level;
        Map<TileKey, Tile> kept = new LinkedHashMap<>();
        level.tiles().forEach((k, t) -> {
            if ((from == null || !k.instant().isBefore(from)) && (to == null || !k.instant().isAfter(to)))
                kept.put(k, t);
        });
        return level.withTiles(kept);
    }

    @Override
    public Level selectBands(Level level, int... bandIndices) {
        return mapTiles(level, t -> t.selectBands(bandIndices));
    }

    @Override
    public Level normalize(Level level, double inMin, double inMax, double outMin, double outMax) {
        if (inMax == inMin)
            throw new IllegalArgumentException("input range must not be empty");
        double scale = (outMax - outMin) / (inMax - inMin);
        Level floats = convertCellType(level, CellType.FLOAT32);
        return mapTiles(floats, t -> t.mapCells(v -> {
            double clamped = Math.max(inMin, Math.min(inMax, v));
            return (clamped - inMin) * scale + outMin;
        }));
    }

    @Override
    public Level toSpatial(Level level) {
        if (level.isSpatial()) return level;
        Map<TileKey, List<Tile>> groups = new TreeMap<>(TileKey.ORDER);
        // tiles() iterates by instant within each key, so earliest comes first
        level.tiles().forEach((k, t) -> groups.computeIfAbsent(k.spatialKey(), x -> new ArrayList<>()).add(t));
        List<Map.Entry<TileKey, Tile>> out = workers.map(groups.entrySet(),
            g -> Map.entry(g.getKey(), overlay(g.getValue())));
        return level.toBuilder().type(LayerType.SPATIAL).tiles(Level.tileMap(out)).build();
    }

    @Override
    public Level resample(Level level, LayoutDefinition target, ResampleMethod method) {
        LayoutTiler sourceTiler = level.tiler();
        LayoutTiler targetTiler = new LayoutTiler(target);
        int bandCount = level.bandCount();

        Map<Instant, Map<TileKey, Tile>> byInstant = byInstant(level);
        Map<Instant, LevelSampler> samplers = new HashMap<>();
        Map<Instant, Set<TileKey>> targetKeys = new TreeMap<>(INSTANT_ORDER);
        for (Map.Entry<Instant, Map<TileKey, Tile>> group : byInstant.entrySet()) {
            samplers.put(group.getKey(), new LevelSampler(level.layout(), group.getValue(), level.bufferX(), level.bufferY()));
            Set<TileKey> keys = new LinkedHashSet<>();
            for (TileKey k : group.getValue().keySet()) {
                keys.addAll(targetTiler.keysCovering(sourceTiler.extentOf(k)));
            }
            targetKeys.put(group.getKey(), keys);
        }

        List<TileKey> allTargets = new ArrayList<>();
        targetKeys.forEach((instant, keys) -> keys.forEach(k -> allTargets.add(k.withInstant(instant))));

        TileLayout tl = target.tileLayout();
        double cw = target.cellWidth(), ch = target.cellHeight();
        CellType cellType = method == ResampleMethod.BILINEAR ? CellType.FLOAT32 : level.cellType();
        Double noData = cellType.isFloatingPoint() ? Double.valueOf(Double.NaN)
            : level.noData() != null ? level.noData() : Double.valueOf(cellType.defaultNoData());
        double fill = noData;

        List<Optional<Map.Entry<TileKey, Tile>>> resampled = workers.map(allTargets, key -> {
            LevelSampler sampler = samplers.get(key.instant());
            Extent ext = targetTiler.extentOf(key);
            double[][] cells = new double[bandCount][tl.tileCols() * tl.tileRows()];
            boolean any = false;
            for (int r = 0; r < tl.tileRows(); r++) {
                double y = ext.ymax() - (r + 0.5) * ch;
                for (int c = 0; c < tl.tileCols(); c++) {
                    double x = ext.xmin() + (c + 0.5) * cw;
                    for (int b = 0; b < bandCount; b++) {
                        double v = method == ResampleMethod.BILINEAR ? sampler.bilinear(b, x, y) : sampler.nearest(b, x, y);
                        if (Double.isNaN(v)) {
                            cells[b][r * tl.tileCols() + c] = fill;
                        } else {
                            cells[b][r * tl.tileCols() + c] = cellType.convert(v);
                            any = true;
                        }
                    }
                }
            }
            if (!any) return Optional.empty();
            return Optional.of(Map.entry(key, Tile.wrap(tl.tileCols(), tl.tileRows(), cellType, noData, cells)));
        });
        List<Map.Entry<TileKey, Tile>> out = new ArrayList<>();
        resampled.forEach(o -> o.ifPresent(out::add));
        log.debug("resampled {} tiles of {} onto {} tiles of {}", level.size(), sourceTiler.name(), out.size(), targetTiler.name());
        return level.toBuilder()
            .layout(target)
            .cellType(cellType)
            .noData(noData)
            .bufferX(0)
            .bufferY(0)
            .tiles(Level.tileMap(out))
            .build();
    }

    @Override
    public Level merge(Level left, Level right, AggregateFunction overlapResolver) {
        if (left.isSpatial() && right.isSpatial())
            throw new IllegalArgumentException("merging needs at least one spacetime level");
        if (!left.layout().equals(right.layout()))
            throw new IllegalArgumentException("merged levels must share a layout, got " + left.tiler().name()
                + " and " + right.tiler().name());
        if (left.bufferX() + left.bufferY() + right.bufferX() + right.bufferY() != 0)
            throw new IllegalArgumentException("buffered levels cannot be merged");
        int leftBands = left.bandCount(), rightBands = right.bandCount();
        if (overlapResolver != null && leftBands > 0 && rightBands > 0 && leftBands != rightBands)
            throw new IllegalArgumentException("an overlap resolver needs the same bands on both sides, got "
                + leftBands + " and " + rightBands);

        boolean sameCells = left.cellType() == right.cellType() && Objects.equals(left.noData(), right.noData());
        CellType cellType = overlapResolver == null && sameCells ? left.cellType() : CellType.FLOAT32;
        Double noData = cellType.isFloatingPoint() ? Double.valueOf(Double.NaN)
            : left.noData() != null ? left.noData() : Double.valueOf(cellType.defaultNoData());
        double fill = noData;

        Level timed = left.isSpatial() ? right : left;
        Set<TileKey> keys = new TreeSet<>(TileKey.ORDER);
        keys.addAll(timed.tiles().keySet());
        if (!left.isSpatial() && !right.isSpatial()) keys.addAll(right.tiles().keySet());

        TileLayout tl = left.layout().tileLayout();
        int n = tl.tileCols() * tl.tileRows();
        List<Map.Entry<TileKey, Tile>> out = workers.map(new ArrayList<>(keys), key -> {
            Tile a = matching(left, key), b = matching(right, key);
            double[][] cells;
            if (overlapResolver == null) {
                cells = new double[leftBands + rightBands][];
                for (int i = 0; i < leftBands; i++) cells[i] = bandOrFill(a, i, n, cellType, fill);
                for (int i = 0; i < rightBands; i++) cells[leftBands + i] = bandOrFill(b, i, n, cellType, fill);
            } else {
                cells = new double[Math.max(leftBands, rightBands)][];
                for (int i = 0; i < cells.length; i++) {
                    cells[i] = a != null && b != null ? resolve(a, b, i, overlapResolver)
                        : bandOrFill(a != null ? a : b, i, n, cellType, fill);
                }
            }
            return Map.entry(key, Tile.wrap(tl.tileCols(), tl.tileRows(), cellType, noData, cells));
        });
        log.debug("merged {} and {} tiles into {}", left.size(), right.size(), out.size());
        return timed.toBuilder().cellType(cellType).noData(noData).tiles(Level.tileMap(out)).build();
    }

    @Override
    public Level rasterMask(Level level, Level mask, Double replacement) {
        if (!level.layout().equals(mask.layout()))
            throw new IllegalArgumentException("mask must share the layout of the data, got " + mask.tiler().name()
                + " and " + level.tiler().name());
        if (mask.bufferX() != level.bufferX() || mask.bufferY() != level.bufferY())
            throw new IllegalArgumentException("mask and data must carry the same buffers");
        if (level.isSpatial() && !mask.isSpatial())
            throw new IllegalArgumentException("a spacetime mask cannot be applied to a spatial level");
        int maskBands = mask.bandCount(), bands = level.bandCount();
        if (maskBands > 1 && maskBands != bands)
            throw new IllegalArgumentException("mask has " + maskBands + " bands, data has " + bands);

        CellType cellType = level.cellType();
        double noData = level.noData() != null ? level.noData() : cellType.defaultNoData();
        double value = replacement == null ? noData : cellType.convert(replacement);
        List<Map.Entry<TileKey, Tile>> out = workers.map(level.entries(), e -> {
            Tile m = matching(mask, e.getKey());
            if (m == null) return e;
            Tile t = e.getValue();
            double[][] cells = new double[t.bandCount()][];
            for (int b = 0; b < cells.length; b++) {
                cells[b] = t.band(b);
                int mb = maskBands == 1 ? 0 : b;
                for (int i = 0; i < cells[b].length; i++) {
                    if (t.isNoData(cells[b][i])) {
                        cells[b][i] = noData;
                        continue;
                    }
                    double flag = m.get(mb, i % t.cols(), i / t.cols());
                    if (!m.isNoData(flag) && flag != 0) cells[b][i] = value;
                }
            }
            return Map.entry(e.getKey(), Tile.wrap(t.cols(), t.rows(), cellType, noData, cells));
        });
        return level.toBuilder().noData(noData).tiles(Level.tileMap(out)).build();
    }

    @Override
    public Level applyKernel(Level level, double[][] kernel, double border, double replaceInvalid) {
        if (kernel.length == 0 || kernel[0].length == 0)
            throw new IllegalArgumentException("kernel must not be empty");
        int kh = kernel.length, kw = kernel[0].length;
        for (double[] row : kernel) {
            if (row.length != kw) throw new IllegalArgumentException("kernel rows must all have " + kw + " values");
        }
        if (kh % 2 == 0 || kw % 2 == 0)
            throw new IllegalArgumentException("kernel must have odd dimensions, got " + kh + "x" + kw);
        if (level.bufferX() != 0 || level.bufferY() != 0)
            throw new IllegalArgumentException("kernels run on unbuffered levels");

        Map<Instant, LevelSampler> samplers = new HashMap<>();
        byInstant(level).forEach((instant, tiles) ->
            samplers.put(instant, new LevelSampler(level.layout(), tiles, 0, 0)));
        TileLayout tl = level.layout().tileLayout();
        int cols = tl.tileCols(), rows = tl.tileRows();
        int bandCount = level.bandCount();

        List<Map.Entry<TileKey, Tile>> out = workers.map(level.entries(), e -> {
            LevelSampler sampler = samplers.get(e.getKey().instant());
            int gx0 = e.getKey().col() * cols - kw / 2, gy0 = e.getKey().row() * rows - kh / 2;
            double[][] cells = new double[bandCount][cols * rows];
            for (int b = 0; b < bandCount; b++) {
                for (int r = 0; r < rows; r++) {
                    for (int c = 0; c < cols; c++) {
                        double sum = 0;
                        for (int i = 0; i < kh; i++) {
                            for (int j = 0; j < kw; j++) {
                                int gx = gx0 + c + j, gy = gy0 + r + i;
                                double v;
                                if (!sampler.covers(gx, gy)) {
                                    v = border;
                                } else {
                                    v = sampler.sample(b, gx, gy);
                                    if (Double.isNaN(v)) v = replaceInvalid;
                                }
                                sum += kernel[i][j] * v;
                            }
                        }
                        cells[b][r * cols + c] = CellType.FLOAT32.convert(sum);
                    }
                }
            }
            return Map.entry(e.getKey(), Tile.wrap(cols, rows, CellType.FLOAT32, Double.NaN, cells));
        });
        log.debug("applied a {}x{} kernel to {} tiles", kh, kw, out.size());
        return level.toBuilder().cellType(CellType.FLOAT32).noData(Double.NaN).tiles(Level.tileMap(out)).build();
    }

    /**
     * Groups the tiles of a level by instant, ascending, spatial keys first.
     */
    static Map<Instant, Map<TileKey, Tile>> byInstant(Level level) {
        Map<Instant, Map<TileKey, Tile>> out = new TreeMap<>(INSTANT_ORDER);
        level.tiles().forEach((k, t) -> out.computeIfAbsent(k.instant(), i -> new LinkedHashMap<>()).put(k, t));
        return out;
    }

    /** The tile of {@code level} for {@code key}; spatial levels match on the spatial key. */
    private static Tile matching(Level level, TileKey key) {
        return level.tile(level.isSpatial() ? key.spatialKey() : key);
    }

    private static double[] bandOrFill(Tile t, int band, int n, CellType cellType, double fill) {
        double[] out = new double[n];
        if (t == null) {
            Arrays.fill(out, fill);
            return out;
        }
        for (int i = 0; i < n; i++) {
            double v = t.get(band, i % t.cols(), i / t.cols());
            out[i] = t.isNoData(v) ? fill : cellType.convert(v);
        }
        return out;
    }

    private static double[] resolve(Tile a, Tile b, int band, AggregateFunction function) {
        double[] out = new double[a.cols() * a.rows()];
        double[] pair = new double[2];
        for (int i = 0; i < out.length; i++) {
            int col = i % a.cols(), row = i / a.cols();
            double va = a.get(band, col, row), vb = b.get(band, col, row);
            pair[0] = a.isNoData(va) ? Double.NaN : va;
            pair[1] = b.isNoData(vb) ? Double.NaN : vb;
            out[i] = CellType.FLOAT32.convert(function.apply(pair));
        }
        return out;
    }

    private Level mapTiles(Level level, UnaryOperator<Tile> op) {
        List<Map.Entry<TileKey, Tile>> out = workers.map(level.entries(),
            e -> Map.entry(e.getKey(), op.apply(e.getValue())));
        return level.withTiles(Level.tileMap(out));
    }

    private static Tile reduceCells(List<Tile> tiles, AggregateFunction function) {
        Tile first = tiles.get(0);
        int n = first.cols() * first.rows();
        double[][] out = new double[first.bandCount()][n];
        double[] stack = new double[tiles.size()];
        for (int b = 0; b < out.length; b++) {
            for (int i = 0; i < n; i++) {
                int col = i % first.cols(), row = i / first.cols();
                for (int s = 0; s < stack.length; s++) {
                    Tile t = tiles.get(s);
                    double v = t.get(b, col, row);
                    stack[s] = t.isNoData(v) ? Double.NaN : v;
                }
                out[b][i] = function.apply(stack);
            }
        }
        return Tile.wrap(first.cols(), first.rows(), CellType.FLOAT32, Double.NaN, out);
    }

    /** First tile wins; its nodata cells are filled from the following tiles. */
    private static Tile overlay(List<Tile> tiles) {
        Tile first = tiles.get(0);
        if (tiles.size() == 1) return first;
        double[][] cells = new double[first.bandCount()][];
        for (int b = 0; b < cells.length; b++) {
            cells[b] = first.band(b);
            for (int i = 0; i < cells[b].length; i++) {
                if (!first.isNoData(cells[b][i])) continue;
                int col = i % first.cols(), row = i / first.cols();
                for (int s = 1; s < tiles.size(); s++) {
                    double v = tiles.get(s).get(b, col, row);
                    if (!tiles.get(s).isNoData(v)) {
                        cells[b][i] = v;
                        break;
                    }
                }
            }
        }
        return Tile.wrap(first.cols(), first.rows(), first.cellType(), first.noData(), cells);
    }
}
