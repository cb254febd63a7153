package com.tazifor.datacube.udf;

import com.tazifor.datacube.error.UdfContractViolationException;
import com.tazifor.datacube.error.UnsupportedCombinationException;
import com.tazifor.datacube.geo.model.Extent;
import com.tazifor.datacube.geo.model.LayoutDefinition;
import com.tazifor.datacube.geo.model.TileKey;
import com.tazifor.datacube.geo.spi.LayoutTiler;
import com.tazifor.datacube.model.CellType;
import com.tazifor.datacube.model.CubeMetadata;
import com.tazifor.datacube.model.DataArray;
import com.tazifor.datacube.model.Level;
import com.tazifor.datacube.model.Tile;
import com.tazifor.datacube.process.UdfReducer;
import com.tazifor.datacube.store.TileStore;
import com.tazifor.datacube.store.TileWorkerPool;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Runs user functions over the tiles of a level.
 * <p>
 * <b>Single mode</b> ({@link #applyTiles}) hands every tile to the function
 * on its own as a {@code (bands, x, y)} array. <b>Grouped mode</b>
 * ({@link #applyTilesSpatiotemporal}) collects all instants of a spatial key
 * into one {@code (t, bands, x, y)} array, sorted by instant. Either way the
 * function must answer with exactly one array, whose {@code x}/{@code y}
 * lengths match the tile.
 * </p>
 * The level is converted to {@code FLOAT32} first, so user code always sees
 * {@code NaN} for nodata. Tasks run on the {@link TileWorkerPool}; each one
 * builds its own envelope and script instance.
 */
@Slf4j
public class UdfPipeline {

    private static final String T = CubeMetadata.T;
    private static final String BANDS = CubeMetadata.BANDS;
    private static final String X = CubeMetadata.X;
    private static final String Y = CubeMetadata.Y;

    private final UdfRuntime runtime;
    private final TileStore store;
    private final TileWorkerPool workers;
    private final Map<String, Object> projection;
    private final CollapsedTimePolicy collapsedTimePolicy;
    private final Instant collapsedTimeLabel;

    public UdfPipeline(UdfRuntime runtime, TileStore store, TileWorkerPool workers, Map<String, Object> projection,
                       CollapsedTimePolicy collapsedTimePolicy, Instant collapsedTimeLabel) {
        this.runtime = runtime;
        this.store = store;
        this.workers = workers;
        this.projection = projection == null ? Map.of() : Map.copyOf(projection);
        this.collapsedTimePolicy = collapsedTimePolicy;
        this.collapsedTimeLabel = collapsedTimeLabel;
    }

    /**
     * Compiles the user code once. Callers do this before touching any tile
     * so that a broken function fails the request up front.
     */
    public CompiledUdf compile(UdfReducer udf) {
        return runtime.compile(udf.code());
    }

    public Level applyTiles(Level level, List<String> bandNames, UdfReducer udf, CompiledUdf function) {
        Level floats = store.convertCellType(level, CellType.FLOAT32);
        log.info("running {} udf on {} tiles ({})", runtime.name(), floats.size(), floats.tiler().name());

        List<Map.Entry<TileKey, Tile>> out = workers.map(floats.entries(), e -> {
            DataArray input = toArray(floats, e.getKey(), e.getValue(), bandNames);
            DataArray result = single(function.run(envelope(input, udf)), e.getKey());
            return Map.entry(e.getKey(), toTile(result, e.getValue().cols(), e.getValue().rows(), e.getKey()));
        });
        return floats.withTiles(Level.tileMap(out));
    }

    public Level applyTilesSpatiotemporal(Level level, List<String> bandNames, UdfReducer udf,
                                          CompiledUdf function) {
        if (level.isSpatial())
            throw new UnsupportedCombinationException("grouped udf execution needs a level with a time dimension");
        Level floats = store.convertCellType(level, CellType.FLOAT32);

        Map<TileKey, List<Map.Entry<TileKey, Tile>>> groups = new TreeMap<>(TileKey.ORDER);
        for (Map.Entry<TileKey, Tile> e : floats.tiles().entrySet()) {
            groups.computeIfAbsent(e.getKey().spatialKey(), k -> new ArrayList<>()).add(e);
        }
        log.info("running {} udf on {} spatial groups of {} tiles", runtime.name(), groups.size(), floats.size());

        List<Map.Entry<TileKey, Tile>> out = workers.flatMap(groups.entrySet(), g -> {
            List<Map.Entry<TileKey, Tile>> members = new ArrayList<>(g.getValue());
            members.sort(Comparator.comparing(m -> m.getKey().instant()));
            return applyToGroup(floats, g.getKey(), members, bandNames, function, udf);
        });
        return floats.withTiles(Level.tileMap(out));
    }

    private List<Map.Entry<TileKey, Tile>> applyToGroup(Level level, TileKey spatialKey,
                                                       List<Map.Entry<TileKey, Tile>> members, List<String> bandNames,
                                                       CompiledUdf function, UdfReducer udf) {
        List<Instant> instants = new ArrayList<>(members.size());
        List<DataArray> slices = new ArrayList<>(members.size());
        for (Map.Entry<TileKey, Tile> m : members) {
            instants.add(m.getKey().instant());
            slices.add(toArray(level, m.getKey(), m.getValue(), bandNames));
        }
        log.debug("group {} stacks {} instants", spatialKey, instants.size());
        DataArray stacked = DataArray.stack(T, instants, slices);
        DataArray result = single(function.run(envelope(stacked, udf)), spatialKey);

        Tile template = members.get(0).getValue();
        if (!result.hasDim(T)) {
            TileKey key = spatialKey.withInstant(collapsedTimePolicy.resolve(instants, collapsedTimeLabel));
            return List.of(Map.entry(key, toTile(result, template.cols(), template.rows(), key)));
        }

        List<Object> labels = result.coords(T);
        int length = result.length(T);
        if (labels.isEmpty() && length != instants.size())
            throw new UdfContractViolationException("udf result for " + spatialKey + " has " + length
                + " time steps without labels");
        List<Map.Entry<TileKey, Tile>> out = new ArrayList<>(length);
        Set<Instant> seen = new HashSet<>();
        for (int i = 0; i < length; i++) {
            Instant instant = labels.isEmpty() ? instants.get(i) : toInstant(labels.get(i), spatialKey);
            if (!seen.add(instant))
                throw new UdfContractViolationException("udf result for " + spatialKey + " repeats instant " + instant);
            TileKey key = spatialKey.withInstant(instant);
            out.add(Map.entry(key, toTile(result.isel(T, i), template.cols(), template.rows(), key)));
        }
        return out;
    }

    private UdfData envelope(DataArray array, UdfReducer udf) {
        List<DataArray> cubes = new ArrayList<>();
        cubes.add(array);
        return new UdfData(new LinkedHashMap<>(projection), cubes, new LinkedHashMap<>(udf.context()));
    }

    private static DataArray single(List<DataArray> results, TileKey key) {
        if (results.size() != 1)
            throw new UdfContractViolationException("udf must return exactly one array, got " + results.size()
                + " for " + key);
        return results.get(0);
    }

    /**
     * Builds the {@code (bands, x, y)} array of one tile, or a bare
     * {@code (bands)} array for single-pixel tiles. Coordinates are pixel
     * centers; y runs from the top row down.
     */
    static DataArray toArray(Level level, TileKey key, Tile tile, List<String> bandNames) {
        LayoutDefinition layout = level.layout();
        double cw = layout.cellWidth(), ch = layout.cellHeight();
        Extent extent = new LayoutTiler(layout).extentOf(key).buffer(level.bufferX() * cw, level.bufferY() * ch);

        int bands = tile.bandCount(), cols = tile.cols(), rows = tile.rows();
        List<Object> bandLabels = new ArrayList<>(bands);
        for (int b = 0; b < bands; b++) {
            bandLabels.add(bandNames != null && bandNames.size() == bands ? bandNames.get(b) : "band_" + b);
        }
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("extent", Map.of("xmin", extent.xmin(), "ymin", extent.ymin(),
            "xmax", extent.xmax(), "ymax", extent.ymax()));
        attrs.put("crs", level.crs());

        if (cols == 1 && rows == 1) {
            double[] values = new double[bands];
            for (int b = 0; b < bands; b++) values[b] = tile.get(b, 0, 0);
            return new DataArray(List.of(BANDS), new int[]{bands}, values, Map.of(BANDS, bandLabels), attrs);
        }

        double[] values = new double[bands * cols * rows];
        int i = 0;
        for (int b = 0; b < bands; b++) {
            for (int c = 0; c < cols; c++) {
                for (int r = 0; r < rows; r++) {
                    values[i++] = tile.get(b, c, r);
                }
            }
        }
        List<Object> xs = new ArrayList<>(cols);
        for (int c = 0; c < cols; c++) xs.add(extent.xmin() + (c + 0.5) * cw);
        List<Object> ys = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) ys.add(extent.ymax() - (r + 0.5) * ch);

        Map<String, List<?>> coords = new LinkedHashMap<>();
        coords.put(BANDS, bandLabels);
        coords.put(X, xs);
        coords.put(Y, ys);
        return new DataArray(List.of(BANDS, X, Y), new int[]{bands, cols, rows}, values, coords, attrs);
    }

    /**
     * Decodes a udf result back into a {@code FLOAT32} tile of the given
     * size. Only {@code bands}, {@code x} and {@code y} may remain.
     */
    static Tile toTile(DataArray result, int cols, int rows, TileKey key) {
        for (String dim : result.dims()) {
            if (!dim.equals(BANDS) && !dim.equals(X) && !dim.equals(Y))
                throw new UdfContractViolationException("udf result for " + key + " has unexpected dimension '"
                    + dim + "' in " + result.dims());
        }
        DataArray arr = result;
        if (!arr.hasDim(X) && !arr.hasDim(Y)) {
            if (cols != 1 || rows != 1)
                throw new UdfContractViolationException("udf result for " + key + " lost its x/y dimensions");
            arr = arr.expandDims(Y, null).expandDims(X, null);
        } else if (!arr.hasDim(X) || !arr.hasDim(Y)) {
            throw new UdfContractViolationException("udf result for " + key + " must keep both x and y, got "
                + arr.dims());
        }
        if (!arr.hasDim(BANDS)) arr = arr.expandDims(BANDS, null);
        if (arr.length(X) != cols || arr.length(Y) != rows)
            throw new UdfContractViolationException("udf result for " + key + " measures " + arr.length(X) + "x"
                + arr.length(Y) + ", expected " + cols + "x" + rows);

        double[] values = arr.transpose(List.of(BANDS, Y, X)).values();
        int n = cols * rows;
        int bands = arr.length(BANDS);
        if (bands == 0)
            throw new UdfContractViolationException("udf result for " + key + " has no bands");
        double[][] cells = new double[bands][];
        for (int b = 0; b < bands; b++) {
            cells[b] = Arrays.copyOfRange(values, b * n, (b + 1) * n);
        }
        return Tile.wrap(cols, rows, CellType.FLOAT32, Double.NaN, cells);
    }

    private static Instant toInstant(Object label, TileKey key) {
        if (label instanceof Instant) return (Instant) label;
        if (label instanceof CharSequence) {
            try {
                return Instant.parse(label.toString());
            } catch (DateTimeParseException e) {
                throw new UdfContractViolationException("udf result for " + key + " has time label '" + label
                    + "' that is not an ISO instant");
            }
        }
        throw new UdfContractViolationException("udf result for " + key + " has time label of type "
            + (label == null ? "null" : label.getClass().getName()));
    }
}
