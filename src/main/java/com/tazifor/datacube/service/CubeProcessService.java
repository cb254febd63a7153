package com.tazifor.datacube.service;

import com.tazifor.datacube.error.AmbiguousBandException;
import com.tazifor.datacube.error.BandExistsException;
import com.tazifor.datacube.error.FeatureUnsupportedException;
import com.tazifor.datacube.error.KernelDimensionsUnevenException;
import com.tazifor.datacube.error.UnsupportedCombinationException;
import com.tazifor.datacube.error.UnsupportedDimensionException;
import com.tazifor.datacube.geo.model.*;
import com.tazifor.datacube.geo.spi.LayoutTiler;
import com.tazifor.datacube.model.*;
import com.tazifor.datacube.process.*;
import com.tazifor.datacube.store.TileStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Cube processes that map onto a single tile store primitive, plus the
 * band-resolution logic of NDVI and point time series.
 */
@Slf4j
@Service
public class CubeProcessService {

    /** Tile size used when resampling onto a new resolution. */
    static final int RESAMPLE_TILE_SIZE = 256;

    private final TileStore store;

    public CubeProcessService(TileStore store) {
        this.store = store;
    }

    public DataCube filterTemporal(DataCube cube, Instant from, Instant to) {
        return cube.applyToLevels(level -> store.filterTemporal(level, from, to));
    }

    public DataCube filterBands(DataCube cube, List<String> bands) {
        CubeMetadata md = cube.metadata();
        if (!md.hasBandDimension())
            throw new UnsupportedDimensionException("cannot filter bands of a cube without a band dimension");
        List<String> names = md.bandNames();
        int[] indices = new int[bands.size()];
        for (int i = 0; i < bands.size(); i++) {
            indices[i] = names.indexOf(bands.get(i));
            if (indices[i] < 0)
                throw new IllegalArgumentException("no band named '" + bands.get(i) + "', available bands are " + names);
        }
        return cube.applyToLevels(level -> store.selectBands(level, indices)).withMetadata(md.filterBands(bands));
    }

    /**
     * Clamps values to {@code [inMin, inMax]} and scales them onto
     * {@code [outMin, outMax]}. Whole-number output ranges are stored as
     * {@code UINT8} (nodata 255) when they fit below 255, otherwise as
     * {@code INT16} when they fit that type.
     */
    public DataCube linearScaleRange(DataCube cube, double inMin, double inMax, double outMin, double outMax) {
        CellType target = narrowestType(outMin, outMax);
        log.info("linear_scale_range [{}, {}] -> [{}, {}] as {}", inMin, inMax, outMin, outMax, target.typeName());
        return cube.applyToLevels(level -> {
            Level scaled = store.normalize(level, inMin, inMax, outMin, outMax);
            return target == CellType.FLOAT32 ? scaled : store.convertCellType(scaled, target);
        });
    }

    static CellType narrowestType(double outMin, double outMax) {
        boolean whole = outMin == Math.rint(outMin) && outMax == Math.rint(outMax);
        if (!whole) return CellType.FLOAT32;
        double lo = Math.min(outMin, outMax), hi = Math.max(outMin, outMax);
        if (lo >= 0 && hi < 255) return CellType.UINT8;
        if (lo > Short.MIN_VALUE && hi <= Short.MAX_VALUE) return CellType.INT16;
        return CellType.FLOAT32;
    }

    public DataCube maskPolygon(DataCube cube, Polygon polygon) {
        return cube.applyToLevels(level -> store.mask(level, polygon));
    }

    /**
     * Groups instants into left-closed intervals, labels each group and
     * reduces it per cell.
     */
    public DataCube aggregateTemporal(DataCube cube, List<TemporalInterval> intervals, List<Instant> labels,
                                      Reducer reducer) {
        if (!cube.metadata().hasTemporalDimension())
            throw new UnsupportedDimensionException("aggregate_temporal needs a temporal dimension");
        if (intervals.size() != labels.size())
            throw new IllegalArgumentException(intervals.size() + " intervals but " + labels.size() + " labels");
        if (!(reducer instanceof BuiltinReducer))
            throw new UnsupportedCombinationException("aggregate_temporal does not support " + reducer.kind());
        AggregateFunction function = ((BuiltinReducer) reducer).function().orElseThrow(() ->
            new UnsupportedCombinationException("aggregate_temporal does not support " + reducer.kind()));
        return cube.applyToLevels(level -> store.aggregateTemporal(level, intervals, labels, function));
    }

    /**
     * Re-lays the highest level onto {@value #RESAMPLE_TILE_SIZE}-pixel tiles
     * of the given cell size, anchored at the top-left corner of the data.
     * A resolution of 0 leaves the cube unchanged. The result has a single
     * level.
     */
    public DataCube resampleSpatial(DataCube cube, double resolution, ResampleMethod method) {
        if (resolution < 0)
            throw new IllegalArgumentException("resolution must not be negative: " + resolution);
        Level level = cube.highestLevel();
        if (resolution == 0 || level.isEmpty()) return cube;

        KeyBounds kb = level.keyBounds().orElseThrow();
        LayoutTiler tiler = level.tiler();
        Extent topLeft = tiler.extentOf(TileKey.of(kb.minCol(), kb.minRow()));
        Extent bottomRight = tiler.extentOf(TileKey.of(kb.maxCol(), kb.maxRow()));
        int totalCols = (int) Math.ceil((bottomRight.xmax() - topLeft.xmin()) / resolution - 1e-9);
        int totalRows = (int) Math.ceil((topLeft.ymax() - bottomRight.ymin()) / resolution - 1e-9);
        int layoutCols = Math.max(1, (totalCols + RESAMPLE_TILE_SIZE - 1) / RESAMPLE_TILE_SIZE);
        int layoutRows = Math.max(1, (totalRows + RESAMPLE_TILE_SIZE - 1) / RESAMPLE_TILE_SIZE);
        double span = RESAMPLE_TILE_SIZE * resolution;
        Extent extent = new Extent(topLeft.xmin(), topLeft.ymax() - layoutRows * span,
            topLeft.xmin() + layoutCols * span, topLeft.ymax());
        LayoutDefinition target = new LayoutDefinition(extent,
            new TileLayout(layoutCols, layoutRows, RESAMPLE_TILE_SIZE, RESAMPLE_TILE_SIZE));

        log.info("resample_spatial to {} ({}): {}", resolution, method, new LayoutTiler(target).name());
        return DataCube.of(store.resample(level, target, method), cube.metadata());
    }

    /**
     * Resamples {@code cube} onto the layout of {@code target}. Both cubes
     * must be single-level and share a coordinate reference system.
     */
    public DataCube resampleCubeSpatial(DataCube cube, DataCube target, ResampleMethod method) {
        if (cube.pyramid().levels().size() != 1 || target.pyramid().levels().size() != 1)
            throw new FeatureUnsupportedException("resample_cube_spatial only supports single-level pyramids, got "
                + cube.pyramid().levels().size() + " and " + target.pyramid().levels().size() + " levels");
        Level source = cube.highestLevel();
        Level reference = target.highestLevel();
        if (!source.crs().equals(reference.crs()))
            throw new FeatureUnsupportedException("resample_cube_spatial cannot reproject from " + source.crs()
                + " to " + reference.crs());
        return cube.applyToLevels(level -> store.resample(level, reference.layout(), method));
    }

    /**
     * Combines two cubes level by level.
     * <p>
     * Without a resolver the bands of {@code other} follow the bands of
     * {@code cube}; a band name present in both is an error. With a built-in
     * resolver both cubes must carry the same bands and overlapping cells
     * are reduced with it. A cube without time is repeated for every
     * instant of the other one, and the result keeps the dimensions of the
     * cube with time.
     * </p>
     *
     * @param overlapResolver a {@link BuiltinReducer}, or {@code null}
     */
    public DataCube mergeCubes(DataCube cube, DataCube other, Reducer overlapResolver) {
        CubeMetadata md = cube.metadata(), otherMd = other.metadata();
        if (md.hasBandDimension() != otherMd.hasBandDimension())
            throw new UnsupportedCombinationException("merge_cubes needs a band dimension on both cubes or on neither");
        if (cube.isSpatial() && other.isSpatial())
            throw new FeatureUnsupportedException("merge_cubes does not support two cubes without a time dimension");

        AggregateFunction resolver = null;
        List<Band> bands = new ArrayList<>(md.bands());
        if (overlapResolver == null) {
            List<String> shared = new ArrayList<>(otherMd.bandNames());
            shared.retainAll(md.bandNames());
            if (!shared.isEmpty())
                throw new UnsupportedCombinationException("bands " + shared + " exist in both cubes, merge_cubes needs"
                    + " an overlap resolver");
            bands.addAll(otherMd.bands());
        } else {
            if (!(overlapResolver instanceof BuiltinReducer))
                throw new UnsupportedCombinationException("merge_cubes does not support " + overlapResolver.kind()
                    + " as overlap resolver");
            resolver = ((BuiltinReducer) overlapResolver).function().orElseThrow(() ->
                new UnsupportedCombinationException("merge_cubes does not support " + overlapResolver.kind()
                    + " as overlap resolver"));
            if (!md.bandNames().equals(otherMd.bandNames()))
                throw new UnsupportedCombinationException("an overlap resolver needs the same bands in both cubes, got "
                    + md.bandNames() + " and " + otherMd.bandNames());
        }

        AggregateFunction function = resolver;
        log.info("merge_cubes: {} + {} bands, resolver {}", md.bands().size(), otherMd.bands().size(),
            function == null ? "none" : function);
        CubeMetadata merged = (cube.isSpatial() ? otherMd : md).withBands(bands);
        return cube.applyToLevelsWithZoom((zoom, level) ->
            store.merge(level, aligned(other, zoom, level, "merge_cubes"), function)).withMetadata(merged);
    }

    /**
     * Replaces the cells of {@code cube} where {@code mask} is non-zero with
     * {@code replacement}, or with nodata when it is {@code null}. A mask
     * without time applies to every instant.
     */
    public DataCube mask(DataCube cube, DataCube mask, Double replacement) {
        if (cube.isSpatial() && !mask.isSpatial())
            throw new UnsupportedCombinationException("a mask with a time dimension cannot mask a cube without one");
        return cube.applyToLevelsWithZoom((zoom, level) ->
            store.rasterMask(level, aligned(mask, zoom, level, "mask"), replacement));
    }

    /**
     * Convolves every band with {@code kernel} scaled by {@code factor}.
     * Both kernel dimensions must be odd; the first row of the kernel
     * weighs the row above the pixel.
     *
     * @param border         value of neighbours outside the data
     * @param replaceInvalid value used for nodata neighbours
     */
    public DataCube applyKernel(DataCube cube, double[][] kernel, double factor, double border, double replaceInvalid) {
        if (kernel == null || kernel.length == 0 || kernel[0].length == 0)
            throw new IllegalArgumentException("apply_kernel needs a non-empty kernel");
        for (double[] row : kernel) {
            if (row.length != kernel[0].length)
                throw new IllegalArgumentException("apply_kernel needs a rectangular kernel");
        }
        if (kernel.length % 2 == 0 || kernel[0].length % 2 == 0)
            throw new KernelDimensionsUnevenException("kernel dimensions must be odd, got " + kernel.length + "x"
                + kernel[0].length);
        double[][] scaled = new double[kernel.length][];
        for (int i = 0; i < kernel.length; i++) {
            scaled[i] = new double[kernel[i].length];
            for (int j = 0; j < scaled[i].length; j++) scaled[i][j] = kernel[i][j] * factor;
        }
        log.info("apply_kernel: {}x{} kernel, factor {}", kernel.length, kernel[0].length, factor);
        return cube.applyToLevels(level -> store.applyKernel(level, scaled, border, replaceInvalid));
    }

    /**
     * The level of {@code other} at {@code zoom}, re-laid onto the layout of
     * {@code level} with nearest neighbour sampling when the layouts differ.
     */
    private Level aligned(DataCube other, int zoom, Level level, String process) {
        Level source = other.pyramid().levels().get(zoom);
        if (source == null)
            throw new FeatureUnsupportedException(process + " needs a level at zoom " + zoom + " in both cubes");
        if (source.layout().equals(level.layout())) return source;
        if (!source.crs().equals(level.crs()))
            throw new FeatureUnsupportedException(process + " cannot reproject from " + source.crs() + " to "
                + level.crs());
        log.debug("{}: re-laying {} onto {}", process, source.tiler().name(), level.tiler().name());
        return store.resample(source, level.layout(), ResampleMethod.NEAREST_NEIGHBOR);
    }

    public DataCube renameDimension(DataCube cube, String source, String target) {
        if (!cube.metadata().hasDimension(source))
            throw new UnsupportedDimensionException("cannot rename dimension '" + source + "': it does not exist");
        return cube.withMetadata(cube.metadata().renameDimension(source, target));
    }

    public DataCube addDimension(DataCube cube, String name, String label, String type) {
        return cube.withMetadata(cube.metadata().addDimension(name, label, Dimension.Type.fromName(type)));
    }

    /**
     * Normalized difference vegetation index {@code (nir - red) / (nir + red)}.
     * <p>
     * Bands are looked up by name, then by common name; unspecified bands
     * default to the common names {@code nir} and {@code red}. Without a
     * target band the band dimension is reduced away; with one, the index is
     * appended as a new band.
     * </p>
     */
    public DataCube ndvi(DataCube cube, String nir, String red, String targetBand) {
        CubeMetadata md = cube.metadata();
        if (!md.hasBandDimension())
            throw new AmbiguousBandException(AmbiguousBandException.DIMENSION_AMBIGUOUS,
                "ndvi requires a band dimension");
        int redIndex = resolveBand(md, red, "red", AmbiguousBandException.RED_BAND_AMBIGUOUS);
        int nirIndex = resolveBand(md, nir, "nir", AmbiguousBandException.NIR_BAND_AMBIGUOUS);
        if (targetBand != null && md.bandNames().contains(targetBand))
            throw new BandExistsException("a band named '" + targetBand + "' already exists");

        BandExpression index = BandExpression.normalizedDifference(BandExpression.band(nirIndex),
            BandExpression.band(redIndex));
        if (targetBand == null) {
            return cube.applyToLevels(level -> store.mapBands(level, List.of(index)))
                .withMetadata(md.reduceDimension(md.bandDimension().orElseThrow().name()));
        }
        List<BandExpression> expressions = new ArrayList<>();
        for (int b = 0; b < md.bands().size(); b++) expressions.add(BandExpression.band(b));
        expressions.add(index);
        return cube.applyToLevels(level -> store.mapBands(level, expressions))
            .withMetadata(md.appendBand(Band.of(targetBand)));
    }

    private static int resolveBand(CubeMetadata md, String requested, String defaultCommonName, String code) {
        List<Band> bands = md.bands();
        String wanted = requested == null ? defaultCommonName : requested;
        if (requested != null) {
            for (int i = 0; i < bands.size(); i++) {
                if (requested.equals(bands.get(i).name())) return i;
            }
        }
        int found = -1;
        for (int i = 0; i < bands.size(); i++) {
            if (wanted.equalsIgnoreCase(bands.get(i).commonName())) {
                if (found >= 0)
                    throw new AmbiguousBandException(code, "several bands have common name '" + wanted + "'");
                found = i;
            }
        }
        if (found < 0)
            throw new AmbiguousBandException(code, "no band with name or common name '" + wanted + "' in "
                + md.bandNames());
        return found;
    }

    /**
     * Band values of the pixel containing {@code (x, y)}, per instant.
     *
     * @return values keyed by ISO-8601 instant (or {@value ZonalAggregator#NO_DATE}), in time order;
     * empty when the point lies outside the layout
     */
    public Map<String, List<Double>> timeseries(DataCube cube, double x, double y) {
        Level level = cube.highestLevel();
        LayoutDefinition layout = level.layout();
        Point p = Point.of(x, y);
        Map<String, List<Double>> out = new LinkedHashMap<>();
        if (!layout.extent().contains(p)) return out;

        LayoutTiler tiler = level.tiler();
        TileKey key = tiler.keyOf(p);
        Extent ext = tiler.extentOf(key);
        TileLayout tl = layout.tileLayout();
        int col = Math.min(tl.tileCols() - 1, (int) Math.floor((x - ext.xmin()) / layout.cellWidth())) + level.bufferX();
        int row = Math.min(tl.tileRows() - 1, (int) Math.floor((ext.ymax() - y) / layout.cellHeight())) + level.bufferY();

        level.tiles().forEach((k, t) -> {
            if (!k.spatialKey().equals(key)) return;
            List<Double> values = new ArrayList<>(t.bandCount());
            for (int b = 0; b < t.bandCount(); b++) {
                double v = t.get(b, col, row);
                values.add(t.isNoData(v) ? Double.NaN : v);
            }
            out.put(k.instant() == null ? ZonalAggregator.NO_DATE : k.instant().toString(), values);
        });
        return out;
    }
}
