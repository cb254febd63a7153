package com.tazifor.datacube.service;

import com.tazifor.datacube.config.EngineProperties;
import com.tazifor.datacube.error.InvalidUnitException;
import com.tazifor.datacube.error.UnsupportedCombinationException;
import com.tazifor.datacube.error.UnsupportedDimensionException;
import com.tazifor.datacube.error.WindowTooSmallException;
import com.tazifor.datacube.model.CubeMetadata;
import com.tazifor.datacube.model.DataCube;
import com.tazifor.datacube.model.Dimension;
import com.tazifor.datacube.model.Level;
import com.tazifor.datacube.process.*;
import com.tazifor.datacube.store.TileStore;
import com.tazifor.datacube.udf.CompiledUdf;
import com.tazifor.datacube.udf.UdfPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Decides how a cube operation runs: a built-in tile store primitive, the
 * per-tile udf path or the per-spatial-group udf path.
 * <p>
 * Every request is validated, and its udf compiled, before any level is
 * touched. An invalid request never reaches the tile store or the retiler.
 * </p>
 */
@Slf4j
@Service
public class OperationDispatcher {

    private static final String SINGLE_DAY = "P1D";

    private final TileStore store;
    private final UdfPipeline pipeline;
    private final NeighborhoodRetiler retiler;
    private final int minWindowSize;

    @Autowired
    public OperationDispatcher(TileStore store, UdfPipeline pipeline, NeighborhoodRetiler retiler,
                               EngineProperties properties) {
        this(store, pipeline, retiler, properties.getNeighborhood().getMinWindowSize());
    }

    public OperationDispatcher(TileStore store, UdfPipeline pipeline, NeighborhoodRetiler retiler, int minWindowSize) {
        this.store = store;
        this.pipeline = pipeline;
        this.retiler = retiler;
        this.minWindowSize = minWindowSize;
    }

    /**
     * Reduces {@code dimension} away.
     * <ul>
     *   <li>built-in reducer over the temporal dimension: per-cell aggregation</li>
     *   <li>udf over the temporal dimension: grouped udf execution</li>
     *   <li>udf over the band dimension: per-tile udf execution</li>
     *   <li>band algebra over the band dimension: band expression evaluation</li>
     * </ul>
     * Anything else fails with {@link UnsupportedCombinationException}.
     */
    public DataCube reduceDimension(DataCube cube, String dimension, Reducer reducer) {
        CubeMetadata md = cube.metadata();
        if (!md.hasDimension(dimension))
            throw new UnsupportedDimensionException("cannot reduce dimension '" + dimension
                + "': it does not exist, available dimensions are " + dimensionNames(md));
        boolean temporal = md.isTemporalDimension(dimension);
        boolean bands = md.isBandDimension(dimension);

        UnaryOperator<Level> op;
        if (reducer instanceof BuiltinReducer) {
            BuiltinReducer builtin = (BuiltinReducer) reducer;
            if (!temporal)
                throw new UnsupportedDimensionException("reducer " + builtin.kind() + " only reduces the temporal dimension "
                    + md.temporalDimension().map(d -> "'" + d.name() + "'").orElse("(none)")
                    + ", got '" + dimension + "'");
            AggregateFunction function = builtin.function()
                .orElseThrow(() -> unsupported(reducer, dimension));
            log.info("reduce_dimension {}: per-cell {} aggregation", dimension, function);
            op = level -> store.aggregateByCell(level, function);
        } else if (reducer instanceof UdfReducer && temporal) {
            UdfReducer udf = (UdfReducer) reducer;
            CompiledUdf function = pipeline.compile(udf);
            log.info("reduce_dimension {}: grouped udf", dimension);
            op = level -> store.toSpatial(pipeline.applyTilesSpatiotemporal(level, md.bandNames(), udf, function));
        } else if (reducer instanceof UdfReducer && bands) {
            UdfReducer udf = (UdfReducer) reducer;
            CompiledUdf function = pipeline.compile(udf);
            log.info("reduce_dimension {}: per-tile udf", dimension);
            op = level -> pipeline.applyTiles(level, md.bandNames(), udf, function);
        } else if (reducer instanceof BandAlgebraReducer && bands) {
            List<BandExpression> expressions = ((BandAlgebraReducer) reducer).expressions();
            log.info("reduce_dimension {}: band algebra with {} expression(s)", dimension, expressions.size());
            op = level -> store.mapBands(level, expressions);
        } else {
            throw unsupported(reducer, dimension);
        }
        return cube.applyToLevels(op).withMetadata(md.reduceDimension(dimension));
    }

    /**
     * Applies a per-pixel process without changing the cube's dimensions.
     * A udf runs tile by tile; a band expression runs on every band value
     * on its own.
     */
    public DataCube apply(DataCube cube, Reducer process) {
        CubeMetadata md = cube.metadata();
        if (process instanceof UdfReducer) {
            UdfReducer udf = (UdfReducer) process;
            CompiledUdf function = pipeline.compile(udf);
            log.info("apply: per-tile udf");
            return cube.applyToLevels(level -> pipeline.applyTiles(level, md.bandNames(), udf, function));
        }
        if (process instanceof BandAlgebraReducer && ((BandAlgebraReducer) process).expressions().size() == 1) {
            BandExpression expression = ((BandAlgebraReducer) process).expressions().get(0);
            log.info("apply: band expression per value");
            return cube.applyToLevels(level -> store.mapCells(level, expression));
        }
        throw new UnsupportedCombinationException("apply does not support " + process.kind());
    }

    /**
     * Runs a process over overlapping spatial windows.
     *
     * @param size    window size per dimension; x and y in pixels, t as an ISO duration or absent
     * @param overlap margin per dimension; spatial margins default to 0
     */
    public DataCube applyNeighborhood(DataCube cube, Reducer process, List<DimensionWindow> size,
                                      List<DimensionWindow> overlap) {
        CubeMetadata md = cube.metadata();
        List<Dimension> spatial = md.spatialDimensions();
        if (spatial.size() != 2)
            throw new UnsupportedDimensionException("apply_neighborhood needs exactly two spatial dimensions, found "
                + spatial.size());
        for (DimensionWindow w : size) {
            if (!md.hasDimension(w.dimension()))
                throw new UnsupportedDimensionException("apply_neighborhood size refers to unknown dimension '"
                    + w.dimension() + "', available dimensions are " + dimensionNames(md));
        }
        String xName = spatial.get(0).name(), yName = spatial.get(1).name();

        DimensionWindow sizeX = find(size, xName).orElseThrow(() -> new UnsupportedCombinationException(
            "apply_neighborhood needs a window size for dimension '" + xName + "'"));
        DimensionWindow sizeY = find(size, yName).orElseThrow(() -> new UnsupportedCombinationException(
            "apply_neighborhood needs a window size for dimension '" + yName + "'"));
        int sx = pixels(sizeX, "size"), sy = pixels(sizeY, "size");
        int ox = find(overlap, xName).map(w -> pixels(w, "overlap")).orElse(0);
        int oy = find(overlap, yName).map(w -> pixels(w, "overlap")).orElse(0);
        if (sx < minWindowSize || sy < minWindowSize)
            throw new WindowTooSmallException("apply_neighborhood window " + sx + "x" + sy + " is below the minimum of "
                + minWindowSize + " pixels");
        if (ox < 0 || oy < 0)
            throw new InvalidUnitException("apply_neighborhood overlap must not be negative, got " + ox + "x" + oy);

        boolean singleDate = singleDate(md, size, overlap);
        UnaryOperator<Level> op;
        if (process instanceof UdfReducer) {
            UdfReducer udf = (UdfReducer) process;
            CompiledUdf function = pipeline.compile(udf);
            op = singleDate
                ? level -> pipeline.applyTiles(level, md.bandNames(), udf, function)
                : level -> pipeline.applyTilesSpatiotemporal(level, md.bandNames(), udf, function);
        } else if (process instanceof BandAlgebraReducer && singleDate
            && ((BandAlgebraReducer) process).expressions().size() == 1) {
            BandExpression expression = ((BandAlgebraReducer) process).expressions().get(0);
            op = level -> store.mapCells(level, expression);
        } else {
            throw new UnsupportedCombinationException("apply_neighborhood does not support " + process.kind()
                + (singleDate ? "" : " over the full time series"));
        }
        log.info("apply_neighborhood: {}x{} windows, {}x{} overlap, {} mode", sx, sy, ox, oy,
            singleDate ? "single" : "grouped");

        return cube.applyToLevels(level -> {
            Level processed = op.apply(retiler.retile(level, sx, sy, ox, oy));
            return ox > 0 || oy > 0 ? retiler.removeOverlap(processed) : processed;
        });
    }

    /**
     * No temporal size (or an unbounded one) runs grouped, {@code P1D} without
     * temporal overlap runs per date. Cubes without a time dimension always
     * run per tile.
     */
    private static boolean singleDate(CubeMetadata md, List<DimensionWindow> size, List<DimensionWindow> overlap) {
        Optional<Dimension> t = md.temporalDimension();
        if (t.isEmpty()) return true;
        Optional<DimensionWindow> tSize = find(size, t.get().name());
        if (tSize.isEmpty() || tSize.get().value() == null) return false;
        Optional<DimensionWindow> tOverlap = find(overlap, t.get().name());
        boolean noOverlap = tOverlap.isEmpty() || tOverlap.get().value() == null
            || (tOverlap.get().value() instanceof Number && ((Number) tOverlap.get().value()).doubleValue() == 0);
        if (SINGLE_DAY.equals(String.valueOf(tSize.get().value())) && noOverlap) return true;
        throw new UnsupportedCombinationException("apply_neighborhood only supports a temporal size of null or "
            + SINGLE_DAY + " without temporal overlap, got size " + tSize.get().value()
            + tOverlap.map(o -> " and overlap " + o.value()).orElse(""));
    }

    private static int pixels(DimensionWindow w, String what) {
        if (!w.inPixels())
            throw new InvalidUnitException("apply_neighborhood " + what + " for dimension '" + w.dimension()
                + "' must be in '" + DimensionWindow.PIXELS + "', got '" + w.unit() + "'");
        return w.intValue();
    }

    private static Optional<DimensionWindow> find(List<DimensionWindow> windows, String dimension) {
        if (windows == null) return Optional.empty();
        return windows.stream().filter(w -> dimension.equals(w.dimension())).findFirst();
    }

    private static List<String> dimensionNames(CubeMetadata md) {
        return md.dimensions().stream().map(Dimension::name).toList();
    }

    private static UnsupportedCombinationException unsupported(Reducer reducer, String dimension) {
        return new UnsupportedCombinationException("reducer " + reducer.kind() + " cannot reduce dimension '"
            + dimension + "'");
    }
}
