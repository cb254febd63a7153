package com.tazifor.datacube.store;

import com.tazifor.datacube.geo.model.LayoutDefinition;
import com.tazifor.datacube.geo.model.Polygon;
import com.tazifor.datacube.model.CellType;
import com.tazifor.datacube.model.Level;
import com.tazifor.datacube.process.AggregateFunction;
import com.tazifor.datacube.process.BandExpression;
import com.tazifor.datacube.process.ResampleMethod;
import com.tazifor.datacube.process.TemporalInterval;

import java.time.Instant;
import java.util.List;

/**
 * Primitives of the distributed tile store. The engine treats every call as
 * a black-box distributed transform: a level goes in, a new level comes out.
 */
public interface TileStore {

    Level convertCellType(Level level, CellType cellType);

    /**
     * Reduces all instants of each spatial key cell by cell. The result is a
     * spatial {@code FLOAT32} level.
     */
    Level aggregateByCell(Level level, AggregateFunction function);

    /**
     * Maps each instant onto the label of every interval containing it and
     * reduces cell by cell per (spatial key, label). Instants outside all
     * intervals are dropped.
     */
    Level aggregateTemporal(Level level, List<TemporalInterval> intervals, List<Instant> labels,
                            AggregateFunction function);

    /** One output band per expression, evaluated over the pixel's band values. */
    Level mapBands(Level level, List<BandExpression> expressions);

    /** Evaluates {@code expression} on every band value on its own (band 0 is the value). */
    Level mapCells(Level level, BandExpression expression);

    /** Sets pixels whose centers fall outside {@code polygon} to nodata. */
    Level mask(Level level, Polygon polygon);

    /** Keeps instants in {@code [from, to]}; spatial levels pass through. */
    Level filterTemporal(Level level, Instant from, Instant to);

    Level selectBands(Level level, int... bandIndices);

    /** Clamps to {@code [inMin, inMax]} and rescales linearly onto {@code [outMin, outMax]}. */
    Level normalize(Level level, double inMin, double inMax, double outMin, double outMax);

    /** Drops instants; tiles that end up on the same key are merged, earliest first. */
    Level toSpatial(Level level);

    Level resample(Level level, LayoutDefinition target, ResampleMethod method);

    /**
     * Combines two levels of one layout, at least one of them spacetime.
     * Without a resolver the right bands are appended after the left bands
     * and a side without a tile contributes nodata. With a resolver both
     * sides carry the same bands and tiles present on both are combined
     * cell by cell. Spatial tiles are matched against every instant of
     * their spatial key.
     *
     * @param overlapResolver combines overlapping cells, or {@code null} to concatenate bands
     */
    Level merge(Level left, Level right, AggregateFunction overlapResolver);

    /**
     * Replaces cells where {@code mask} holds a non-zero value. A single-band
     * mask applies to every band. Tiles without a mask tile are kept as is.
     *
     * @param replacement the new cell value, or {@code null} for nodata
     */
    Level rasterMask(Level level, Level mask, Double replacement);

    /**
     * Weighted focal sum with an odd-sized kernel; {@code kernel[0][0]}
     * weighs the upper-left neighbour. Neighbours outside the data read as
     * {@code border}, nodata neighbours as {@code replaceInvalid}. The result
     * is {@code FLOAT32}.
     */
    Level applyKernel(Level level, double[][] kernel, double border, double replaceInvalid);
}
