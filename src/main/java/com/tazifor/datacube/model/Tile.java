package com.tazifor.datacube.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Immutable banded raster grid.
 * <p>
 * Cells are stored per band in row-major order; row 0 is the top row of the
 * tile. A cell is nodata when it equals the tile's nodata sentinel or is
 * {@code NaN}.
 * </p>
 */
public final class Tile {

    private final int cols;
    private final int rows;
    private final CellType cellType;
    private final Double noData;
    private final double[][] bands;

    private Tile(int cols, int rows, CellType cellType, Double noData, double[][] bands) {
        if (cols <= 0 || rows <= 0)
            throw new IllegalArgumentException("tile dimensions must be > 0");
        if (bands.length == 0)
            throw new IllegalArgumentException("a tile needs at least one band");
        for (double[] band : bands) {
            if (band.length != cols * rows)
                throw new IllegalArgumentException("band length " + band.length + " does not match " + cols + "x" + rows);
        }
        this.cols = cols;
        this.rows = rows;
        this.cellType = cellType;
        this.noData = noData;
        this.bands = bands;
    }

    /**
     * Creates a tile from copies of the given band arrays.
     */
    public static Tile of(int cols, int rows, CellType cellType, Double noData, double[]... bands) {
        double[][] copy = new double[bands.length][];
        for (int b = 0; b < bands.length; b++) copy[b] = bands[b].clone();
        return new Tile(cols, rows, cellType, noData, copy);
    }

    /**
     * Creates a tile that takes ownership of {@code bands}. Callers must not
     * touch the arrays afterwards.
     */
    public static Tile wrap(int cols, int rows, CellType cellType, Double noData, double[][] bands) {
        return new Tile(cols, rows, cellType, noData, bands);
    }

    public static Tile filled(int cols, int rows, int bandCount, double value, CellType cellType, Double noData) {
        double[][] cells = new double[bandCount][cols * rows];
        for (double[] band : cells) Arrays.fill(band, value);
        return new Tile(cols, rows, cellType, noData, cells);
    }

    public int cols() { return cols; }

    public int rows() { return rows; }

    public int bandCount() { return bands.length; }

    public CellType cellType() { return cellType; }

    /** The nodata sentinel, or {@code null} when none is declared. */
    public Double noData() { return noData; }

    public double get(int band, int col, int row) {
        return bands[band][row * cols + col];
    }

    /** Copy of one band's cells in row-major order. */
    public double[] band(int band) {
        return bands[band].clone();
    }

    public boolean isNoData(double value) {
        return Double.isNaN(value) || (noData != null && value == noData);
    }

    public boolean isNoData(int band, int col, int row) {
        return isNoData(get(band, col, row));
    }

    /**
     * Converts to another cell type keeping the nodata semantics: floating
     * point targets use {@code NaN}, integer targets keep the current
     * sentinel when representable and fall back to the type default.
     */
    public Tile convert(CellType target) {
        Double targetNoData;
        if (target.isFloatingPoint()) {
            targetNoData = Double.NaN;
        } else if (noData != null && target.canHold(noData)) {
            targetNoData = noData;
        } else {
            targetNoData = target.defaultNoData();
        }
        return convert(target, targetNoData);
    }

    public Tile convert(CellType target, Double targetNoData) {
        double nd = targetNoData == null ? target.defaultNoData() : targetNoData;
        double[][] out = new double[bands.length][cols * rows];
        for (int b = 0; b < bands.length; b++) {
            double[] src = bands[b];
            double[] dst = out[b];
            for (int i = 0; i < src.length; i++) {
                dst[i] = isNoData(src[i]) ? nd : target.convert(src[i]);
            }
        }
        return new Tile(cols, rows, target, targetNoData, out);
    }

    /**
     * Applies {@code op} to every data cell, leaving nodata cells untouched.
     */
    public Tile mapCells(DoubleUnaryOperator op) {
        double[][] out = new double[bands.length][];
        for (int b = 0; b < bands.length; b++) {
            double[] src = bands[b];
            double[] dst = new double[src.length];
            for (int i = 0; i < src.length; i++) {
                dst[i] = isNoData(src[i]) ? src[i] : op.applyAsDouble(src[i]);
            }
            out[b] = dst;
        }
        return new Tile(cols, rows, cellType, noData, out);
    }

    /**
     * Cuts out the window {@code [x, x+width) × [y, y+height)} of this tile
     * (tile pixel space, y counted from the top row).
     */
    public Tile crop(int x, int y, int width, int height) {
        if (x < 0 || y < 0 || x + width > cols || y + height > rows)
            throw new IllegalArgumentException("crop window exceeds tile bounds");
        double[][] out = new double[bands.length][width * height];
        for (int b = 0; b < bands.length; b++) {
            for (int r = 0; r < height; r++) {
                System.arraycopy(bands[b], (y + r) * cols + x, out[b], r * width, width);
            }
        }
        return new Tile(width, height, cellType, noData, out);
    }

    public Tile selectBands(int... indices) {
        double[][] out = new double[indices.length][];
        for (int i = 0; i < indices.length; i++) out[i] = bands[indices[i]];
        return new Tile(cols, rows, cellType, noData, out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tile)) return false;
        Tile other = (Tile) o;
        return cols == other.cols && rows == other.rows && cellType == other.cellType
            && Objects.equals(noData, other.noData) && Arrays.deepEquals(bands, other.bands);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * cols + rows) + Arrays.deepHashCode(bands);
    }

    @Override
    public String toString() {
        return "Tile[" + cols + "x" + rows + "x" + bands.length + " " + cellType.typeName() + " nodata=" + noData + "]";
    }
}
