package com.tazifor.datacube.geo.model;

/**
 * A {@link TileLayout} anchored on a geographic {@link Extent}.
 * Together they define the affine mapping from tile keys and pixel indices
 * to map coordinates.
 */
public record LayoutDefinition(Extent extent, TileLayout tileLayout) {

    /** Width of a single pixel in map units. */
    public double cellWidth() {
        return extent.width() / tileLayout.totalCols();
    }

    /** Height of a single pixel in map units. */
    public double cellHeight() {
        return extent.height() / tileLayout.totalRows();
    }

    public double tileWidth() {
        return extent.width() / tileLayout.layoutCols();
    }

    public double tileHeight() {
        return extent.height() / tileLayout.layoutRows();
    }
}
