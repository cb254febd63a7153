package com.tazifor.datacube.geo.model;

/**
 * Grid geometry of a level: how many tiles the layout has and how many
 * pixels each tile spans.
 */
public record TileLayout(int layoutCols, int layoutRows, int tileCols, int tileRows) {

    public TileLayout {
        if (layoutCols <= 0 || layoutRows <= 0 || tileCols <= 0 || tileRows <= 0)
            throw new IllegalArgumentException("tile layout dimensions must be > 0");
    }

    public int totalCols() { return layoutCols * tileCols; }

    public int totalRows() { return layoutRows * tileRows; }
}
