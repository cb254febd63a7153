package com.tazifor.datacube.geo.model;

/**
 * A rectangular pixel range {@code [x, x+width) × [y, y+height)}.
 * In stitching space the origin is the bottom-left pixel of the layout.
 */
public record PixelWindow(int x, int y, int width, int height) {

    public int xEnd() { return x + width; }

    public int yEnd() { return y + height; }

    public boolean isEmpty() { return width <= 0 || height <= 0; }
}
