package com.tazifor.datacube.process;

/**
 * Size or overlap of a neighborhood along one dimension. {@code value} is a
 * number for spatial dimensions and an ISO duration such as {@code "P1D"}
 * (or {@code null} for "all values") for the temporal one.
 */
public record DimensionWindow(String dimension, Object value, String unit) {

    public static final String PIXELS = "px";

    public static DimensionWindow pixels(String dimension, int value) {
        return new DimensionWindow(dimension, value, PIXELS);
    }

    public boolean inPixels() {
        return PIXELS.equals(unit);
    }

    public int intValue() {
        if (!(value instanceof Number))
            throw new IllegalArgumentException("window on " + dimension + " is not numeric: " + value);
        return ((Number) value).intValue();
    }
}
