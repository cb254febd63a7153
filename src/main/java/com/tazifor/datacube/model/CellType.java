package com.tazifor.datacube.model;

/**
 * Numeric storage type of tile cells. Values are always held as doubles in
 * memory; the cell type governs rounding and range on conversion.
 */
public enum CellType {
    UINT8("uint8", 0, 255, 255.0),
    INT16("int16", Short.MIN_VALUE, Short.MAX_VALUE, Short.MIN_VALUE),
    INT32("int32", Integer.MIN_VALUE, Integer.MAX_VALUE, Integer.MIN_VALUE),
    FLOAT32("float32", -Float.MAX_VALUE, Float.MAX_VALUE, Double.NaN),
    FLOAT64("float64", -Double.MAX_VALUE, Double.MAX_VALUE, Double.NaN);

    private final String typeName;
    private final double min;
    private final double max;
    private final double defaultNoData;

    CellType(String typeName, double min, double max, double defaultNoData) {
        this.typeName = typeName;
        this.min = min;
        this.max = max;
        this.defaultNoData = defaultNoData;
    }

    public String typeName() {
        return typeName;
    }

    public boolean isFloatingPoint() {
        return this == FLOAT32 || this == FLOAT64;
    }

    public double defaultNoData() {
        return defaultNoData;
    }

    public boolean canHold(double value) {
        if (Double.isNaN(value)) return isFloatingPoint();
        return value >= min && value <= max;
    }

    /**
     * Converts a (non-nodata) value into this type's domain: integer types
     * round half-up and clamp, {@code FLOAT32} drops precision.
     */
    public double convert(double value) {
        switch (this) {
            case FLOAT64:
                return value;
            case FLOAT32:
                return (float) value;
            default:
                if (Double.isNaN(value)) return defaultNoData;
                return Math.max(min, Math.min(max, Math.floor(value + 0.5)));
        }
    }

    public static CellType fromName(String name) {
        for (CellType t : values()) {
            if (t.typeName.equalsIgnoreCase(name) || t.name().equalsIgnoreCase(name)) return t;
        }
        throw new IllegalArgumentException("Unknown cell type: " + name);
    }
}
