package com.tazifor.datacube.process;

public enum ResampleMethod {
    NEAREST_NEIGHBOR,
    BILINEAR;

    /** Unknown method names fall back to nearest neighbour. */
    public static ResampleMethod fromName(String name) {
        return "bilinear".equalsIgnoreCase(name) ? BILINEAR : NEAREST_NEIGHBOR;
    }
}
