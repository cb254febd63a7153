package com.tazifor.datacube.error;

/**
 * A band could not be resolved by name or common name. The code tells which
 * lookup failed ({@code DimensionAmbiguous}, {@code RedBandAmbiguous}, ...).
 */
public class AmbiguousBandException extends DatacubeException {

    public static final String DIMENSION_AMBIGUOUS = "DimensionAmbiguous";
    public static final String RED_BAND_AMBIGUOUS = "RedBandAmbiguous";
    public static final String NIR_BAND_AMBIGUOUS = "NirBandAmbiguous";

    public AmbiguousBandException(String code, String message) {
        super(code, message);
    }
}
