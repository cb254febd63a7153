package com.tazifor.datacube.error;

/** The requested dimension does not exist or cannot be used by the operation. */
public class UnsupportedDimensionException extends DatacubeException {

    public UnsupportedDimensionException(String message) {
        super("UnsupportedDimension", message);
    }
}
