package com.tazifor.datacube.error;

/** A convolution kernel has an even number of rows or columns. */
public class KernelDimensionsUnevenException extends DatacubeException {

    public KernelDimensionsUnevenException(String message) {
        super("KernelDimensionsUneven", message);
    }
}
