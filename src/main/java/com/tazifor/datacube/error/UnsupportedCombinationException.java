package com.tazifor.datacube.error;

/** The reducer or callback kind cannot be applied to the requested dimension. */
public class UnsupportedCombinationException extends DatacubeException {

    public UnsupportedCombinationException(String message) {
        super("UnsupportedCombination", message);
    }
}
