package com.tazifor.datacube.error;

/** A neighborhood size or overlap was not expressed in pixels. */
public class InvalidUnitException extends DatacubeException {

    public InvalidUnitException(String message) {
        super("InvalidUnit", message);
    }
}
