package com.tazifor.datacube.error;

public class BandExistsException extends DatacubeException {

    public BandExistsException(String message) {
        super("BandExists", message);
    }
}
