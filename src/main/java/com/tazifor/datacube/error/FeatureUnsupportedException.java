package com.tazifor.datacube.error;

/** A well-formed request the engine does not implement. */
public class FeatureUnsupportedException extends DatacubeException {

    public FeatureUnsupportedException(String message) {
        super("FeatureUnsupported", message);
    }
}
