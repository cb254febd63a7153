package com.tazifor.datacube.error;

/** A neighborhood window is below the supported minimum. */
public class WindowTooSmallException extends DatacubeException {

    public WindowTooSmallException(String message) {
        super("WindowTooSmall", message);
    }
}
