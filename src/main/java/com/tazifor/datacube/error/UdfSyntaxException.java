package com.tazifor.datacube.error;

/**
 * User code could not be compiled. Raised when an operation is requested,
 * before any tile is processed.
 */
public class UdfSyntaxException extends DatacubeException {

    public UdfSyntaxException(String message, Throwable cause) {
        super("UdfSyntaxError", message, cause);
    }
}
