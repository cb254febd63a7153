package com.tazifor.datacube.error;

/**
 * Base class of every failure the engine reports to its callers.
 * <p>
 * {@link #code()} is a stable identifier (e.g. {@code "UnsupportedDimension"})
 * that outer layers map onto API error codes; the message names the
 * offending input.
 * </p>
 */
public class DatacubeException extends RuntimeException {

    private final String code;

    public DatacubeException(String code, String message) {
        super(message);
        this.code = code;
    }

    public DatacubeException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
