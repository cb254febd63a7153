package com.tazifor.datacube.error;

/**
 * User code failed while running. The message keeps the original failure
 * text; the original exception is the cause. Never retried.
 */
public class UdfExecutionException extends DatacubeException {

    public UdfExecutionException(String message, Throwable cause) {
        super("UdfExecutionError", message, cause);
    }
}
