package com.tazifor.datacube.error;

/** User code returned something other than exactly one usable array. */
public class UdfContractViolationException extends DatacubeException {

    public UdfContractViolationException(String message) {
        super("UdfContractViolation", message);
    }
}
