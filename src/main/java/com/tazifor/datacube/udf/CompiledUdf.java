package com.tazifor.datacube.udf;

import com.tazifor.datacube.model.DataArray;

import java.util.List;

/**
 * A parsed user function. Each {@link #run} call is independent: no state
 * survives from one invocation to the next.
 */
public interface CompiledUdf {

    /**
     * Invokes the function on one envelope and returns the arrays it
     * produced (possibly none).
     *
     * @throws com.tazifor.datacube.error.UdfExecutionException when user code fails
     */
    List<DataArray> run(UdfData data);
}
