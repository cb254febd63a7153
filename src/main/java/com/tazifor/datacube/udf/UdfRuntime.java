package com.tazifor.datacube.udf;

/**
 * Compiles user-supplied source into something the pipeline can invoke.
 */
public interface UdfRuntime {

    /**
     * Parses {@code code} eagerly.
     *
     * @throws com.tazifor.datacube.error.UdfSyntaxException when the code does not compile
     */
    CompiledUdf compile(String code);

    /** Runtime name, e.g. "groovy". */
    String name();
}
