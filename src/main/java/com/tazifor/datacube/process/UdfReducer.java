package com.tazifor.datacube.process;

import java.util.Map;

/**
 * User-defined function: source code and the opaque context handed to it.
 * Whether it runs per tile or per spatial group is decided by the dimension
 * it is applied to.
 */
public record UdfReducer(String code, Map<String, Object> context) implements Reducer {

    public UdfReducer {
        if (code == null)
            throw new IllegalArgumentException("a udf reducer requires a 'udf' code string");
        context = context == null ? Map.of() : context;
    }

    public static UdfReducer of(String code) {
        return new UdfReducer(code, Map.of());
    }

    @Override
    public String kind() {
        return "udf";
    }
}
