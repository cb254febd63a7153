package com.tazifor.datacube.process;

import java.util.Optional;

public record BuiltinReducer(String name) implements Reducer {

    public BuiltinReducer {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("reducer name must not be blank");
    }

    public Optional<AggregateFunction> function() {
        return AggregateFunction.fromName(name);
    }

    @Override
    public String kind() {
        return "builtin '" + name + "'";
    }
}
