package com.tazifor.datacube.process;

import java.util.List;

/**
 * Composed band-algebra callback. Each expression produces one output band.
 */
public record BandAlgebraReducer(List<BandExpression> expressions) implements Reducer {

    public BandAlgebraReducer {
        if (expressions == null || expressions.isEmpty())
            throw new IllegalArgumentException("band algebra needs at least one expression");
        expressions = List.copyOf(expressions);
    }

    public static BandAlgebraReducer of(BandExpression expression) {
        return new BandAlgebraReducer(List.of(expression));
    }

    @Override
    public String kind() {
        return "band algebra";
    }
}
