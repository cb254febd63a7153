package com.tazifor.datacube.process;

/**
 * Resolved form of a callback handed to a cube operation by the
 * process-graph evaluator. Exactly one of:
 * <ul>
 *   <li>{@link BuiltinReducer}: a named per-cell aggregation (min, max, ...)</li>
 *   <li>{@link UdfReducer}: user code plus its context</li>
 *   <li>{@link BandAlgebraReducer}: a composed expression over band values</li>
 * </ul>
 */
public interface Reducer {

    /** Short label used in error messages and logs. */
    String kind();
}
