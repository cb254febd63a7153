package com.tazifor.datacube.service;

/**
 * Partial mean: a (sum, count) pair that combines associatively.
 */
public record MeanAccumulator(double sum, long count) {

    public static final MeanAccumulator EMPTY = new MeanAccumulator(0, 0);

    public MeanAccumulator add(double value) {
        return new MeanAccumulator(sum + value, count + 1);
    }

    public MeanAccumulator combine(MeanAccumulator other) {
        return new MeanAccumulator(sum + other.sum, count + other.count);
    }

    /** {@code NaN} when nothing was accumulated. */
    public double mean() {
        return count == 0 ? Double.NaN : sum / count;
    }
}
