package com.tazifor.datacube.process;

import java.util.Optional;

/**
 * Built-in per-cell aggregations. {@code NaN} inputs are skipped; when every
 * input is {@code NaN} the result is {@code NaN}. Variance and standard
 * deviation are population statistics.
 */
public enum AggregateFunction {
    MIN,
    MAX,
    SUM,
    MEAN,
    VARIANCE,
    STANDARD_DEVIATION;

    /**
     * Resolves a reducer name case-insensitively: {@code min}, {@code max},
     * {@code sum}, {@code mean}, {@code variance} and {@code sd}.
     */
    public static Optional<AggregateFunction> fromName(String name) {
        if (name == null) return Optional.empty();
        switch (name.trim().toUpperCase()) {
            case "MIN": return Optional.of(MIN);
            case "MAX": return Optional.of(MAX);
            case "SUM": return Optional.of(SUM);
            case "MEAN": return Optional.of(MEAN);
            case "VARIANCE": return Optional.of(VARIANCE);
            case "SD":
            case "STANDARDDEVIATION": return Optional.of(STANDARD_DEVIATION);
            default: return Optional.empty();
        }
    }

    public double apply(double[] values) {
        int count = 0;
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (Double.isNaN(v)) continue;
            count++;
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (count == 0) return Double.NaN;

        switch (this) {
            case MIN: return min;
            case MAX: return max;
            case SUM: return sum;
            case MEAN: return sum / count;
            default:
                double mean = sum / count;
                double sq = 0;
                for (double v : values) {
                    if (!Double.isNaN(v)) sq += (v - mean) * (v - mean);
                }
                double variance = sq / count;
                return this == VARIANCE ? variance : Math.sqrt(variance);
        }
    }
}
