package com.forgeloop.orchestrator.optimizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Descriptive statistics used by the optimizer.
 */
public final class Statistics {

    private static final double IQR_FACTOR = 1.5;

    private Statistics() {}

    /** Values kept and values discarded by {@link #removeOutliers}. */
    public record OutlierSplit(List<Double> kept, List<Double> removed) {}

    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("mean of an empty sample");
        }
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.size();
    }

    /** Sample standard deviation (n - 1 denominator); 0 for fewer than two values. */
    public static double stddev(List<Double> values) {
        if (values.size() < 2) return 0.0;
        double mean = mean(values);
        double squares = 0;
        for (double v : values) squares += (v - mean) * (v - mean);
        return Math.sqrt(squares / (values.size() - 1));
    }

    /**
     * Quantile with linear interpolation between closest ranks: position
     * {@code p * (n - 1)} in the sorted sample.
     */
    public static double quantile(List<Double> values, double p) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("quantile of an empty sample");
        }
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(null);
        double position = p * (sorted.size() - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted.get(lower) + fraction * (sorted.get(upper) - sorted.get(lower));
    }

    /** IQR rule: discard points outside {@code [Q1 - 1.5 IQR, Q3 + 1.5 IQR]}. Order is preserved. */
    public static OutlierSplit removeOutliers(List<Double> values) {
        if (values.isEmpty()) {
            return new OutlierSplit(List.of(), List.of());
        }
        double q1 = quantile(values, 0.25);
        double q3 = quantile(values, 0.75);
        double iqr = q3 - q1;
        double low  = q1 - IQR_FACTOR * iqr;
        double high = q3 + IQR_FACTOR * iqr;

        List<Double> kept = new ArrayList<>();
        List<Double> removed = new ArrayList<>();
        for (double v : values) {
            if (v < low || v > high) removed.add(v);
            else kept.add(v);
        }
        return new OutlierSplit(List.copyOf(kept), List.copyOf(removed));
    }
}
