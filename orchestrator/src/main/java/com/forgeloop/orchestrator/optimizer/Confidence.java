package com.forgeloop.orchestrator.optimizer;

/**
 * Confidence of a recommendation, from sample size and coefficient of
 * variation (stddev / mean):
 * <pre>
 *   HIGH    n >= 30 and cv < 0.15
 *   MEDIUM  n >= 10 and cv < 0.25
 *   LOW     otherwise
 * </pre>
 * A zero mean with zero spread has cv 0; a zero mean with any spread is LOW.
 */
public enum Confidence {
    HIGH,
    MEDIUM,
    LOW;

    public static Confidence of(int sampleSize, double mean, double stddev) {
        double cv;
        if (mean == 0.0) {
            if (stddev > 0.0) return LOW;
            cv = 0.0;
        } else {
            cv = stddev / Math.abs(mean);
        }
        if (sampleSize >= 30 && cv < 0.15) return HIGH;
        if (sampleSize >= 10 && cv < 0.25) return MEDIUM;
        return LOW;
    }
}
