package com.forgeloop.orchestrator.optimizer;

import java.util.List;

/**
 * The statistics behind one evaluated parameter, whether or not it produced
 * a recommendation.
 *
 * @param rawSize         projects where the metric is defined
 * @param sampleSize      projects left after outlier removal
 * @param removedOutliers metric values discarded by the IQR rule
 * @param recommendations empty when the metric is on target or the sample is too small
 */
public record ParameterAnalysis(String parameterName,
                                String metric,
                                int rawSize,
                                int sampleSize,
                                List<Double> removedOutliers,
                                Double mean,
                                Double stddev,
                                double target,
                                List<ThresholdRecommendation> recommendations,
                                String note) {

    public ParameterAnalysis {
        removedOutliers = List.copyOf(removedOutliers);
        recommendations = List.copyOf(recommendations);
    }
}
