package com.forgeloop.orchestrator.optimizer;

import java.util.List;
import java.util.Optional;

/**
 * Result of one optimizer pass.
 *
 * With INSUFFICIENT_SAMPLE the recommendation list is empty: the history is
 * too short to say anything.
 */
public record OptimizationReport(Status status,
                                 int historySize,
                                 List<ThresholdRecommendation> recommendations,
                                 List<ParameterAnalysis> analyses) {

    public enum Status { OK, INSUFFICIENT_SAMPLE }

    public OptimizationReport {
        recommendations = List.copyOf(recommendations);
        analyses        = List.copyOf(analyses);
    }

    public static OptimizationReport insufficientSample(int historySize) {
        return new OptimizationReport(Status.INSUFFICIENT_SAMPLE, historySize, List.of(), List.of());
    }

    public Optional<ParameterAnalysis> analysis(String parameterName) {
        return analyses.stream().filter(a -> a.parameterName().equals(parameterName)).findFirst();
    }
}
