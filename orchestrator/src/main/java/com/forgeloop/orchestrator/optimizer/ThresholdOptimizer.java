package com.forgeloop.orchestrator.optimizer;

import com.forgeloop.orchestrator.config.ForgeloopProperties;
import com.forgeloop.orchestrator.config.TunableThresholds;
import com.forgeloop.orchestrator.history.ProjectRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Offline analysis of completed projects, producing advisory threshold changes.
 *
 * <pre>
 *   complexity.simple-max   Simple items that had to be split      target  5%
 *   complexity.medium-max   Medium items that needed three commits  target 40%
 *   budget.*                items whose usage passed the ceiling    target  0
 * </pre>
 *
 * Each metric is a per-project rate. Projects where the rate is undefined
 * (no items of the category) are left out, outliers are dropped with the IQR
 * rule, and a threshold is lowered only when the mean rate is above target.
 * The size of the cut is the excess over target, capped at half the current
 * value.
 *
 * This class has no write path to the live thresholds.
 */
@Component
public class ThresholdOptimizer {

    private static final Logger log = LoggerFactory.getLogger(ThresholdOptimizer.class);

    private static final double MAX_CUT = 0.5;

    private final ForgeloopProperties.Optimizer settings;
    private final TunableThresholds thresholds;

    public ThresholdOptimizer(ForgeloopProperties properties, TunableThresholds thresholds) {
        this.settings   = properties.getOptimizer();
        this.thresholds = thresholds;
    }

    public OptimizationReport analyze(List<ProjectRecord> history) {
        if (history.size() < settings.getMinSample()) {
            log.info("Optimizer: {} completed project(s), need {}; no recommendations",
                    history.size(), settings.getMinSample());
            return OptimizationReport.insufficientSample(history.size());
        }

        List<ParameterAnalysis> analyses = List.of(
                analyzeSimpleMax(history),
                analyzeMediumMax(history),
                analyzeBudget(history));
        List<ThresholdRecommendation> recommendations = analyses.stream()
                .flatMap(a -> a.recommendations().stream())
                .toList();
        log.info("Optimizer: {} project(s) analysed, {} recommendation(s)", history.size(), recommendations.size());
        return new OptimizationReport(OptimizationReport.Status.OK, history.size(), recommendations, analyses);
    }

    // ------------------------------------------------------------------
    // Parameters
    // ------------------------------------------------------------------

    private ParameterAnalysis analyzeSimpleMax(List<ProjectRecord> history) {
        return analyze(TunableThresholds.SIMPLE_MAX, "simple split rate", settings.getSimpleSplitRateTarget(),
                rates(history, r -> ratio(r.getSimpleSplits(), r.getSimpleItems())),
                (stats, confidence) -> {
                    long old = thresholds.simpleMax();
                    long proposed = lowered(old, stats.mean - settings.getSimpleSplitRateTarget());
                    return List.of(new ThresholdRecommendation(TunableThresholds.SIMPLE_MAX, old, proposed,
                            confidence, stats.kept.size(),
                            "%.1f%% of Simple items needed a split (target %.0f%%); lower the Simple upper bound"
                                    .formatted(stats.mean * 100, settings.getSimpleSplitRateTarget() * 100)));
                });
    }

    private ParameterAnalysis analyzeMediumMax(List<ProjectRecord> history) {
        return analyze(TunableThresholds.MEDIUM_MAX, "medium three-commit rate",
                settings.getMediumThreeCommitRateTarget(),
                rates(history, r -> ratio(r.getMediumThreeCommits(), r.getMediumItems())),
                (stats, confidence) -> {
                    long old = thresholds.mediumMax();
                    long proposed = Math.max(thresholds.simpleMax() + 1,
                            lowered(old, stats.mean - settings.getMediumThreeCommitRateTarget()));
                    if (proposed >= old) {
                        return List.of();
                    }
                    return List.of(new ThresholdRecommendation(TunableThresholds.MEDIUM_MAX, old, proposed,
                            confidence, stats.kept.size(),
                            "%.1f%% of Medium items needed three commits (target %.0f%%); lower the Medium upper bound"
                                    .formatted(stats.mean * 100, settings.getMediumThreeCommitRateTarget() * 100)));
                });
    }

    /** One overflow metric drives both budget boundaries, lowered by the same factor. */
    private ParameterAnalysis analyzeBudget(List<ProjectRecord> history) {
        return analyze(TunableThresholds.CEILING, "overflow rate", 0.0,
                rates(history, r -> ratio(r.getOverflowItems(), r.getTotalItems())),
                (stats, confidence) -> {
                    long oldCeiling = thresholds.ceiling();
                    long oldProceed = thresholds.proceedBelow();
                    long newCeiling = lowered(oldCeiling, stats.mean);
                    long newProceed = Math.min(lowered(oldProceed, stats.mean), newCeiling - 1);
                    String reasoning = "%.1f%% of items used more than the ceiling (target 0%%); lower the budget zones"
                            .formatted(stats.mean * 100);
                    return List.of(
                            new ThresholdRecommendation(TunableThresholds.PROCEED_BELOW, oldProceed, newProceed,
                                    confidence, stats.kept.size(), reasoning),
                            new ThresholdRecommendation(TunableThresholds.CEILING, oldCeiling, newCeiling,
                                    confidence, stats.kept.size(), reasoning));
                });
    }

    // ------------------------------------------------------------------
    // Shared pipeline
    // ------------------------------------------------------------------

    private record Sample(List<Double> kept, List<Double> removed, double mean, double stddev) {}

    @FunctionalInterface
    private interface Recommender {
        List<ThresholdRecommendation> recommend(Sample sample, Confidence confidence);
    }

    private ParameterAnalysis analyze(String parameter, String metric, double target,
                                      List<Double> values, Recommender recommender) {
        if (values.size() < settings.getMinSample()) {
            String note = "only %d project(s) define the %s; need %d".formatted(values.size(), metric,
                    settings.getMinSample());
            log.info("Optimizer: skipping {}: {}", parameter, note);
            return new ParameterAnalysis(parameter, metric, values.size(), 0, List.of(), null, null, target,
                    List.of(), note);
        }

        Statistics.OutlierSplit split = Statistics.removeOutliers(values);
        double mean = Statistics.mean(split.kept());
        double stddev = Statistics.stddev(split.kept());
        Sample sample = new Sample(split.kept(), split.removed(), mean, stddev);
        Confidence confidence = Confidence.of(split.kept().size(), mean, stddev);

        List<ThresholdRecommendation> recommendations = mean > target
                ? recommender.recommend(sample, confidence)
                : List.of();
        String note = recommendations.isEmpty()
                ? "%s %.3f within target %.3f".formatted(metric, mean, target)
                : "%s %.3f above target %.3f".formatted(metric, mean, target);
        if (!split.removed().isEmpty()) {
            log.debug("Optimizer: {} dropped {} outlier(s): {}", parameter, split.removed().size(), split.removed());
        }
        return new ParameterAnalysis(parameter, metric, values.size(), split.kept().size(), split.removed(),
                mean, stddev, target, recommendations, note);
    }

    private static List<Double> rates(List<ProjectRecord> history, Function<ProjectRecord, Double> rate) {
        List<Double> values = new ArrayList<>();
        for (ProjectRecord record : history) {
            Double value = rate.apply(record);
            if (value != null) values.add(value);
        }
        return values;
    }

    private static Double ratio(int part, int whole) {
        return whole == 0 ? null : (double) part / whole;
    }

    static long lowered(long value, double excess) {
        return value - Math.round(value * Math.min(MAX_CUT, excess));
    }
}
