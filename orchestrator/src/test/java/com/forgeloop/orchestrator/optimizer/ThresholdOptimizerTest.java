package com.forgeloop.orchestrator.optimizer;

import com.forgeloop.orchestrator.config.ForgeloopProperties;
import com.forgeloop.orchestrator.config.TunableThresholds;
import com.forgeloop.orchestrator.history.ProjectRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class ThresholdOptimizerTest {

    ThresholdOptimizer optimizer;

    @BeforeEach
    void setUp() {
        ForgeloopProperties properties = new ForgeloopProperties();
        optimizer = new ThresholdOptimizer(properties, TunableThresholds.from(properties));
    }

    // ------------------------------------------------------------------
    // Sample gate
    // ------------------------------------------------------------------

    @Test
    void analyze_fourProjects_insufficientSample() {
        OptimizationReport report = optimizer.analyze(projects(4, 20, 100));

        assertThat(report.status()).isEqualTo(OptimizationReport.Status.INSUFFICIENT_SAMPLE);
        assertThat(report.historySize()).isEqualTo(4);
        assertThat(report.recommendations()).isEmpty();
        assertThat(report.analyses()).isEmpty();
    }

    @Test
    void analyze_fiveProjectsAboveTarget_recommendsLowerSimpleMax() {
        OptimizationReport report = optimizer.analyze(projects(5, 15, 100));

        assertThat(report.status()).isEqualTo(OptimizationReport.Status.OK);
        ThresholdRecommendation rec = report.recommendations().stream()
                .filter(r -> r.parameterName().equals(TunableThresholds.SIMPLE_MAX))
                .findFirst().orElseThrow();
        // 15% against a 5% target: cut by 10%
        assertThat(rec.oldValue()).isEqualTo(500);
        assertThat(rec.newValue()).isEqualTo(450);
        assertThat(rec.sampleSize()).isEqualTo(5);
        assertThat(rec.confidence()).isEqualTo(Confidence.LOW);
    }

    // ------------------------------------------------------------------
    // Outliers and statistics
    // ------------------------------------------------------------------

    @Test
    void analyze_outlierProject_removedBeforeMean() {
        List<ProjectRecord> history = new ArrayList<>();
        for (int splits : new int[] {1, 2, 1, 2, 1, 100}) {
            history.add(project(splits, 100, 0, 0, 0, 10));
        }

        OptimizationReport report = optimizer.analyze(history);

        ParameterAnalysis simple = report.analysis(TunableThresholds.SIMPLE_MAX).orElseThrow();
        assertThat(simple.rawSize()).isEqualTo(6);
        assertThat(simple.removedOutliers()).containsExactly(1.0);
        assertThat(simple.sampleSize()).isEqualTo(5);
        assertThat(simple.mean()).isCloseTo(0.014, within(1e-9));
        assertThat(simple.recommendations()).isEmpty();
    }

    @Test
    void analyze_confidenceFollowsSampleSizeAndSpread() {
        // 30 projects, identical rates: cv 0
        OptimizationReport report = optimizer.analyze(projects(30, 10, 100));

        assertThat(report.analysis(TunableThresholds.SIMPLE_MAX).orElseThrow().recommendations())
                .singleElement()
                .extracting(ThresholdRecommendation::confidence)
                .isEqualTo(Confidence.HIGH);

        OptimizationReport smaller = optimizer.analyze(projects(12, 10, 100));
        assertThat(smaller.recommendations().get(0).confidence()).isEqualTo(Confidence.MEDIUM);
    }

    // ------------------------------------------------------------------
    // Parameters
    // ------------------------------------------------------------------

    @Test
    void analyze_mediumThreeCommitRateAboveTarget_lowersMediumMax() {
        List<ProjectRecord> history = IntStream.range(0, 5)
                .mapToObj(i -> project(0, 10, 6, 10, 0, 20))
                .toList();

        OptimizationReport report = optimizer.analyze(history);

        ThresholdRecommendation rec = report.analysis(TunableThresholds.MEDIUM_MAX).orElseThrow()
                .recommendations().get(0);
        assertThat(rec.oldValue()).isEqualTo(1500);
        assertThat(rec.newValue()).isEqualTo(1200);
    }

    @Test
    void analyze_mediumRateOnTarget_noRecommendation() {
        List<ProjectRecord> history = IntStream.range(0, 5)
                .mapToObj(i -> project(0, 10, 3, 10, 0, 20))
                .toList();

        ParameterAnalysis medium = optimizer.analyze(history).analysis(TunableThresholds.MEDIUM_MAX).orElseThrow();

        assertThat(medium.recommendations()).isEmpty();
        assertThat(medium.mean()).isCloseTo(0.3, within(1e-9));
        assertThat(medium.note()).startsWith("medium three-commit rate").contains("within target");
    }

    @Test
    void analyze_overflowRate_lowersBothBudgetBoundariesBySameFactor() {
        List<ProjectRecord> history = IntStream.range(0, 5)
                .mapToObj(i -> project(0, 10, 0, 0, 2, 10))
                .toList();

        OptimizationReport report = optimizer.analyze(history);

        assertThat(report.analysis(TunableThresholds.CEILING).orElseThrow().recommendations())
                .extracting(ThresholdRecommendation::parameterName, ThresholdRecommendation::newValue)
                .containsExactly(
                        tuple(TunableThresholds.PROCEED_BELOW, 80_000L),
                        tuple(TunableThresholds.CEILING, 120_000L));
    }

    @Test
    void analyze_categoryNeverSeen_parameterSkippedWithNote() {
        ParameterAnalysis medium = optimizer.analyze(projects(5, 15, 100))
                .analysis(TunableThresholds.MEDIUM_MAX).orElseThrow();

        assertThat(medium.sampleSize()).isZero();
        assertThat(medium.mean()).isNull();
        assertThat(medium.note()).isEqualTo("only 0 project(s) define the medium three-commit rate; need 5");
    }

    @Test
    void lowered_cutCappedAtHalf() {
        assertThat(ThresholdOptimizer.lowered(1000, 0.9)).isEqualTo(500);
        assertThat(ThresholdOptimizer.lowered(1000, 0.1)).isEqualTo(900);
    }

    // ------------------------------------------------------------------

    private static List<ProjectRecord> projects(int count, int simpleSplits, int simpleItems) {
        return IntStream.range(0, count)
                .mapToObj(i -> project(simpleSplits, simpleItems, 0, 0, 0, simpleItems))
                .toList();
    }

    private static ProjectRecord project(int simpleSplits, int simpleItems, int mediumThree, int mediumItems,
                                         int overflow, int total) {
        ProjectRecord record = new ProjectRecord("p", Instant.EPOCH, Instant.EPOCH);
        record.setSimpleSplits(simpleSplits);
        record.setSimpleItems(simpleItems);
        record.setMediumThreeCommits(mediumThree);
        record.setMediumItems(mediumItems);
        record.setOverflowItems(overflow);
        record.setTotalItems(total);
        return record;
    }
}
