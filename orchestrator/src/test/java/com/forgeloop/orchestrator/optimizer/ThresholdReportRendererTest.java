package com.forgeloop.orchestrator.optimizer;

import com.forgeloop.orchestrator.config.TunableThresholds;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ThresholdReportRendererTest {

    ThresholdReportRenderer renderer = new ThresholdReportRenderer();

    @Test
    void render_insufficientSample_saysSoAndStops() {
        String md = renderer.render(OptimizationReport.insufficientSample(3));

        assertThat(md).isEqualTo("# Threshold report\n\n"
                + "**Insufficient sample:** 3 completed project(s) on record. No recommendations.\n");
    }

    @Test
    void render_recommendation_tableAndStatistics() {
        ThresholdRecommendation rec = new ThresholdRecommendation(TunableThresholds.SIMPLE_MAX, 500, 450,
                Confidence.LOW, 5, "15.0% of Simple items needed a split");
        ParameterAnalysis simple = new ParameterAnalysis(TunableThresholds.SIMPLE_MAX, "simple split rate",
                6, 5, List.of(1.0), 0.15, 0.0, 0.05, List.of(rec), "simple split rate above target");
        ParameterAnalysis medium = new ParameterAnalysis(TunableThresholds.MEDIUM_MAX, "medium three-commit rate",
                0, 0, List.of(), null, null, 0.4, List.of(),
                "only 0 project(s) define the medium three-commit rate; need 5");
        OptimizationReport report = new OptimizationReport(OptimizationReport.Status.OK, 6,
                List.of(rec), List.of(simple, medium));

        String md = renderer.render(report);

        assertThat(md).startsWith("# Threshold report\n\n6 completed project(s) analysed.")
                .contains("| `complexity.simple-max` | 500 | 450 | LOW | 5 | 15.0% of Simple items needed a split |")
                .contains("mean 0.150, stddev 0.000, target 0.050, n=5 of 6, outliers removed: [1.0]")
                .contains("- `complexity.medium-max` (medium three-commit rate): only 0 project(s)");
    }

    @Test
    void render_noRecommendations_saysOnTarget() {
        OptimizationReport report = new OptimizationReport(OptimizationReport.Status.OK, 5, List.of(), List.of());

        assertThat(renderer.render(report)).contains("None. Every metric is on target.");
    }
}
