package com.forgeloop.orchestrator.optimizer;

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Markdown rendering of an {@link OptimizationReport} for human approvers.
 */
@Component
public class ThresholdReportRenderer {

    public String render(OptimizationReport report) {
        StringBuilder md = new StringBuilder("# Threshold report\n\n");
        if (report.status() == OptimizationReport.Status.INSUFFICIENT_SAMPLE) {
            md.append("**Insufficient sample:** ").append(report.historySize())
              .append(" completed project(s) on record. No recommendations.\n");
            return md.toString();
        }
        md.append(report.historySize()).append(" completed project(s) analysed.\n\n");

        md.append("## Recommendations\n\n");
        if (report.recommendations().isEmpty()) {
            md.append("None. Every metric is on target.\n\n");
        } else {
            md.append("| Parameter | Current | Proposed | Confidence | Sample | Reasoning |\n");
            md.append("|---|---:|---:|---|---:|---|\n");
            for (ThresholdRecommendation rec : report.recommendations()) {
                md.append("| `").append(rec.parameterName()).append("` | ")
                  .append(rec.oldValue()).append(" | ")
                  .append(rec.newValue()).append(" | ")
                  .append(rec.confidence()).append(" | ")
                  .append(rec.sampleSize()).append(" | ")
                  .append(rec.reasoning()).append(" |\n");
            }
            md.append("\nRecommendations are advisory. Apply them through an explicit approval.\n\n");
        }

        md.append("## Statistics\n\n");
        for (ParameterAnalysis analysis : report.analyses()) {
            md.append("- `").append(analysis.parameterName()).append("` (").append(analysis.metric()).append("): ");
            if (analysis.mean() == null) {
                md.append(analysis.note()).append('\n');
                continue;
            }
            md.append(String.format(Locale.ROOT, "mean %.3f, stddev %.3f, target %.3f, n=%d of %d",
                    analysis.mean(), analysis.stddev(), analysis.target(),
                    analysis.sampleSize(), analysis.rawSize()));
            if (!analysis.removedOutliers().isEmpty()) {
                md.append(", outliers removed: ").append(analysis.removedOutliers());
            }
            md.append('\n');
        }
        return md.toString();
    }
}
