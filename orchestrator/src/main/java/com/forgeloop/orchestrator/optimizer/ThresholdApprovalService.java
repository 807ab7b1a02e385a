package com.forgeloop.orchestrator.optimizer;

import com.forgeloop.orchestrator.config.TunableThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * The only write path from a recommendation to the live thresholds, and only
 * on an explicit approval. Changes live in memory; make them permanent in
 * configuration.
 */
@Service
public class ThresholdApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ThresholdApprovalService.class);

    // Lower bounds first, so every intermediate state keeps simple < medium and proceed < ceiling.
    private static final List<String> APPLY_ORDER = List.of(
            TunableThresholds.SIMPLE_MAX, TunableThresholds.PROCEED_BELOW,
            TunableThresholds.MEDIUM_MAX, TunableThresholds.CEILING);

    private final TunableThresholds thresholds;

    public ThresholdApprovalService(TunableThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Apply approved recommendations. Nothing is applied if any of them was
     * computed against a value that is no longer current.
     *
     * @throws StaleRecommendationException if an oldValue no longer matches
     * @throws IllegalArgumentException     if the result would break threshold ordering
     */
    public synchronized Map<String, Long> apply(List<ThresholdRecommendation> approved, String approver) {
        if (approver == null || approver.isBlank()) {
            throw new IllegalArgumentException("An approver is required");
        }
        for (ThresholdRecommendation rec : approved) {
            long current = thresholds.get(rec.parameterName());
            if (current != rec.oldValue()) {
                throw new StaleRecommendationException("%s is %d now, recommendation was made against %d"
                        .formatted(rec.parameterName(), current, rec.oldValue()));
            }
        }
        List<ThresholdRecommendation> ordered = approved.stream()
                .sorted(Comparator.comparingInt(rec -> APPLY_ORDER.indexOf(rec.parameterName())))
                .toList();

        TunableThresholds trial = thresholds.copy();
        ordered.forEach(rec -> trial.set(rec.parameterName(), rec.newValue()));

        for (ThresholdRecommendation rec : ordered) {
            thresholds.set(rec.parameterName(), rec.newValue());
            log.info("Threshold {} changed {} -> {} (approved by {})",
                    rec.parameterName(), rec.oldValue(), rec.newValue(), approver);
        }
        return thresholds.snapshot();
    }
}
