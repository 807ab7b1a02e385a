package com.forgeloop.orchestrator.optimizer;

import com.forgeloop.orchestrator.config.TunableThresholds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThresholdApprovalServiceTest {

    TunableThresholds thresholds;
    ThresholdApprovalService service;

    @BeforeEach
    void setUp() {
        thresholds = new TunableThresholds(500, 1500, 100_000, 150_000);
        service = new ThresholdApprovalService(thresholds);
    }

    @Test
    void apply_approvedRecommendation_changesLiveValue() {
        Map<String, Long> values = service.apply(List.of(rec(TunableThresholds.SIMPLE_MAX, 500, 450)), "maria");

        assertThat(thresholds.simpleMax()).isEqualTo(450);
        assertThat(values).containsEntry(TunableThresholds.SIMPLE_MAX, 450L)
                          .containsEntry(TunableThresholds.MEDIUM_MAX, 1500L);
    }

    @Test
    void apply_staleOldValue_nothingApplied() {
        thresholds.set(TunableThresholds.SIMPLE_MAX, 480);

        assertThatThrownBy(() -> service.apply(List.of(
                        rec(TunableThresholds.MEDIUM_MAX, 1500, 1200),
                        rec(TunableThresholds.SIMPLE_MAX, 500, 450)), "maria"))
                .isInstanceOf(StaleRecommendationException.class)
                .hasMessage("complexity.simple-max is 480 now, recommendation was made against 500");

        assertThat(thresholds.mediumMax()).isEqualTo(1500);
        assertThat(thresholds.simpleMax()).isEqualTo(480);
    }

    @Test
    void apply_blankApprover_rejected() {
        assertThatThrownBy(() -> service.apply(List.of(rec(TunableThresholds.SIMPLE_MAX, 500, 450)), " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("An approver is required");

        assertThat(thresholds.simpleMax()).isEqualTo(500);
    }

    @Test
    void apply_budgetPairInAnyOrder_lowerBoundAppliedFirst() {
        // ceiling first would leave proceed-below above it
        service.apply(List.of(
                rec(TunableThresholds.CEILING, 150_000, 90_000),
                rec(TunableThresholds.PROCEED_BELOW, 100_000, 80_000)), "maria");

        assertThat(thresholds.proceedBelow()).isEqualTo(80_000);
        assertThat(thresholds.ceiling()).isEqualTo(90_000);
    }

    @Test
    void apply_resultBreaksOrdering_nothingApplied() {
        assertThatThrownBy(() -> service.apply(List.of(
                        rec(TunableThresholds.PROCEED_BELOW, 100_000, 90_000),
                        rec(TunableThresholds.MEDIUM_MAX, 1500, 400)), "maria"))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(thresholds.snapshot()).containsEntry(TunableThresholds.PROCEED_BELOW, 100_000L)
                                         .containsEntry(TunableThresholds.MEDIUM_MAX, 1500L);
    }

    private static ThresholdRecommendation rec(String parameter, long oldValue, long newValue) {
        return new ThresholdRecommendation(parameter, oldValue, newValue, Confidence.LOW, 5, "test");
    }
}
