package com.forgeloop.orchestrator.optimizer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StatisticsTest {

    @Test
    void quantile_interpolatesBetweenClosestRanks() {
        List<Double> values = List.of(4.0, 1.0, 3.0, 2.0);

        assertThat(Statistics.quantile(values, 0.25)).isCloseTo(1.75, within(1e-12));
        assertThat(Statistics.quantile(values, 0.5)).isCloseTo(2.5, within(1e-12));
        assertThat(Statistics.quantile(values, 1.0)).isEqualTo(4.0);
    }

    @Test
    void stddev_usesSampleDenominator() {
        // population stddev would be 2.0
        List<Double> values = List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0);

        assertThat(Statistics.stddev(values)).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-12));
        assertThat(Statistics.stddev(List.of(3.0))).isZero();
    }

    @Test
    void mean_emptySample_rejected() {
        assertThatThrownBy(() -> Statistics.mean(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removeOutliers_keepsOrderAndSplitsByIqrFences() {
        Statistics.OutlierSplit split = Statistics.removeOutliers(List.of(10.0, 12.0, 11.0, 95.0, 13.0, 12.0));

        assertThat(split.removed()).containsExactly(95.0);
        assertThat(split.kept()).containsExactly(10.0, 12.0, 11.0, 13.0, 12.0);
    }

    @Test
    void removeOutliers_identicalValues_nothingRemoved() {
        Statistics.OutlierSplit split = Statistics.removeOutliers(List.of(0.2, 0.2, 0.2, 0.2, 0.2));

        assertThat(split.removed()).isEmpty();
        assertThat(split.kept()).hasSize(5);
    }
}
