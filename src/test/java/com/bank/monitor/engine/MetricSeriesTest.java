package com.bank.monitor.engine;

import com.bank.monitor.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MetricSeriesTest {

    @Test
    void emptySeries_statisticsAreZero() {
        MetricSeries series = new MetricSeries("denied", 5);

        assertThat(series.isEmpty()).isTrue();
        assertThat(series.mean()).isEqualTo(0.0);
        assertThat(series.stdDev()).isEqualTo(0.0);
        assertThat(series.snapshot()).isEmpty();
    }

    @Test
    void append_belowCapacity_keepsInsertionOrder() {
        MetricSeries series = TestDataFactory.createSeries("denied", 5, 3, 1, 2);

        assertThat(series.size()).isEqualTo(3);
        assertThat(series.isFull()).isFalse();
        assertThat(series.snapshot()).containsExactly(3L, 1L, 2L);
    }

    @Test
    void append_atCapacity_evictsOldestFirst() {
        MetricSeries series = TestDataFactory.createSeries("denied", 3, 1, 2, 3);
        series.append(4);
        series.append(5);

        assertThat(series.size()).isEqualTo(3);
        assertThat(series.isFull()).isTrue();
        assertThat(series.snapshot()).containsExactly(3L, 4L, 5L);
    }

    @Test
    void append_manyTimes_neverExceedsCapacity() {
        MetricSeries series = new MetricSeries("reversed", 60);
        for (int i = 0; i < 1000; i++) {
            series.append(i);
            assertThat(series.size()).isLessThanOrEqualTo(60);
        }

        assertThat(series.size()).isEqualTo(60);
        assertThat(series.snapshot().get(0)).isEqualTo(940L);
        assertThat(series.snapshot().get(59)).isEqualTo(999L);
    }

    @Test
    void statistics_usePopulationStandardDeviation() {
        // mean=5, deviations all 5 -> population std=5 (sample std would be ~5.27)
        MetricSeries series = TestDataFactory.createSeries("denied", 10, 0, 10, 0, 10, 0, 10, 0, 10, 0, 10);

        assertThat(series.mean()).isCloseTo(5.0, within(1e-9));
        assertThat(series.stdDev()).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void statistics_reflectOnlyRetainedWindow() {
        MetricSeries series = TestDataFactory.createSeries("denied", 2, 100, 4, 6);

        assertThat(series.mean()).isCloseTo(5.0, within(1e-9));
        assertThat(series.stdDev()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void flatSeries_hasZeroStdDev() {
        MetricSeries series = TestDataFactory.createSeries("denied", 10, 5, 5, 5, 5, 5);

        assertThat(series.stdDev()).isEqualTo(0.0);
    }

    @Test
    void constructor_nonPositiveCapacity_throws() {
        assertThatThrownBy(() -> new MetricSeries("denied", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
