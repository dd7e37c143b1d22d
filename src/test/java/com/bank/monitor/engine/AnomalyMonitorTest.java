package com.bank.monitor.engine;

import com.bank.monitor.engine.evaluators.StaticCeilingEvaluator;
import com.bank.monitor.model.AnomalyAlert;
import com.bank.monitor.model.DetectionPolicy;
import com.bank.monitor.model.IngestResult;
import com.bank.monitor.model.MetricBaseline;
import com.bank.monitor.model.MetricStatus;
import com.bank.monitor.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyMonitorTest {

    @Mock private AlertSink alertSink;

    private AnomalyMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new AnomalyMonitor(MonitorConfig.defaults(), alertSink);
    }

    // ── Construction ──

    @Test
    void constructor_createsEmptySeriesPerTrackedMetric() {
        assertThat(monitor.getPolicies()).containsExactly(
                Map.entry("failed", DetectionPolicy.STATIC_CEILING),
                Map.entry("denied", DetectionPolicy.ADAPTIVE_ZSCORE),
                Map.entry("reversed", DetectionPolicy.ADAPTIVE_ZSCORE));
        assertThat(monitor.baselines())
                .extracting(MetricBaseline::getHistorySize)
                .containsExactly(0, 0, 0);
    }

    @Test
    void constructor_zeroWindow_throwsConfigError() {
        MonitorConfig config = MonitorConfig.builder().windowSize(0).build();

        assertThatThrownBy(() -> new AnomalyMonitor(config, alertSink))
                .isInstanceOf(InvalidMonitorConfigException.class)
                .hasMessageContaining("windowSize");
    }

    @Test
    void constructor_nonPositiveSigma_throwsConfigError() {
        assertThatThrownBy(() -> new AnomalyMonitor(MonitorConfig.builder().sigmaThreshold(0).build(), alertSink))
                .isInstanceOf(InvalidMonitorConfigException.class)
                .hasMessageContaining("sigmaThreshold");
        assertThatThrownBy(() -> new AnomalyMonitor(MonitorConfig.builder().sigmaThreshold(-1.5).build(), alertSink))
                .isInstanceOf(InvalidMonitorConfigException.class);
        assertThatThrownBy(() -> new AnomalyMonitor(MonitorConfig.builder().sigmaThreshold(Double.NaN).build(), alertSink))
                .isInstanceOf(InvalidMonitorConfigException.class);
    }

    @Test
    void constructor_zeroToleranceMetricNotTracked_throwsConfigError() {
        MonitorConfig config = MonitorConfig.builder()
                .trackedMetrics(List.of("denied"))
                .zeroToleranceMetrics(Set.of("failed"))
                .build();

        assertThatThrownBy(() -> new AnomalyMonitor(config, alertSink))
                .isInstanceOf(InvalidMonitorConfigException.class)
                .hasMessageContaining("failed");
    }

    @Test
    void constructor_missingEvaluatorForPolicy_throwsConfigError() {
        DetectionEngine staticOnly = new DetectionEngine(List.of(
                new StaticCeilingEvaluator(5)));

        assertThatThrownBy(() -> new AnomalyMonitor(MonitorConfig.defaults(), staticOnly, alertSink))
                .isInstanceOf(InvalidMonitorConfigException.class)
                .hasMessageContaining("ADAPTIVE_ZSCORE");
    }

    @Test
    void constructor_customMetricSet_isEvaluatedInConfiguredOrder() {
        MonitorConfig config = MonitorConfig.builder()
                .trackedMetrics(List.of("chargeback", "failed"))
                .zeroToleranceMetrics(Set.of("chargeback", "failed"))
                .build();
        AnomalyMonitor custom = new AnomalyMonitor(config, alertSink);

        IngestResult result = custom.ingest(Map.of("chargeback", 9, "failed", 7));

        assertThat(result.getAlerts()).extracting(AnomalyAlert::getMetric)
                .containsExactly("chargeback", "failed");
    }

    // ── Detection scenarios ──

    @Test
    void scenarioA_failureSpikeAfterSteadyTraffic_alertsOnlyOnFailed() {
        for (int i = 0; i < 60; i++) {
            IngestResult warm = monitor.ingest(Map.of("failed", 0, "denied", 5, "reversed", 1));
            assertThat(warm.getAlerts()).isEmpty();
        }

        IngestResult result = monitor.ingest(Map.of("failed", 15, "denied", 8, "reversed", 2));

        assertThat(result.getStatus()).isEqualTo("processed");
        assertThat(result.getAlerts()).hasSize(1);
        AnomalyAlert alert = result.getAlerts().get(0);
        assertThat(alert.getMetric()).isEqualTo("failed");
        assertThat(alert.getObservedValue()).isEqualTo(15);
        assertThat(alert.getBaselineMean()).isEqualTo(0.0);
        assertThat(alert.getPolicy()).isEqualTo(DetectionPolicy.STATIC_CEILING);
        assertThat(alert.getMessage()).contains("'failed'").contains("Current Value 15");
        verify(alertSink, times(1)).notify(alert);
    }

    @Test
    void scenarioB_flatHistory_firesOnlyAboveMeanPlusMargin() {
        for (int i = 0; i < 10; i++) {
            monitor.ingest(Map.of("denied", 5));
        }
        assertThat(monitor.baseline("denied").getStdDev()).isEqualTo(0.0);
        assertThat(monitor.baseline("denied").getMean()).isEqualTo(5.0);

        IngestResult atMargin = monitor.ingest(Map.of("denied", 10));
        assertThat(atMargin.getAlerts()).isEmpty();

        // history is now ten 5s plus one 10, so rebuild a flat window first
        AnomalyMonitor fresh = new AnomalyMonitor(MonitorConfig.defaults(), alertSink);
        for (int i = 0; i < 10; i++) {
            fresh.ingest(Map.of("denied", 5));
        }
        IngestResult aboveMargin = fresh.ingest(Map.of("denied", 11));
        assertThat(aboveMargin.getAlerts()).extracting(AnomalyAlert::getMetric).containsExactly("denied");
        assertThat(aboveMargin.getAlerts().get(0).getBaselineMean()).isEqualTo(5.0);
    }

    @Test
    void scenarioC_nineSamples_extremeOutlierDoesNotFire() {
        for (int i = 0; i < 9; i++) {
            monitor.ingest(Map.of("denied", 5, "reversed", 1));
        }

        IngestResult result = monitor.ingest(Map.of("denied", 100_000, "reversed", 100_000));

        assertThat(result.getAlerts()).isEmpty();
        verifyNoInteractions(alertSink);
    }

    @Test
    void scenarioD_nullBatch_throwsInputErrorAndLeavesHistoryUntouched() {
        monitor.ingest(TestDataFactory.createBatch(1, 5, 1));

        assertThatThrownBy(() -> monitor.ingest(null))
                .isInstanceOf(InvalidBatchException.class);

        assertThat(monitor.baselines()).extracting(MetricBaseline::getHistorySize).containsExactly(1, 1, 1);
    }

    @Test
    void nonNumericCount_throwsInputErrorBeforeAnyMetricIsAppended() {
        Map<String, Object> batch = new HashMap<>();
        batch.put("failed", 1);
        batch.put("denied", 2);
        batch.put("reversed", "three");

        assertThatThrownBy(() -> monitor.ingest(batch))
                .isInstanceOf(InvalidBatchException.class)
                .hasMessageContaining("reversed");

        assertThat(monitor.baselines()).extracting(MetricBaseline::getHistorySize).containsExactly(0, 0, 0);
    }

    @Test
    void fractionalCount_throwsInputError() {
        assertThatThrownBy(() -> monitor.ingest(Map.of("denied", 2.5)))
                .isInstanceOf(InvalidBatchException.class);
    }

    @Test
    void wholeNumberDouble_isAccepted() {
        monitor.ingest(Map.of("denied", 4.0));

        assertThat(monitor.baseline("denied").getValues()).containsExactly(4L);
    }

    @Test
    void missingAndNullMetrics_countAsZero() {
        Map<String, Object> batch = new HashMap<>();
        batch.put("denied", null);
        batch.put("timestamp", "10:00");

        IngestResult result = monitor.ingest(batch);

        assertThat(result.getMetrics()).extracting(MetricStatus::getValue).containsExactly(0L, 0L, 0L);
        assertThat(monitor.baseline("failed").getValues()).containsExactly(0L);
    }

    @Test
    void negativeCount_isAccepted() {
        monitor.ingest(Map.of("reversed", -2));

        assertThat(monitor.baseline("reversed").getValues()).containsExactly(-2L);
    }

    @Test
    void staticMetric_firesRegardlessOfHistoryLength() {
        IngestResult first = monitor.ingest(Map.of("failed", 6));
        assertThat(first.getAlerts()).extracting(AnomalyAlert::getMetric).containsExactly("failed");
        assertThat(first.getAlerts().get(0).getBaselineMean()).isEqualTo(0.0);

        IngestResult atCeiling = monitor.ingest(Map.of("failed", 5));
        assertThat(atCeiling.getAlerts()).isEmpty();
    }

    @Test
    void currentValueIsJudgedAgainstPastOnly() {
        for (int i = 0; i < 10; i++) {
            monitor.ingest(Map.of("denied", 5));
        }

        IngestResult result = monitor.ingest(Map.of("denied", 11));

        // had 11 been appended first the mean would be 5.55 and the window no longer flat
        assertThat(result.getMetrics().get(1).getHistorySize()).isEqualTo(10);
        assertThat(result.getMetrics().get(1).getBaselineMean()).isEqualTo(5.0);
        assertThat(result.getAlerts()).hasSize(1);
        assertThat(monitor.baseline("denied").getHistorySize()).isEqualTo(11);
    }

    @Test
    void ingest_isNotIdempotent() {
        AnomalyMonitor tolerant = new AnomalyMonitor(MonitorConfig.builder().sigmaThreshold(3.5).build(), alertSink);
        for (int i = 0; i < 10; i++) {
            tolerant.ingest(Map.of("denied", 5));
        }
        Map<String, Object> spike = Map.of("denied", 11);

        IngestResult first = tolerant.ingest(spike);
        IngestResult second = tolerant.ingest(spike);

        // the first spike widened the baseline, so the same count no longer stands out
        assertThat(first.getAlerts()).hasSize(1);
        assertThat(second.getAlerts()).isEmpty();
        assertThat(second.getMetrics().get(1).getHistorySize()).isEqualTo(11);
    }

    // ── Bounded history ──

    @Test
    void history_neverExceedsWindow_andEvictsOldestFirst() {
        AnomalyMonitor small = new AnomalyMonitor(MonitorConfig.builder().windowSize(3).build(), alertSink);

        for (int i = 1; i <= 5; i++) {
            small.ingest(Map.of("denied", i));
        }

        MetricBaseline baseline = small.baseline("denied");
        assertThat(baseline.getHistorySize()).isEqualTo(3);
        assertThat(baseline.getValues()).containsExactly(3L, 4L, 5L);
    }

    @Test
    void baseline_unknownMetric_throws() {
        assertThatThrownBy(() -> monitor.baseline("approved"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ── Alert dispatch ──

    @Test
    void sinkFailure_doesNotAbortRemainingMetricsOrLaterBatches() {
        MonitorConfig config = MonitorConfig.builder()
                .trackedMetrics(List.of("failed", "denied"))
                .zeroToleranceMetrics(Set.of("failed", "denied"))
                .build();
        AnomalyMonitor twoStatic = new AnomalyMonitor(config, alertSink);
        doThrow(new AlertDeliveryException("webhook down", null)).when(alertSink).notify(any());

        IngestResult result = twoStatic.ingest(Map.of("failed", 9, "denied", 9));

        assertThat(result.getAlerts()).extracting(AnomalyAlert::getMetric).containsExactly("failed", "denied");
        verify(alertSink, times(2)).notify(any());
        assertThat(twoStatic.baselines()).extracting(MetricBaseline::getHistorySize).containsExactly(1, 1);

        IngestResult next = twoStatic.ingest(Map.of("failed", 7));
        assertThat(next.getAlerts()).hasSize(1);
        verify(alertSink, times(3)).notify(any());
    }

    @Test
    void alerts_areDispatchedInEvaluationOrder() {
        for (int i = 0; i < 10; i++) {
            monitor.ingest(Map.of("failed", 0, "denied", 5, "reversed", 1));
        }

        monitor.ingest(Map.of("failed", 20, "denied", 50, "reversed", 50));

        ArgumentCaptor<AnomalyAlert> captor = ArgumentCaptor.forClass(AnomalyAlert.class);
        verify(alertSink, times(3)).notify(captor.capture());
        assertThat(captor.getAllValues()).extracting(AnomalyAlert::getMetric)
                .containsExactly("failed", "denied", "reversed");
    }

    @Test
    void warmUp_detectsButNeverCallsSink() {
        IngestResult result = monitor.warmUp(Map.of("failed", 50));

        assertThat(result.getAlerts()).hasSize(1);
        assertThat(monitor.baseline("failed").getHistorySize()).isEqualTo(1);
        verifyNoInteractions(alertSink);
    }

    // ── Concurrency ──

    @Test
    void concurrentIngest_neverLosesAppends() throws Exception {
        AnomalyMonitor large = new AnomalyMonitor(MonitorConfig.builder().windowSize(10_000).build(), alertSink);
        int threads = 8;
        int batchesPerThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < batchesPerThread; i++) {
                    large.ingest(Map.of("failed", 0, "denied", 5, "reversed", 1));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(large.baselines()).extracting(MetricBaseline::getHistorySize)
                .containsOnly(threads * batchesPerThread);
    }
}
