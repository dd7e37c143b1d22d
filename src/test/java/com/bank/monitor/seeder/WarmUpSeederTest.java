package com.bank.monitor.seeder;

import com.bank.monitor.engine.AlertSink;
import com.bank.monitor.engine.AnomalyMonitor;
import com.bank.monitor.engine.MonitorConfig;
import com.bank.monitor.model.MetricBaseline;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class WarmUpSeederTest {

    @Mock private AlertSink alertSink;

    @Test
    void run_fillsEveryWindowWithoutAlerting() {
        AnomalyMonitor monitor = new AnomalyMonitor(MonitorConfig.defaults(), alertSink);

        new WarmUpSeeder(monitor).run();

        assertThat(monitor.baselines())
                .allSatisfy(b -> {
                    assertThat(b.getHistorySize()).isEqualTo(60);
                    assertThat(b.isWarmedUp()).isTrue();
                });
        assertThat(monitor.baseline("failed").getMean()).isEqualTo(0.0);
        verifyNoInteractions(alertSink);
    }

    @Test
    void healthyMinute_coversEveryTrackedMetricWithinHealthyRange() {
        AnomalyMonitor monitor = new AnomalyMonitor(MonitorConfig.defaults(), alertSink);

        Map<String, Object> minute = new WarmUpSeeder(monitor).healthyMinute();

        assertThat(minute).containsOnlyKeys("failed", "denied", "reversed");
        assertThat((Long) minute.get("failed")).isZero();
        assertThat((Long) minute.get("denied")).isBetween(4L, 6L);
        assertThat((Long) minute.get("reversed")).isBetween(0L, 2L);
    }

    @Test
    void seededBaselines_stillDetectFailureSpike() {
        AnomalyMonitor monitor = new AnomalyMonitor(MonitorConfig.defaults(), alertSink);
        new WarmUpSeeder(monitor).run();

        MetricBaseline denied = monitor.baseline("denied");

        assertThat(denied.getMean()).isBetween(4.0, 6.0);
        assertThat(denied.getStdDev()).isGreaterThan(0.0);
        assertThat(monitor.ingest(Map.of("failed", 15)).getAlerts()).hasSize(1);
    }
}
