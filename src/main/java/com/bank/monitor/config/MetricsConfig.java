package com.bank.monitor.config;

import com.bank.monitor.engine.AnomalyMonitor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBatchIngested(String mode) {
        Counter.builder("monitor.batches.ingested")
                .tag("mode", mode)
                .register(registry)
                .increment();
    }

    public void recordBatchRejected() {
        Counter.builder("monitor.batches.rejected")
                .register(registry)
                .increment();
    }

    public void recordAnomaly(String metric, String policy) {
        Counter.builder("monitor.anomaly.detected.count")
                .tag("metric", metric)
                .tag("policy", policy)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Expose the rolling mean and sample count of every tracked metric.
     */
    public void registerBaselineGauges(AnomalyMonitor monitor) {
        for (String metric : monitor.getPolicies().keySet()) {
            Gauge.builder("monitor.baseline.mean", monitor, m -> m.baseline(metric).getMean())
                    .tag("metric", metric)
                    .register(registry);
            Gauge.builder("monitor.baseline.samples", monitor, m -> m.baseline(metric).getHistorySize())
                    .tag("metric", metric)
                    .register(registry);
        }
    }
}
