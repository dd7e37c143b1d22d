package com.bank.monitor.engine;

import com.bank.monitor.model.AnomalyAlert;
import com.bank.monitor.model.DetectionPolicy;
import com.bank.monitor.model.IngestResult;
import com.bank.monitor.model.MetricBaseline;
import com.bank.monitor.model.MetricStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Streaming anomaly detector over per-minute transaction status counts.
 *
 * Flow for each batch, per tracked metric in configured order:
 * 1. Read the count (absent = 0)
 * 2. Evaluate the metric's policy against the history as it was before this minute
 * 3. Build an alert if the policy fired
 * 4. Append the count to the rolling window
 * Alerts are then handed to the sink in evaluation order.
 *
 * Ingestion of one batch is atomic with respect to other batches on the same
 * instance. History is in-memory only and must be rebuilt with {@link #warmUp}
 * after a restart.
 */
public class AnomalyMonitor {

    private static final Logger log = LoggerFactory.getLogger(AnomalyMonitor.class);

    public static final String STATUS_PROCESSED = "processed";

    private final MonitorConfig config;
    private final DetectionEngine detectionEngine;
    private final AlertSink alertSink;
    private final Map<String, DetectionPolicy> policyByMetric;
    private final Map<String, MetricSeries> seriesByMetric;
    private final Object ingestLock = new Object();

    public AnomalyMonitor(MonitorConfig config, AlertSink alertSink) {
        this(config, null, alertSink);
    }

    public AnomalyMonitor(MonitorConfig config, DetectionEngine detectionEngine, AlertSink alertSink) {
        if (config == null) {
            throw new InvalidMonitorConfigException("config must not be null");
        }
        config.validate();
        if (alertSink == null) {
            throw new InvalidMonitorConfigException("alertSink must not be null");
        }

        this.config = config;
        this.detectionEngine = detectionEngine != null
                ? detectionEngine
                : DetectionEngine.withDefaultEvaluators(config);
        this.alertSink = alertSink;

        Map<String, DetectionPolicy> policies = new LinkedHashMap<>();
        Map<String, MetricSeries> series = new LinkedHashMap<>();
        for (String metric : config.getTrackedMetrics()) {
            DetectionPolicy policy = config.getZeroToleranceMetrics().contains(metric)
                    ? DetectionPolicy.STATIC_CEILING
                    : DetectionPolicy.ADAPTIVE_ZSCORE;
            if (!this.detectionEngine.supports(policy)) {
                throw new InvalidMonitorConfigException(
                        "No evaluator registered for policy " + policy + " (metric " + metric + ")");
            }
            policies.put(metric, policy);
            series.put(metric, new MetricSeries(metric, config.getWindowSize()));
        }
        this.policyByMetric = Collections.unmodifiableMap(policies);
        this.seriesByMetric = series;

        if (config.getWindowSize() < config.getMinHistory()) {
            log.warn("windowSize={} is smaller than minHistory={}; adaptive metrics will never alert",
                    config.getWindowSize(), config.getMinHistory());
        }
        log.info("Anomaly monitor ready: window={}, sigma={}, policies={}",
                config.getWindowSize(), config.getSigmaThreshold(), policyByMetric);
    }

    /**
     * Evaluate one minute's counts, dispatch any alerts and update the rolling windows.
     *
     * Not idempotent: the batch becomes part of the baseline, so the same batch
     * ingested again is judged against a different history.
     *
     * @param batch metric name to count; untracked keys are ignored
     * @return alerts and per-metric outcome, in metric evaluation order
     * @throws InvalidBatchException if the batch is null or a tracked count is not an integer
     */
    public IngestResult ingest(Map<String, ?> batch) {
        IngestResult result = process(batch);
        for (AnomalyAlert alert : result.getAlerts()) {
            dispatch(alert);
        }
        return result;
    }

    /**
     * Same as {@link #ingest} but never calls the alert sink. Used to rebuild
     * baselines from historical batches without re-raising old incidents.
     */
    public IngestResult warmUp(Map<String, ?> batch) {
        return process(batch);
    }

    public MonitorConfig getConfig() {
        return config;
    }

    /**
     * Tracked metrics and their policy, in evaluation order.
     */
    public Map<String, DetectionPolicy> getPolicies() {
        return policyByMetric;
    }

    public MetricBaseline baseline(String metric) {
        MetricSeries series = seriesByMetric.get(metric);
        if (series == null) {
            throw new IllegalArgumentException("Unknown metric: " + metric);
        }
        synchronized (ingestLock) {
            return toBaseline(series);
        }
    }

    public List<MetricBaseline> baselines() {
        synchronized (ingestLock) {
            List<MetricBaseline> baselines = new ArrayList<>(seriesByMetric.size());
            for (MetricSeries series : seriesByMetric.values()) {
                baselines.add(toBaseline(series));
            }
            return baselines;
        }
    }

    private IngestResult process(Map<String, ?> batch) {
        // Validate everything first so a bad batch leaves every window untouched
        Map<String, Long> counts = readCounts(batch);

        List<MetricStatus> statuses = new ArrayList<>(policyByMetric.size());
        List<AnomalyAlert> alerts = new ArrayList<>();
        long now = System.currentTimeMillis();

        synchronized (ingestLock) {
            for (Map.Entry<String, DetectionPolicy> entry : policyByMetric.entrySet()) {
                String metric = entry.getKey();
                long value = counts.get(metric);
                MetricSeries series = seriesByMetric.get(metric);

                MetricStatus status = detectionEngine.evaluate(entry.getValue(), metric, value, series);
                statuses.add(status);
                if (status.isAnomalous()) {
                    alerts.add(buildAlert(status, now));
                }

                series.append(value);
            }
        }

        return IngestResult.builder()
                .status(STATUS_PROCESSED)
                .alerts(Collections.unmodifiableList(alerts))
                .metrics(Collections.unmodifiableList(statuses))
                .processedAt(now)
                .build();
    }

    private Map<String, Long> readCounts(Map<String, ?> batch) {
        if (batch == null) {
            throw new InvalidBatchException("Batch must be a mapping of metric name to count, got null");
        }
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String metric : policyByMetric.keySet()) {
            counts.put(metric, toCount(metric, batch.get(metric)));
        }
        return counts;
    }

    private static long toCount(String metric, Object raw) {
        if (raw == null) {
            return 0L;
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger big) {
            try {
                return big.longValueExact();
            } catch (ArithmeticException e) {
                throw new InvalidBatchException("Count for '" + metric + "' is out of range: " + raw);
            }
        }
        if (raw instanceof BigDecimal decimal) {
            try {
                return decimal.longValueExact();
            } catch (ArithmeticException e) {
                throw new InvalidBatchException("Count for '" + metric + "' must be a whole number, got " + raw);
            }
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)
                    || d > Long.MAX_VALUE || d < Long.MIN_VALUE) {
                throw new InvalidBatchException("Count for '" + metric + "' must be a whole number, got " + raw);
            }
            return (long) d;
        }
        throw new InvalidBatchException("Count for '" + metric + "' must be numeric, got "
                + raw.getClass().getSimpleName() + " '" + raw + "'");
    }

    private AnomalyAlert buildAlert(MetricStatus status, long detectedAt) {
        String message = String.format("[ALERT] Anomaly detected in '%s': Current Value %d (Expected Baseline: ~%.2f)",
                status.getMetric(), status.getValue(), status.getBaselineMean());

        return AnomalyAlert.builder()
                .metric(status.getMetric())
                .observedValue(status.getValue())
                .baselineMean(status.getBaselineMean())
                .policy(status.getPolicy())
                .message(message)
                .detectedAt(detectedAt)
                .build();
    }

    private void dispatch(AnomalyAlert alert) {
        try {
            alertSink.notify(alert);
        } catch (Exception e) {
            // Detection already happened; only delivery failed
            log.error("Failed to deliver alert for metric={} value={}: {}",
                    alert.getMetric(), alert.getObservedValue(), e.getMessage(), e);
        }
    }

    private MetricBaseline toBaseline(MetricSeries series) {
        DetectionPolicy policy = policyByMetric.get(series.getMetric());
        return MetricBaseline.builder()
                .metric(series.getMetric())
                .policy(policy)
                .windowSize(series.capacity())
                .historySize(series.size())
                .mean(series.mean())
                .stdDev(series.stdDev())
                .warmedUp(policy == DetectionPolicy.STATIC_CEILING || series.size() >= config.getMinHistory())
                .values(series.snapshot())
                .build();
    }
}
