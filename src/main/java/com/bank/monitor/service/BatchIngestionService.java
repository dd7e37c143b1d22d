package com.bank.monitor.service;

import com.bank.monitor.config.MetricsConfig;
import com.bank.monitor.engine.AnomalyMonitor;
import com.bank.monitor.engine.InvalidBatchException;
import com.bank.monitor.model.AnomalyAlert;
import com.bank.monitor.model.IngestResult;
import com.bank.monitor.model.MetricBaseline;
import com.bank.monitor.model.MetricStatus;
import com.bank.monitor.model.ReplaySummary;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for minute batches arriving over HTTP.
 *
 * Flow:
 * 1. Check the payload is a mapping of metric name to count
 * 2. Run it through the AnomalyMonitor (alerts are dispatched by the monitor's sink)
 * 3. Record metrics (the log alert channel reports each anomaly at WARN)
 *
 * Stops accepting batches once the application context starts closing.
 */
@Service
public class BatchIngestionService {

    private static final Logger log = LoggerFactory.getLogger(BatchIngestionService.class);

    private final AnomalyMonitor monitor;
    private final MetricsConfig metricsConfig;

    private volatile boolean accepting = true;

    public BatchIngestionService(AnomalyMonitor monitor, MetricsConfig metricsConfig) {
        this.monitor = monitor;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Ingest one minute's counts and dispatch any alerts.
     *
     * @throws InvalidBatchException if the payload is not a mapping or holds a non-numeric count
     * @throws IngestionStoppedException if the service is shutting down
     */
    @Observed(name = "batch.ingest", contextualName = "ingest-batch")
    public IngestResult ingest(Object payload) {
        ensureAccepting();

        IngestResult result;
        try {
            result = monitor.ingest(toBatch(payload));
        } catch (InvalidBatchException e) {
            metricsConfig.recordBatchRejected();
            throw e;
        }

        metricsConfig.recordBatchIngested("live");
        for (AnomalyAlert alert : result.getAlerts()) {
            metricsConfig.recordAnomaly(alert.getMetric(), alert.getPolicy().name());
            log.debug("Anomaly detected for metric={}: value={}, baseline={}, policy={}",
                    alert.getMetric(), alert.getObservedValue(),
                    String.format("%.2f", alert.getBaselineMean()), alert.getPolicy());
        }
        if (log.isDebugEnabled()) {
            for (MetricStatus status : result.getMetrics()) {
                log.debug("metric={} -> {}", status.getMetric(), status.getReason());
            }
        }
        return result;
    }

    /**
     * Replay historical batches, oldest first, to rebuild the baselines.
     * Alerts are detected and counted but never dispatched. Malformed entries are skipped.
     */
    @Observed(name = "batch.replay", contextualName = "replay-batches")
    public ReplaySummary replay(List<?> payloads) {
        ensureAccepting();

        int processed = 0;
        int rejected = 0;
        int anomalies = 0;
        Map<String, Integer> anomaliesByMetric = new LinkedHashMap<>();

        for (int i = 0; i < payloads.size(); i++) {
            if (!accepting) {
                log.info("Replay interrupted by shutdown after {} of {} batches", i, payloads.size());
                break;
            }

            IngestResult result;
            try {
                result = monitor.warmUp(toBatch(payloads.get(i)));
            } catch (InvalidBatchException e) {
                rejected++;
                metricsConfig.recordBatchRejected();
                log.warn("Skipping malformed batch #{} during replay: {}", i, e.getMessage());
                continue;
            }

            processed++;
            metricsConfig.recordBatchIngested("replay");
            for (AnomalyAlert alert : result.getAlerts()) {
                anomalies++;
                anomaliesByMetric.merge(alert.getMetric(), 1, Integer::sum);
            }
        }

        log.info("Replay complete: processed={}, rejected={}, anomalies={}", processed, rejected, anomalies);

        return ReplaySummary.builder()
                .batchesProcessed(processed)
                .batchesRejected(rejected)
                .anomaliesDetected(anomalies)
                .anomaliesByMetric(anomaliesByMetric)
                .build();
    }

    public List<MetricBaseline> getBaselines() {
        return monitor.baselines();
    }

    /**
     * Returns null when the metric is not tracked.
     */
    public MetricBaseline getBaseline(String metric) {
        if (!monitor.getPolicies().containsKey(metric)) {
            return null;
        }
        return monitor.baseline(metric);
    }

    public boolean isAccepting() {
        return accepting;
    }

    @PreDestroy
    public void stopAccepting() {
        accepting = false;
        log.info("Batch ingestion stopped; no further batches will be accepted");
    }

    private void ensureAccepting() {
        if (!accepting) {
            throw new IngestionStoppedException("Monitor is shutting down; batch rejected");
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> toBatch(Object payload) {
        if (!(payload instanceof Map<?, ?> map)) {
            String type = payload == null ? "null" : payload.getClass().getSimpleName();
            throw new InvalidBatchException("Batch must be a mapping of metric name to count, got " + type);
        }
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                throw new InvalidBatchException("Batch keys must be metric names, got " + key);
            }
        }
        return (Map<String, ?>) map;
    }
}
