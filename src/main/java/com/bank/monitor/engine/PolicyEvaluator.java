package com.bank.monitor.engine;

import com.bank.monitor.model.DetectionPolicy;
import com.bank.monitor.model.MetricStatus;

/**
 * Interface for all detection policy evaluators.
 * Each implementation handles a specific DetectionPolicy.
 */
public interface PolicyEvaluator {

    /**
     * The policy this evaluator handles.
     */
    DetectionPolicy getSupportedPolicy();

    /**
     * Judge the observed value against the metric's history.
     *
     * @param metric  metric name
     * @param value   this minute's count
     * @param history rolling window BEFORE the value is appended
     * @return the evaluation outcome for this metric
     */
    MetricStatus evaluate(String metric, long value, MetricSeries history);
}
