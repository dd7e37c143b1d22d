package com.bank.monitor.engine.evaluators;

import com.bank.monitor.engine.MetricSeries;
import com.bank.monitor.engine.PolicyEvaluator;
import com.bank.monitor.model.DetectionPolicy;
import com.bank.monitor.model.MetricStatus;

/**
 * Zero-tolerance check for metrics that should sit near zero in healthy operation.
 *
 * Logic: flag when value > ceiling, whatever the history holds. No warm-up is
 * needed, so a failure spike is caught even right after a restart.
 *
 * Example: ceiling=5. A minute with 15 failed transactions fires; a minute with
 * exactly 5 does not.
 */
public class StaticCeilingEvaluator implements PolicyEvaluator {

    private final long ceiling;

    public StaticCeilingEvaluator(long ceiling) {
        this.ceiling = ceiling;
    }

    @Override
    public DetectionPolicy getSupportedPolicy() {
        return DetectionPolicy.STATIC_CEILING;
    }

    @Override
    public MetricStatus evaluate(String metric, long value, MetricSeries history) {
        boolean anomalous = value > ceiling;

        String reason = anomalous
                ? String.format("Static ceiling exceeded: value=%d, ceiling=%d", value, ceiling)
                : String.format("Within static ceiling: value=%d, ceiling=%d", value, ceiling);

        return MetricStatus.builder()
                .metric(metric)
                .policy(DetectionPolicy.STATIC_CEILING)
                .value(value)
                .historySize(history.size())
                .baselineMean(history.mean())
                .baselineStdDev(history.stdDev())
                .anomalous(anomalous)
                .reason(reason)
                .build();
    }
}
