package com.bank.monitor.engine.evaluators;

import com.bank.monitor.engine.MetricSeries;
import com.bank.monitor.engine.PolicyEvaluator;
import com.bank.monitor.model.DetectionPolicy;
import com.bank.monitor.model.MetricStatus;

/**
 * Scores a noisy metric against its own rolling window.
 *
 * Logic:
 *   1. Fewer than minHistory samples: never fires (cold start).
 *   2. Zero variance: fires when value > mean + margin, since a Z-score is undefined.
 *   3. Otherwise fires when (value - mean) / std > sigma. One-sided, drops are never flagged.
 *
 * Example: window of ten 5s (mean=5, std=0), margin=5. A value of 11 fires, 10 does not.
 */
public class AdaptiveZScoreEvaluator implements PolicyEvaluator {

    private final int minHistory;
    private final double sigmaThreshold;
    private final double zeroVarianceMargin;

    public AdaptiveZScoreEvaluator(int minHistory, double sigmaThreshold, double zeroVarianceMargin) {
        this.minHistory = minHistory;
        this.sigmaThreshold = sigmaThreshold;
        this.zeroVarianceMargin = zeroVarianceMargin;
    }

    @Override
    public DetectionPolicy getSupportedPolicy() {
        return DetectionPolicy.ADAPTIVE_ZSCORE;
    }

    @Override
    public MetricStatus evaluate(String metric, long value, MetricSeries history) {
        int historySize = history.size();
        if (historySize < minHistory) {
            return MetricStatus.builder()
                    .metric(metric)
                    .policy(DetectionPolicy.ADAPTIVE_ZSCORE)
                    .value(value)
                    .historySize(historySize)
                    .baselineMean(history.mean())
                    .baselineStdDev(history.stdDev())
                    .anomalous(false)
                    .reason(String.format("Cold start: %d of %d samples collected", historySize, minHistory))
                    .build();
        }

        double mean = history.mean();
        double std = history.stdDev();

        if (std == 0.0) {
            double threshold = mean + zeroVarianceMargin;
            boolean anomalous = value > threshold;
            String reason = String.format("Flat baseline: value=%d, mean=%.2f, threshold=%.2f%s",
                    value, mean, threshold, anomalous ? ". Exceeded." : "");

            return MetricStatus.builder()
                    .metric(metric)
                    .policy(DetectionPolicy.ADAPTIVE_ZSCORE)
                    .value(value)
                    .historySize(historySize)
                    .baselineMean(mean)
                    .baselineStdDev(0.0)
                    .anomalous(anomalous)
                    .reason(reason)
                    .build();
        }

        double zScore = (value - mean) / std;
        boolean anomalous = zScore > sigmaThreshold;
        String reason = String.format("Z-score=%.2f (threshold=%.2f): value=%d, mean=%.2f, std=%.2f",
                zScore, sigmaThreshold, value, mean, std);

        return MetricStatus.builder()
                .metric(metric)
                .policy(DetectionPolicy.ADAPTIVE_ZSCORE)
                .value(value)
                .historySize(historySize)
                .baselineMean(mean)
                .baselineStdDev(std)
                .zScore(zScore)
                .anomalous(anomalous)
                .reason(reason)
                .build();
    }
}
