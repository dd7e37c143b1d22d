package com.bank.monitor.engine;

import lombok.Builder;
import lombok.Value;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable detection settings for one {@link AnomalyMonitor}.
 */
@Value
@Builder
public class MonitorConfig {

    public static final List<String> DEFAULT_TRACKED_METRICS = List.of("failed", "denied", "reversed");
    public static final Set<String> DEFAULT_ZERO_TOLERANCE_METRICS = Set.of("failed");

    // Rolling window length, one sample per minute
    @Builder.Default
    int windowSize = 60;

    // Z-score above which an adaptive metric is flagged
    @Builder.Default
    double sigmaThreshold = 3.0;

    // Adaptive metrics never fire with fewer samples than this
    @Builder.Default
    int minHistory = 10;

    // Zero-tolerance metrics fire strictly above this count
    @Builder.Default
    long staticFailureCeiling = 5;

    // Absolute margin over the mean used when the window has zero variance
    @Builder.Default
    double zeroVarianceMargin = 5.0;

    // Evaluation order of the metrics, also the order of alerts in a result
    @Builder.Default
    List<String> trackedMetrics = DEFAULT_TRACKED_METRICS;

    // Metrics judged by the static ceiling instead of the rolling Z-score
    @Builder.Default
    Set<String> zeroToleranceMetrics = DEFAULT_ZERO_TOLERANCE_METRICS;

    public static MonitorConfig defaults() {
        return MonitorConfig.builder().build();
    }

    void validate() {
        if (windowSize <= 0) {
            throw new InvalidMonitorConfigException("windowSize must be > 0, got " + windowSize);
        }
        if (!(sigmaThreshold > 0) || Double.isInfinite(sigmaThreshold)) {
            throw new InvalidMonitorConfigException("sigmaThreshold must be a positive number, got " + sigmaThreshold);
        }
        if (minHistory <= 0) {
            throw new InvalidMonitorConfigException("minHistory must be > 0, got " + minHistory);
        }
        if (staticFailureCeiling < 0) {
            throw new InvalidMonitorConfigException("staticFailureCeiling must be >= 0, got " + staticFailureCeiling);
        }
        if (!(zeroVarianceMargin >= 0) || Double.isInfinite(zeroVarianceMargin)) {
            throw new InvalidMonitorConfigException("zeroVarianceMargin must be >= 0, got " + zeroVarianceMargin);
        }

        if (trackedMetrics == null || trackedMetrics.isEmpty()) {
            throw new InvalidMonitorConfigException("trackedMetrics must not be empty");
        }
        Set<String> seen = new HashSet<>();
        for (String metric : trackedMetrics) {
            if (metric == null || metric.isBlank()) {
                throw new InvalidMonitorConfigException("trackedMetrics must not contain blank names");
            }
            if (!seen.add(metric)) {
                throw new InvalidMonitorConfigException("trackedMetrics contains duplicate metric: " + metric);
            }
        }
        if (zeroToleranceMetrics == null) {
            throw new InvalidMonitorConfigException("zeroToleranceMetrics must not be null");
        }
        for (String metric : zeroToleranceMetrics) {
            if (!seen.contains(metric)) {
                throw new InvalidMonitorConfigException(
                        "zeroToleranceMetrics must be tracked, unknown metric: " + metric);
            }
        }
    }
}
