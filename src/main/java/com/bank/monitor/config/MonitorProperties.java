package com.bank.monitor.config;

import com.bank.monitor.engine.MonitorConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {

    // Rolling window length in minutes (one batch per minute).
    private int windowSize = 60;

    // Z-score above which an adaptive metric alerts.
    private double sigmaThreshold = 3.0;

    // Samples required before adaptive metrics are scored (cold start guard).
    private int minHistory = 10;

    // Zero-tolerance metrics alert strictly above this count.
    private long staticFailureCeiling = 5;

    // Absolute margin over the mean used when a window has zero variance.
    private double zeroVarianceMargin = 5.0;

    // Metrics read from every batch, in evaluation order.
    private List<String> trackedMetrics = new ArrayList<>(List.of("failed", "denied", "reversed"));

    // Subset of trackedMetrics judged by the static ceiling instead of the Z-score.
    private List<String> zeroToleranceMetrics = new ArrayList<>(List.of("failed"));

    public MonitorConfig toMonitorConfig() {
        return MonitorConfig.builder()
                .windowSize(windowSize)
                .sigmaThreshold(sigmaThreshold)
                .minHistory(minHistory)
                .staticFailureCeiling(staticFailureCeiling)
                .zeroVarianceMargin(zeroVarianceMargin)
                .trackedMetrics(trackedMetrics == null ? null : List.copyOf(trackedMetrics))
                .zeroToleranceMetrics(zeroToleranceMetrics == null ? null : new LinkedHashSet<>(zeroToleranceMetrics))
                .build();
    }
}
