package com.bank.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Snapshot of a metric's rolling baseline")
public class MetricBaseline {

    @Schema(description = "Metric name", example = "denied")
    private String metric;

    @Schema(description = "Detection policy applied to the metric", example = "ADAPTIVE_ZSCORE")
    private DetectionPolicy policy;

    @Schema(description = "Configured rolling window size", example = "60")
    private int windowSize;

    @Schema(description = "Number of samples currently held", example = "42")
    private int historySize;

    @Schema(description = "Mean of the held samples", example = "5.12")
    private double mean;

    @Schema(description = "Population standard deviation of the held samples", example = "0.87")
    private double stdDev;

    @Schema(description = "Whether enough samples exist for statistical scoring", example = "true")
    private boolean warmedUp;

    @Schema(description = "Held samples, oldest first")
    private List<Long> values;
}
