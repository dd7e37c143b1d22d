package com.bank.monitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Evaluation outcome for a single metric within one batch")
public class MetricStatus {

    @Schema(description = "Metric name", example = "denied")
    private String metric;

    @Schema(description = "Detection policy applied to the metric", example = "ADAPTIVE_ZSCORE")
    private DetectionPolicy policy;

    @Schema(description = "Observed count for this minute", example = "8")
    private long value;

    @Schema(description = "Number of samples in the rolling window before this value was appended", example = "60")
    private int historySize;

    @Schema(description = "Mean of the rolling window at evaluation time", example = "5.0")
    private double baselineMean;

    @Schema(description = "Population standard deviation of the rolling window at evaluation time", example = "0.0")
    private double baselineStdDev;

    @Schema(description = "Z-score of the observed value; null when it was not computed", example = "3.4")
    @JsonProperty("zScore")
    private Double zScore;

    @Schema(description = "Whether the observed value was flagged as anomalous", example = "false")
    private boolean anomalous;

    @Schema(description = "Human-readable explanation of the evaluation",
            example = "Flat baseline: value=8, mean=5.00, threshold=10.00")
    private String reason;
}
