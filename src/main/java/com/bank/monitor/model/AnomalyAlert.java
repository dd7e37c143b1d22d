package com.bank.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Alert raised when a metric's observed value is flagged as anomalous")
public class AnomalyAlert {

    @Schema(description = "Metric name", example = "failed")
    String metric;

    @Schema(description = "Observed count that triggered the alert", example = "15")
    long observedValue;

    @Schema(description = "Rolling-window mean at evaluation time, 0 when no history exists", example = "0.0")
    double baselineMean;

    @Schema(description = "Detection policy that fired", example = "STATIC_CEILING")
    DetectionPolicy policy;

    @Schema(description = "Human-readable alert text",
            example = "[ALERT] Anomaly detected in 'failed': Current Value 15 (Expected Baseline: ~0.00)")
    String message;

    @Schema(description = "Detection timestamp in epoch milliseconds", example = "1739886764000")
    long detectedAt;
}
