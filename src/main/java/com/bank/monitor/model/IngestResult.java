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
@Schema(description = "Result of ingesting one minute's batch of transaction status counts")
public class IngestResult {

    @Schema(description = "Processing status", example = "processed")
    private String status;

    @Schema(description = "Alerts raised for this batch, in metric evaluation order")
    private List<AnomalyAlert> alerts;

    @Schema(description = "Per-metric evaluation outcome, in metric evaluation order")
    private List<MetricStatus> metrics;

    @Schema(description = "Processing timestamp in epoch milliseconds", example = "1739886764000")
    private long processedAt;
}
