package com.bank.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of replaying historical batches to rebuild the rolling baselines")
public class ReplaySummary {

    @Schema(description = "Batches applied to the baselines", example = "60")
    private int batchesProcessed;

    @Schema(description = "Malformed batches skipped", example = "0")
    private int batchesRejected;

    @Schema(description = "Anomalies detected during replay (not dispatched)", example = "1")
    private int anomaliesDetected;

    @Schema(description = "Anomalies detected per metric", example = "{\"failed\": 1}")
    private Map<String, Integer> anomaliesByMetric;
}
