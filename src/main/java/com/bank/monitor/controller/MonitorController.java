package com.bank.monitor.controller;

import com.bank.monitor.engine.InvalidBatchException;
import com.bank.monitor.model.IngestResult;
import com.bank.monitor.model.MetricBaseline;
import com.bank.monitor.model.ReplaySummary;
import com.bank.monitor.service.BatchIngestionService;
import com.bank.monitor.service.IngestionStoppedException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/monitor")
@Tag(name = "Monitor", description = "Ingest per-minute transaction status counts and inspect rolling baselines")
public class MonitorController {

    private final BatchIngestionService ingestionService;

    public MonitorController(BatchIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @Operation(summary = "Ingest one minute's batch",
            description = "Evaluates each tracked metric (failed, denied, reversed by default) against its rolling " +
                    "window, dispatches alerts for anomalies and appends the counts to the baselines. " +
                    "Missing metrics count as 0; untracked keys such as timestamp are ignored.")
    @ApiResponse(responseCode = "200", description = "Batch evaluated and appended",
            content = @Content(schema = @Schema(implementation = IngestResult.class)))
    @ApiResponse(responseCode = "400", description = "Malformed batch; no baseline was changed")
    @ApiResponse(responseCode = "503", description = "Monitor is shutting down")
    @PostMapping("/batches")
    public ResponseEntity<?> ingestBatch(@RequestBody Object batch) {
        try {
            IngestResult result = ingestionService.ingest(batch);
            return ResponseEntity.ok(result);
        } catch (InvalidBatchException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IngestionStoppedException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Replay historical batches",
            description = "Rebuilds the rolling baselines after a restart from batches ordered oldest first. " +
                    "Anomalies are counted but no alerts are sent. Malformed batches are skipped.")
    @ApiResponse(responseCode = "200", description = "Replay finished",
            content = @Content(schema = @Schema(implementation = ReplaySummary.class)))
    @ApiResponse(responseCode = "400", description = "Body is not an array")
    @ApiResponse(responseCode = "503", description = "Monitor is shutting down")
    @PostMapping("/batches/replay")
    public ResponseEntity<?> replayBatches(@RequestBody Object batches) {
        if (!(batches instanceof List<?> list)) {
            return ResponseEntity.badRequest().body(Map.of("error", "Replay body must be an array of batches"));
        }
        try {
            ReplaySummary summary = ingestionService.replay(list);
            return ResponseEntity.ok(summary);
        } catch (IngestionStoppedException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Get all rolling baselines")
    @GetMapping("/baselines")
    public ResponseEntity<List<MetricBaseline>> getBaselines() {
        return ResponseEntity.ok(ingestionService.getBaselines());
    }

    @Operation(summary = "Get the rolling baseline of one metric",
            description = "Returns window contents (oldest first), mean, standard deviation and warm-up state.")
    @GetMapping("/baselines/{metric}")
    public ResponseEntity<MetricBaseline> getBaseline(
            @Parameter(description = "Metric name", example = "denied")
            @PathVariable String metric) {
        MetricBaseline baseline = ingestionService.getBaseline(metric);
        if (baseline == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(baseline);
    }
}
