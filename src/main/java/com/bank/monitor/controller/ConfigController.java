package com.bank.monitor.controller;

import com.bank.monitor.config.MonitorProperties;
import com.bank.monitor.config.TwilioAlertProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View the detection and alerting configuration (read-only)")
public class ConfigController {

    private final MonitorProperties monitorProperties;
    private final TwilioAlertProperties twilioConfig;

    public ConfigController(MonitorProperties monitorProperties,
                            TwilioAlertProperties twilioConfig) {
        this.monitorProperties = monitorProperties;
        this.twilioConfig = twilioConfig;
    }

    @Operation(summary = "Get detection settings",
            description = "Settings are fixed at startup; changing them requires a restart and a baseline replay.")
    @GetMapping("/monitor")
    public ResponseEntity<Map<String, Object>> getMonitorConfig() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("windowSize", monitorProperties.getWindowSize());
        response.put("sigmaThreshold", monitorProperties.getSigmaThreshold());
        response.put("minHistory", monitorProperties.getMinHistory());
        response.put("staticFailureCeiling", monitorProperties.getStaticFailureCeiling());
        response.put("zeroVarianceMargin", monitorProperties.getZeroVarianceMargin());
        response.put("trackedMetrics", monitorProperties.getTrackedMetrics());
        response.put("zeroToleranceMetrics", monitorProperties.getZeroToleranceMetrics());
        return ResponseEntity.ok(response);
    }

    // Credentials are never echoed back
    @Operation(summary = "Get alert channel settings")
    @GetMapping("/alerting")
    public ResponseEntity<Map<String, Object>> getAlertingConfig() {
        return ResponseEntity.ok(Map.of(
                "twilioEnabled", twilioConfig.isEnabled(),
                "twilioChannel", twilioConfig.getChannel(),
                "recipientCount", twilioConfig.getRecipients().size()
        ));
    }
}
