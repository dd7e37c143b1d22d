package com.bank.monitor.service;

import com.bank.monitor.config.MetricsConfig;
import com.bank.monitor.engine.AlertSink;
import com.bank.monitor.model.AnomalyAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Alert sink backing the monitor. Fans each alert out to every enabled channel
 * on the async executor so a slow or failing channel never delays ingestion.
 */
@Service
public class AlertNotificationService implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(AlertNotificationService.class);

    private final List<AlertChannel> channels;
    private final MetricsConfig metricsConfig;

    public AlertNotificationService(List<AlertChannel> channels, MetricsConfig metricsConfig) {
        this.channels = channels;
        this.metricsConfig = metricsConfig;
    }

    @Async
    @Override
    public void notify(AnomalyAlert alert) {
        for (AlertChannel channel : channels) {
            if (!channel.isEnabled()) {
                continue;
            }

            try {
                channel.deliver(alert);
                metricsConfig.recordNotification(channel.getName(), "success");
            } catch (Exception e) {
                metricsConfig.recordNotification(channel.getName(), "error");
                log.error("Failed to deliver alert via {} for metric={}: {}",
                        channel.getName(), alert.getMetric(), e.getMessage(), e);
            }
        }
    }
}
