package com.bank.monitor.config;

import com.bank.monitor.engine.AlertSink;
import com.bank.monitor.engine.AnomalyMonitor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One explicit monitor instance per deployment, built from {@code monitor.*} properties.
 * Invalid settings fail the application context at startup.
 */
@Configuration
public class MonitorConfiguration {

    @Bean
    public AnomalyMonitor anomalyMonitor(MonitorProperties properties,
                                         AlertSink alertSink,
                                         MetricsConfig metricsConfig) {
        AnomalyMonitor monitor = new AnomalyMonitor(properties.toMonitorConfig(), alertSink);
        metricsConfig.registerBaselineGauges(monitor);
        return monitor;
    }
}
