package com.bank.monitor.service;

import com.bank.monitor.model.AnomalyAlert;

/**
 * One delivery mechanism for anomaly alerts (log line, SMS, webhook...).
 */
public interface AlertChannel {

    /**
     * Short channel name used in logs and metric tags.
     */
    String getName();

    boolean isEnabled();

    /**
     * @throws com.bank.monitor.engine.AlertDeliveryException if the alert could not be delivered
     */
    void deliver(AnomalyAlert alert);
}
