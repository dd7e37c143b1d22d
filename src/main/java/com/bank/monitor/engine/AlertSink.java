package com.bank.monitor.engine;

import com.bank.monitor.model.AnomalyAlert;

/**
 * Receives alerts raised by an {@link AnomalyMonitor}.
 * Implementations decide the delivery mechanism (log line, SMS, webhook, queue).
 */
public interface AlertSink {

    /**
     * Deliver a single alert.
     *
     * @param alert the alert to deliver
     * @throws AlertDeliveryException if delivery failed
     */
    void notify(AnomalyAlert alert);
}
