package com.bank.monitor.service;

import com.bank.monitor.model.AnomalyAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LogAlertChannel implements AlertChannel {

    private static final Logger log = LoggerFactory.getLogger(LogAlertChannel.class);

    @Override
    public String getName() {
        return "log";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void deliver(AnomalyAlert alert) {
        log.warn("{} policy={}", alert.getMessage(), alert.getPolicy());
    }
}
