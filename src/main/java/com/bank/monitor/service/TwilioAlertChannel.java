package com.bank.monitor.service;

import com.bank.monitor.config.TwilioAlertProperties;
import com.bank.monitor.engine.AlertDeliveryException;
import com.bank.monitor.model.AnomalyAlert;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class TwilioAlertChannel implements AlertChannel {

    private static final Logger log = LoggerFactory.getLogger(TwilioAlertChannel.class);

    private final TwilioAlertProperties config;

    public TwilioAlertChannel(TwilioAlertProperties config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio alert channel initialized. Channel: {}, recipients: {}",
                    config.getChannel(), config.getRecipients().size());
        } else {
            log.info("Twilio alert channel is DISABLED.");
        }
    }

    @Override
    public String getName() {
        return config.getChannel();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && !config.getRecipients().isEmpty();
    }

    @Override
    public void deliver(AnomalyAlert alert) {
        String body = buildMessageBody(alert);
        PhoneNumber from = new PhoneNumber(resolveNumber(config.getFromNumber()));
        int failed = 0;
        Exception lastFailure = null;

        for (String recipient : config.getRecipients()) {
            try {
                Message message = Message.creator(new PhoneNumber(resolveNumber(recipient)), from, body).create();
                log.info("Twilio alert sent for metric={} to={}, sid={}", alert.getMetric(), recipient, message.getSid());
            } catch (Exception e) {
                failed++;
                lastFailure = e;
                log.warn("Twilio alert to {} failed for metric={}: {}", recipient, alert.getMetric(), e.getMessage());
            }
        }

        if (lastFailure != null) {
            throw new AlertDeliveryException(String.format("Twilio delivery failed for metric %s (%d of %d recipients)",
                    alert.getMetric(), failed, config.getRecipients().size()), lastFailure);
        }
    }

    String buildMessageBody(AnomalyAlert alert) {
        return String.format(
                "[ANOMALY ALERT] Transaction status spike\n" +
                "Metric: %s\n" +
                "Current: %d\n" +
                "Baseline: %.2f\n" +
                "Policy: %s\n" +
                "Detected: %s",
                alert.getMetric(),
                alert.getObservedValue(),
                alert.getBaselineMean(),
                alert.getPolicy(),
                Instant.ofEpochMilli(alert.getDetectedAt())
        );
    }

    String resolveNumber(String number) {
        if (config.isWhatsApp()) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
