package com.bank.monitor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Twilio settings for paging the on-call team when a status metric spikes.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "alerting.twilio")
public class TwilioAlertProperties {

    private boolean enabled = false;

    // "sms" or "whatsapp"
    private String channel = "sms";

    private String accountSid;
    private String authToken;
    private String fromNumber;

    // Every recipient receives every alert
    private List<String> recipients = new ArrayList<>();

    public boolean isWhatsApp() {
        return "whatsapp".equalsIgnoreCase(channel);
    }
}
