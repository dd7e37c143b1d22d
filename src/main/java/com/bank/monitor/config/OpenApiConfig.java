package com.bank.monitor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI transactionMonitorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Transaction Monitor API")
                        .version("1.0.0")
                        .description(
                                "Streaming anomaly detection over per-minute transaction status counts.\n\n" +
                                "**Ingestion Pipeline:**\n" +
                                "1. Receive one minute's counts via `POST /api/v1/monitor/batches`\n" +
                                "2. Judge each tracked metric against its rolling window (history before this minute)\n" +
                                "3. Raise alerts and hand them to the notification channels asynchronously\n" +
                                "4. Append the counts to the rolling windows\n\n" +
                                "**Detection Policies:**\n" +
                                "- `STATIC_CEILING`: zero-tolerance metrics (default `failed`) alert when count > 5\n" +
                                "- `ADAPTIVE_ZSCORE`: other metrics alert when Z-score > sigma (default 3); " +
                                "silent for the first 10 minutes; flat windows alert when count > mean + 5\n\n" +
                                "**Restart:** baselines are in-memory; rebuild them with " +
                                "`POST /api/v1/monitor/batches/replay` (no alerts are sent during replay).")
                        .contact(new Contact().name("Transaction Monitoring Team")));
    }
}
