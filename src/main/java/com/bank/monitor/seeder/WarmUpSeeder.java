package com.bank.monitor.seeder;

import com.bank.monitor.engine.AnomalyMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Fills every rolling window with synthetic healthy traffic so detection is
 * fully armed right after startup. Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Healthy minute: failed=0, denied around 5, reversed around 1.
 */
@Component
@Profile("seed")
public class WarmUpSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(WarmUpSeeder.class);

    private final AnomalyMonitor monitor;
    private final Random random = new Random(42); // fixed seed for reproducibility

    public WarmUpSeeder(AnomalyMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public void run(String... args) {
        int minutes = monitor.getConfig().getWindowSize();
        log.info("=== Warming up baselines with {} healthy minutes ===", minutes);

        for (int minute = 0; minute < minutes; minute++) {
            monitor.warmUp(healthyMinute());
        }

        monitor.baselines().forEach(b ->
                log.info("Baseline {}: samples={}, mean={}, std={}",
                        b.getMetric(), b.getHistorySize(),
                        String.format("%.2f", b.getMean()), String.format("%.2f", b.getStdDev())));
        log.info("=== Warm-up complete ===");
    }

    Map<String, Object> healthyMinute() {
        Map<String, Object> batch = new LinkedHashMap<>();
        for (String metric : monitor.getPolicies().keySet()) {
            batch.put(metric, healthyCount(metric));
        }
        return batch;
    }

    private long healthyCount(String metric) {
        switch (metric) {
            case "failed":
                return 0;
            case "denied":
                return 4 + random.nextInt(3);   // 4..6
            case "reversed":
                return random.nextInt(3);       // 0..2
            default:
                return random.nextInt(2);
        }
    }
}
