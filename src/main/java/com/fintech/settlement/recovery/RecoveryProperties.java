package com.fintech.settlement.recovery;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Retry policies per operation type, mapped from properties with prefix "settlement.recovery".
 * Operation types without an entry fall back to {@link RetryPolicy#DEFAULT}.
 */
@Data
@ConfigurationProperties(prefix = "settlement.recovery")
public class RecoveryProperties {

    /**
     * Threads running attempts and backoff timers.
     */
    private int schedulerPoolSize = 8;

    private Map<OperationType, Policy> policies = new LinkedHashMap<>();

    @Data
    public static class Policy {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(10);
        private Duration timeout;

        public RetryPolicy toRetryPolicy() {
            return RetryPolicy.builder()
                    .maxAttempts(maxAttempts)
                    .initialDelay(initialDelay)
                    .backoffMultiplier(backoffMultiplier)
                    .maxDelay(maxDelay)
                    .timeout(timeout)
                    .build();
        }
    }
}
