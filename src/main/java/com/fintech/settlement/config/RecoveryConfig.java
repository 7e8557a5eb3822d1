package com.fintech.settlement.config;

import com.fintech.settlement.recovery.HealthCheck;
import com.fintech.settlement.recovery.OperationType;
import com.fintech.settlement.recovery.RecoveryProperties;
import com.fintech.settlement.recovery.RetryOrchestrator;
import com.fintech.settlement.recovery.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the retry orchestrator.
 * <p>
 * Built-in policies per operation type are registered first; entries under
 * {@code settlement.recovery.policies} replace them.
 */
@Configuration
@EnableConfigurationProperties({RecoveryProperties.class, SettlementProperties.class})
@Slf4j
public class RecoveryConfig {

    static Map<OperationType, RetryPolicy> defaultPolicies() {
        Map<OperationType, RetryPolicy> defaults = new EnumMap<>(OperationType.class);
        defaults.put(OperationType.SETTLEMENT_GENERATION, policy(3, 5, 2.0, 30));
        defaults.put(OperationType.GATEWAY_PAYOUT, policy(5, 10, 1.5, 60));
        defaults.put(OperationType.DATABASE_TRANSACTION, policy(3, 1, 2.0, 10));
        defaults.put(OperationType.REPORT_GENERATION, policy(2, 5, 1.5, 15));
        defaults.put(OperationType.BANK_TRANSFER, policy(3, 5, 2.0, 30));
        defaults.put(OperationType.SETTLEMENT_PROCESSING, policy(1, 1, 1.0, 1));
        return defaults;
    }

    private static RetryPolicy policy(int attempts, long initialSeconds, double multiplier, long maxSeconds) {
        return RetryPolicy.builder()
                .maxAttempts(attempts)
                .initialDelay(Duration.ofSeconds(initialSeconds))
                .backoffMultiplier(multiplier)
                .maxDelay(Duration.ofSeconds(maxSeconds))
                .build();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService recoveryScheduler(RecoveryProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "recovery-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(properties.getSchedulerPoolSize(), threadFactory);
        // timeouts of calls that finished early are cancelled and must not linger in the queue
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Bean
    public RetryOrchestrator retryOrchestrator(RecoveryProperties properties,
                                               ScheduledExecutorService recoveryScheduler,
                                               MeterRegistry meterRegistry,
                                               List<HealthCheck> healthChecks) {
        RetryOrchestrator orchestrator = new RetryOrchestrator(recoveryScheduler, meterRegistry, healthChecks);

        defaultPolicies().forEach(orchestrator::registerPolicy);
        properties.getPolicies().forEach((operationType, policy) ->
                orchestrator.registerPolicy(operationType, policy.toRetryPolicy()));

        log.info("Retry orchestrator configured with {} worker threads and {} health checks",
                properties.getSchedulerPoolSize(), healthChecks.size());
        return orchestrator;
    }
}
