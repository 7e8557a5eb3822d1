package com.fintech.settlement.config;

import com.fintech.settlement.exception.SettlementException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker settings shared by the payout gateway and the bank transfer rail.
 * <p>
 * The breaker stops a failing rail from being hammered while the retry orchestrator
 * keeps backing off. Only transient failures count towards the failure rate; a rejected
 * recipient or account is a fault of the request, not of the rail.
 * <p>
 * States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Rail is failing, requests fail fast
 * - HALF_OPEN: Testing if the rail has recovered
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // Number of calls to record before calculating failure rate
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                // Failure rate threshold to open the circuit (50%)
                .failureRateThreshold(50)
                // Time to wait before transitioning from OPEN to HALF_OPEN
                .waitDurationInOpenState(Duration.ofSeconds(30))
                // Number of calls permitted in HALF_OPEN state
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordException(ResilienceConfig::isRailFailure)
                .build();

        return CircuitBreakerRegistry.of(config);
    }

    static boolean isRailFailure(Throwable throwable) {
        if (throwable instanceof SettlementException) {
            return ((SettlementException) throwable).isRetryable();
        }
        return true;
    }
}
