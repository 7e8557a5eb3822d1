package com.fintech.settlement.recovery;

import io.github.resilience4j.core.IntervalFunction;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Retry settings for one operation type.
 * <p>
 * The first wait is {@code initialDelay}; every following wait is the previous one times
 * {@code backoffMultiplier}, capped at {@code maxDelay}.
 */
@Value
public class RetryPolicy {

    public static final RetryPolicy DEFAULT = RetryPolicy.builder()
            .maxAttempts(3)
            .initialDelay(Duration.ofSeconds(1))
            .backoffMultiplier(2.0)
            .maxDelay(Duration.ofSeconds(10))
            .build();

    int maxAttempts;
    Duration initialDelay;
    double backoffMultiplier;
    Duration maxDelay;

    /**
     * Upper bound for the whole retry sequence, or null for none.
     */
    Duration timeout;

    @Builder
    public RetryPolicy(int maxAttempts, Duration initialDelay, double backoffMultiplier,
                       Duration maxDelay, Duration timeout) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelay == null || initialDelay.toMillis() < 1) {
            throw new IllegalArgumentException("initialDelay must be at least 1ms");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
        }
        if (maxDelay == null || maxDelay.toMillis() < 1) {
            throw new IllegalArgumentException("maxDelay must be at least 1ms");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.backoffMultiplier = backoffMultiplier;
        this.maxDelay = maxDelay;
        this.timeout = timeout;
    }

    /**
     * Wait before the retry that follows attempt {@code n} (1-based).
     */
    public IntervalFunction intervalFunction() {
        long maxDelayMillis = maxDelay.toMillis();
        return IntervalFunction.of(initialDelay.toMillis(),
                previous -> Math.min((long) (previous * backoffMultiplier), maxDelayMillis));
    }
}
