package com.fintech.settlement.recovery;

import io.github.resilience4j.core.IntervalFunction;
import lombok.Getter;

/**
 * Mutable state of one retry sequence.
 */
@Getter
class RetryContext {

    private final OperationType operationType;
    private final RetryPolicy policy;
    private final IntervalFunction intervalFunction;
    private int attempt;
    private long currentDelayMillis;

    RetryContext(OperationType operationType, RetryPolicy policy) {
        this.operationType = operationType;
        this.policy = policy;
        this.intervalFunction = policy.intervalFunction();
        this.currentDelayMillis = policy.getInitialDelay().toMillis();
    }

    void startAttempt() {
        attempt++;
    }

    boolean hasAttemptsLeft() {
        return attempt < policy.getMaxAttempts();
    }

    /**
     * Delay to wait before the next attempt; advances the backoff.
     */
    long nextDelayMillis() {
        currentDelayMillis = intervalFunction.apply(attempt);
        return currentDelayMillis;
    }
}
