package com.fintech.settlement.exception;

/**
 * Base exception for settlement, payout and transfer errors.
 * <p>
 * Subclasses declare whether the failure is transient. The retry orchestrator only
 * retries retryable failures; everything else propagates on the first attempt.
 */
public class SettlementException extends RuntimeException {

    public SettlementException(String message) {
        super(message);
    }

    public SettlementException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Indicates if the operation that raised this error may be attempted again.
     */
    public boolean isRetryable() {
        return false;
    }
}
