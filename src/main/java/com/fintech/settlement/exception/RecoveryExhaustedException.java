package com.fintech.settlement.exception;

import com.fintech.settlement.recovery.OperationType;

/**
 * Raised when an operation failed on every attempt and no recovery action recovered it.
 * The original failure is the cause.
 */
public class RecoveryExhaustedException extends SystemException {

    private final OperationType operationType;
    private final int attempts;

    public RecoveryExhaustedException(OperationType operationType, int attempts, Throwable cause) {
        super(String.format("%s failed after %d attempts: %s",
                operationType.getKey(), attempts, cause == null ? "unknown error" : cause.getMessage()), cause);
        this.operationType = operationType;
        this.attempts = attempts;
    }

    public OperationType getOperationType() {
        return operationType;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
