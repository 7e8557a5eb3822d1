package com.fintech.settlement.exception;

/**
 * Thrown when local infrastructure (database, file system, configuration) is unavailable.
 */
public class SystemException extends SettlementException {

    public SystemException(String message) {
        super(message);
    }

    public SystemException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
