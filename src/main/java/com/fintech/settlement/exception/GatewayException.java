package com.fintech.settlement.exception;

/**
 * Thrown when the payout gateway or the bank transfer rail fails.
 * This could be due to network issues, timeouts, or provider downtime.
 */
public class GatewayException extends SettlementException {

    private final String gatewayName;
    private final String reference;
    private final boolean retryable;

    public GatewayException(String message, String gatewayName) {
        this(message, gatewayName, null, true);
    }

    public GatewayException(String message, String gatewayName, String reference) {
        this(message, gatewayName, reference, true);
    }

    public GatewayException(String message, String gatewayName, String reference, boolean retryable) {
        super(message);
        this.gatewayName = gatewayName;
        this.reference = reference;
        this.retryable = retryable;
    }

    public GatewayException(String message, String gatewayName, String reference, Throwable cause) {
        super(message, cause);
        this.gatewayName = gatewayName;
        this.reference = reference;
        this.retryable = true;
    }

    public String getGatewayName() {
        return gatewayName;
    }

    public String getReference() {
        return reference;
    }

    /**
     * Rejections such as an unregistered recipient number are permanent; timeouts and
     * outages are not.
     */
    @Override
    public boolean isRetryable() {
        return retryable;
    }
}
