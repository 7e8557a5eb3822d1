package com.fintech.settlement.exception;

/**
 * Thrown when a bank transfer is requested with a confirmation secret that does not
 * match the configured one.
 */
public class TransferAuthorizationException extends SettlementException {

    public TransferAuthorizationException(String message) {
        super(message);
    }
}
