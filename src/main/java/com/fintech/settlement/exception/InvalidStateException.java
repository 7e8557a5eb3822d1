package com.fintech.settlement.exception;

/**
 * Thrown when an operation is requested on a settlement or payout whose current
 * status does not allow it.
 */
public class InvalidStateException extends SettlementException {

    public InvalidStateException(String message) {
        super(message);
    }
}
