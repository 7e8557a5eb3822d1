package com.fintech.settlement.exception;

/**
 * Thrown for malformed input such as a missing date or a non-positive amount.
 */
public class ValidationException extends SettlementException {

    public ValidationException(String message) {
        super(message);
    }
}
