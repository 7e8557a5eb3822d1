package com.fintech.settlement.exception;

import java.time.LocalDate;

/**
 * Thrown when a settlement already exists for the requested date.
 */
public class SettlementConflictException extends SettlementException {

    private final LocalDate settlementDate;

    public SettlementConflictException(LocalDate settlementDate) {
        super(String.format("Settlement for %s already exists", settlementDate));
        this.settlementDate = settlementDate;
    }

    public SettlementConflictException(LocalDate settlementDate, Throwable cause) {
        super(String.format("Settlement for %s already exists", settlementDate), cause);
        this.settlementDate = settlementDate;
    }

    public LocalDate getSettlementDate() {
        return settlementDate;
    }
}
