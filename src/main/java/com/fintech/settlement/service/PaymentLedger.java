package com.fintech.settlement.service;

import com.fintech.settlement.entity.Payment;

import java.time.LocalDate;
import java.util.List;

/**
 * Read access to members' contribution payments, owned by the payments module.
 */
public interface PaymentLedger {

    /**
     * Completed payments assigned to the given settlement date.
     */
    List<Payment> findCompletedPayments(LocalDate settlementDate);

    long countCompletedPayments(LocalDate settlementDate);
}
