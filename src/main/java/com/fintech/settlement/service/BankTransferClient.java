package com.fintech.settlement.service;

import com.fintech.settlement.dto.BankAccountDetails;
import com.fintech.settlement.exception.GatewayException;

import java.math.BigDecimal;

/**
 * Contract of the bank rail that moves the SHA and MWU shares. Transfers complete
 * synchronously.
 */
public interface BankTransferClient {

    /**
     * @param reference idempotency reference; resubmitting the same reference must not
     *                  move the money twice
     * @return the bank's transaction id
     * @throws GatewayException if the transfer was not executed
     */
    String submit(BigDecimal amount, BankAccountDetails account, String reference) throws GatewayException;

    String getGatewayName();

    boolean isAvailable();
}
