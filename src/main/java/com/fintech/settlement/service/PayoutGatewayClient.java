package com.fintech.settlement.service;

import com.fintech.settlement.dto.GatewaySubmission;
import com.fintech.settlement.exception.GatewayException;

import java.math.BigDecimal;

/**
 * Contract of the mobile-money gateway used to pay commissions.
 * <p>
 * Submission is asynchronous: the gateway acknowledges the request with a conversation id
 * and reports the final result later through a callback carrying the same id.
 */
public interface PayoutGatewayClient {

    /**
     * Requests a payout.
     *
     * @param amount    amount to pay, always positive
     * @param contact   recipient's phone number
     * @param reference caller's idempotency reference (the payout id)
     * @return acknowledgement carrying the conversation id
     * @throws GatewayException if the request was not accepted
     */
    GatewaySubmission submit(BigDecimal amount, String contact, String reference) throws GatewayException;

    String getGatewayName();

    boolean isAvailable();
}
