package com.fintech.settlement.entity;

/**
 * Status of a single commission payout.
 */
public enum PayoutStatus {
    /**
     * Created with the settlement, not yet submitted to the gateway.
     */
    PENDING,

    /**
     * Accepted by the gateway; waiting for the asynchronous result callback.
     */
    PROCESSING,

    /**
     * Gateway confirmed the disbursement.
     */
    PROCESSED,

    /**
     * Submission was rejected or the gateway reported a failure.
     */
    FAILED
}
