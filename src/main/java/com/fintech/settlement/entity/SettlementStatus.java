package com.fintech.settlement.entity;

/**
 * Lifecycle status of a daily settlement.
 */
public enum SettlementStatus {
    /**
     * Generated, totals frozen, nothing disbursed yet.
     */
    PENDING,

    /**
     * Processing started. Stays here while any payout or bank transfer is unresolved,
     * so an operator can retry failed payouts.
     */
    PROCESSING,

    /**
     * All submitted payouts and bank transfers succeeded.
     */
    COMPLETED,

    /**
     * Set only by an explicit operator decision, never by the processing flow.
     */
    FAILED
}
