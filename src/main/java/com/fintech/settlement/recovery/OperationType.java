package com.fintech.settlement.recovery;

/**
 * Kinds of externally-facing work the orchestrator wraps. Each kind has its own
 * retry policy and recovery actions.
 */
public enum OperationType {
    SETTLEMENT_GENERATION("settlement_generation"),
    SETTLEMENT_PROCESSING("settlement_processing"),
    GATEWAY_PAYOUT("gateway_payout"),
    BANK_TRANSFER("bank_transfer"),
    DATABASE_TRANSACTION("database_transaction"),
    REPORT_GENERATION("report_generation"),
    REPORT_CLEANUP("report_cleanup");

    private final String key;

    OperationType(String key) {
        this.key = key;
    }

    /**
     * Stable name used in logs and metric tags.
     */
    public String getKey() {
        return key;
    }
}
