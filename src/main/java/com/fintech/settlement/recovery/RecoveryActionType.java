package com.fintech.settlement.recovery;

public enum RecoveryActionType {
    /**
     * On success, the operation gets one final invocation.
     */
    RETRY,

    /**
     * Marks the caller-supplied transaction rollback-only.
     */
    ROLLBACK,

    /**
     * Flags the failure for an operator; never recovers by itself.
     */
    MANUAL_INTERVENTION,

    SKIP
}
