package com.fintech.settlement.recovery;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A step run after an operation has exhausted its retry attempts.
 */
@Value
@Builder
public class RecoveryAction {

    @NonNull
    String id;

    @NonNull
    RecoveryActionType type;

    String description;

    @NonNull
    @Builder.Default
    RecoveryPriority priority = RecoveryPriority.MEDIUM;

    @NonNull
    RecoveryHandler handler;
}
