package com.fintech.settlement.dto;

import com.fintech.settlement.entity.SettlementStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one processing run of a settlement. Either phase is null when it was not
 * requested or could not run; its error is then listed in errors.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementProcessingResult {

    private UUID settlementId;
    private LocalDate settlementDate;
    private SettlementStatus finalStatus;
    private String processedBy;
    private PayoutBatchResult payouts;
    private SettlementTransferResult transfers;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public void addError(String error) {
        if (errors == null) {
            errors = new ArrayList<>();
        }
        errors.add(error);
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return java.time.Duration.between(startedAt, completedAt).toMillis();
    }
}
