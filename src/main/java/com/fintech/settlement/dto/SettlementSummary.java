package com.fintech.settlement.dto;

import com.fintech.settlement.entity.Settlement;
import com.fintech.settlement.entity.SettlementStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Read model of a settlement row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementSummary {

    private UUID id;
    private LocalDate settlementDate;
    private BigDecimal totalCollected;
    private BigDecimal shaAmount;
    private BigDecimal mwuAmount;
    private BigDecimal totalDelegateCommissions;
    private BigDecimal totalCoordinatorCommissions;
    private int totalPayments;
    private int uniqueMembers;
    private SettlementStatus status;
    private LocalDateTime processedAt;
    private String processedBy;
    private String notes;

    public static SettlementSummary from(Settlement settlement) {
        return SettlementSummary.builder()
                .id(settlement.getId())
                .settlementDate(settlement.getSettlementDate())
                .totalCollected(settlement.getTotalCollected())
                .shaAmount(settlement.getShaAmount())
                .mwuAmount(settlement.getMwuAmount())
                .totalDelegateCommissions(settlement.getTotalDelegateCommissions())
                .totalCoordinatorCommissions(settlement.getTotalCoordinatorCommissions())
                .totalPayments(settlement.getTotalPayments())
                .uniqueMembers(settlement.getUniqueMembers())
                .status(settlement.getStatus())
                .processedAt(settlement.getProcessedAt())
                .processedBy(settlement.getProcessedBy())
                .notes(settlement.getNotes())
                .build();
    }
}
