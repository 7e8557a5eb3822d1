package com.fintech.settlement.dto;

import com.fintech.settlement.entity.SettlementStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Aggregate figures over the pending and completed settlements of the last N days.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverallStats {

    private int days;
    private int settlementCount;
    private BigDecimal totalCollected;
    private BigDecimal totalShaAmount;
    private BigDecimal totalMwuAmount;
    private BigDecimal totalCommissions;
    private long totalPayments;
    private BigDecimal averagePerDay;

    /**
     * All-time settlement counts per status.
     */
    private Map<SettlementStatus, Long> settlementsByStatus;
}
