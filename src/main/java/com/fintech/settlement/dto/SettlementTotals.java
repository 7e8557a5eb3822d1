package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of aggregating one day's completed payments.
 * <p>
 * mwuAmount is the residual of totalCollected after the SHA share and both commission
 * totals, so the four parts always add up to totalCollected exactly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementTotals {

    private LocalDate settlementDate;
    private BigDecimal totalCollected;
    private BigDecimal shaAmount;
    private BigDecimal mwuAmount;
    private BigDecimal totalDelegateCommissions;
    private BigDecimal totalCoordinatorCommissions;
    private int totalPayments;
    private int uniqueMembers;

    /**
     * Delegate commission on payments for which no delegate could be resolved.
     * Included in totalDelegateCommissions; no payout carries it.
     */
    @Builder.Default
    private BigDecimal unattributedDelegateCommission = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal unattributedCoordinatorCommission = BigDecimal.ZERO;

    @Builder.Default
    private List<RecipientCommission> delegateBreakdown = new ArrayList<>();

    @Builder.Default
    private List<RecipientCommission> coordinatorBreakdown = new ArrayList<>();
}
