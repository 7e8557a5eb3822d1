package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Payout counts and amounts of a settlement grouped by status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutStatistics {

    private UUID settlementId;
    private int totalPayouts;
    private int pendingPayouts;
    private int processingPayouts;
    private int processedPayouts;
    private int failedPayouts;

    @Builder.Default
    private BigDecimal totalAmount = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal pendingAmount = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal processingAmount = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal processedAmount = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal failedAmount = BigDecimal.ZERO;
}
