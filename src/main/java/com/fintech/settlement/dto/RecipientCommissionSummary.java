package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipientCommissionSummary {

    private UUID recipientId;
    private LocalDate from;
    private LocalDate to;
    private long totalPayouts;

    @Builder.Default
    private BigDecimal totalAmount = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal pendingAmount = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal processedAmount = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal failedAmount = BigDecimal.ZERO;
}
