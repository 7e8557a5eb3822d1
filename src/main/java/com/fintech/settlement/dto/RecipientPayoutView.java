package com.fintech.settlement.dto;

import com.fintech.settlement.entity.PayoutStatus;
import com.fintech.settlement.entity.RecipientType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A recipient's payout joined with the date of its settlement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipientPayoutView {

    private UUID id;
    private UUID settlementId;
    private LocalDate settlementDate;
    private RecipientType recipientType;
    private BigDecimal amount;
    private int paymentCount;
    private PayoutStatus status;
    private LocalDateTime processedAt;
    private String transactionReference;
    private String paymentMethod;
}
