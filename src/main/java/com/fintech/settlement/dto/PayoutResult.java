package com.fintech.settlement.dto;

import com.fintech.settlement.entity.RecipientType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of submitting one payout to the gateway.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutResult {

    private UUID payoutId;
    private UUID recipientId;
    private RecipientType recipientType;
    private BigDecimal amount;
    private boolean success;
    private String conversationId;
    private String error;
}
