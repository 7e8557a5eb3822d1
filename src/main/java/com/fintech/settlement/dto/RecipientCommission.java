package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Commission owed to one delegate or coordinator within a settlement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipientCommission {

    private UUID recipientId;
    private String name;
    private String phoneNumber;
    private String email;
    private BigDecimal totalCommission;
    private int paymentCount;
}
