package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manual resolution of a payout by its id: processed when transactionReference is
 * given, failed with failureReason otherwise.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutStatusUpdateRequest {

    private String transactionReference;
    private String paymentMethod;
    private String failureReason;
}
