package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Summary of a batch submission of a settlement's payouts.
 * A successful submission only means the gateway accepted the request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutBatchResult {

    private UUID settlementId;

    @Builder.Default
    private int totalPayouts = 0;

    @Builder.Default
    private int successfulPayouts = 0;

    @Builder.Default
    private int failedPayouts = 0;

    @Builder.Default
    private List<PayoutResult> results = new ArrayList<>();

    public static PayoutBatchResult empty(UUID settlementId) {
        return PayoutBatchResult.builder().settlementId(settlementId).build();
    }

    public void addResult(PayoutResult result) {
        if (results == null) {
            results = new ArrayList<>();
        }
        results.add(result);
        totalPayouts++;
        if (result.isSuccess()) {
            successfulPayouts++;
        } else {
            failedPayouts++;
        }
    }
}
