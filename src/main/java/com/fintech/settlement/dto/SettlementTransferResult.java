package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementTransferResult {

    private UUID settlementId;
    private TransferResult shaTransfer;
    private TransferResult mwuTransfer;

    public boolean isAllSucceeded() {
        return shaTransfer != null && shaTransfer.isSuccess()
                && mwuTransfer != null && mwuTransfer.isSuccess();
    }
}
