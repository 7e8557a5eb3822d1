package com.fintech.settlement.dto;

import com.fintech.settlement.entity.TransferPortion;
import com.fintech.settlement.entity.TransferStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Direct outcome of one SHA or MWU bank transfer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferResult {

    private UUID settlementId;
    private TransferPortion portion;
    private BigDecimal amount;
    private TransferStatus status;
    private String transactionId;
    private String error;
    private LocalDateTime completedAt;

    public boolean isSuccess() {
        return status == TransferStatus.COMPLETED;
    }

    public static TransferResult failed(UUID settlementId, TransferPortion portion, BigDecimal amount, String error) {
        return TransferResult.builder()
                .settlementId(settlementId)
                .portion(portion)
                .amount(amount)
                .status(TransferStatus.FAILED)
                .error(error)
                .build();
    }
}
