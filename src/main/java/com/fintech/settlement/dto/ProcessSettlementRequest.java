package com.fintech.settlement.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessSettlementRequest {

    @NotBlank
    private String operator;

    @Builder.Default
    private boolean initiatePayouts = true;

    @Builder.Default
    private boolean initiateBankTransfers = true;

    /**
     * Required when bank transfers are initiated.
     */
    private String confirmationSecret;

    @Valid
    private BankAccountDetails shaBankDetails;

    @Valid
    private BankAccountDetails mwuBankDetails;
}
