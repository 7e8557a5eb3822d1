package com.fintech.settlement.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Asynchronous payout result posted by the gateway. A result code of "0" means the
 * money reached the recipient.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutCallbackRequest {

    public static final String SUCCESS_CODE = "0";

    @NotBlank
    private String conversationId;

    @NotBlank
    private String resultCode;

    private String resultDescription;

    private String transactionReference;

    public boolean isSuccess() {
        return SUCCESS_CODE.equals(resultCode);
    }
}
