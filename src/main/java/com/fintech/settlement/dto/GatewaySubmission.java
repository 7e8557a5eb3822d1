package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Synchronous acknowledgement of a payout request. The final result arrives later
 * through a callback carrying the same conversationId.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewaySubmission {

    private String conversationId;
    private String originatorConversationId;
    private String responseCode;
    private String responseDescription;
}
