package com.fintech.settlement.service;

import com.fintech.settlement.dto.GatewaySubmission;
import com.fintech.settlement.exception.GatewayException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the simulated payout gateway.
 */
class MockPayoutGatewayClientTest {

    private MockPayoutGatewayClient gateway;

    @BeforeEach
    void setUp() {
        gateway = new MockPayoutGatewayClient();
    }

    @Test
    @DisplayName("Should answer a repeated reference with the original acceptance")
    void shouldReturnOriginalAcceptanceForRepeatedReference() {
        GatewaySubmission first = gateway.submit(new BigDecimal("40.00"), "+254700000030", "payout-1");
        GatewaySubmission second = gateway.submit(new BigDecimal("40.00"), "+254700000030", "payout-1");

        assertThat(second.getConversationId()).isEqualTo(first.getConversationId());
        assertThat(gateway.getSubmissionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should accept a new resubmission round as a separate request")
    void shouldAcceptNewRoundSeparately() {
        GatewaySubmission first = gateway.submit(new BigDecimal("40.00"), "+254700000031", "payout-2");
        GatewaySubmission second = gateway.submit(new BigDecimal("40.00"), "+254700000031", "payout-2-R1");

        assertThat(second.getConversationId()).isNotEqualTo(first.getConversationId());
        assertThat(gateway.getSubmissionCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should accept a reference once its transient failures are used up")
    void shouldAcceptAfterTransientFailures() {
        gateway.failNextSubmissions("+254700000032", 1);

        assertThatThrownBy(() -> gateway.submit(new BigDecimal("10.00"), "+254700000032", "payout-3"))
                .isInstanceOf(GatewayException.class)
                .matches(error -> ((GatewayException) error).isRetryable());

        GatewaySubmission accepted = gateway.submit(new BigDecimal("10.00"), "+254700000032", "payout-3");

        assertThat(gateway.findSubmission("payout-3")).contains(accepted);
    }

    @Test
    @DisplayName("Should reject a blocked contact with a permanent error")
    void shouldRejectBlockedContact() {
        gateway.rejectContact("+254700000033");

        assertThatThrownBy(() -> gateway.submit(new BigDecimal("10.00"), "+254700000033", "payout-4"))
                .isInstanceOf(GatewayException.class)
                .matches(error -> !((GatewayException) error).isRetryable());
        assertThat(gateway.getSubmissionCount()).isZero();
    }

    @Test
    @DisplayName("Circuit breaker fallback should keep the reference and the cause of the failure")
    void fallbackShouldKeepReferenceAndCause() {
        IllegalStateException cause = new IllegalStateException("connection refused");

        assertThatThrownBy(() -> gateway.submitFallback(new BigDecimal("10.00"), "+254700000034", "payout-5", cause))
                .isInstanceOf(GatewayException.class)
                .hasCause(cause)
                .satisfies(error -> {
                    GatewayException gatewayError = (GatewayException) error;
                    assertThat(gatewayError.getReference()).isEqualTo("payout-5");
                    assertThat(gatewayError.getGatewayName()).isEqualTo("MockPayoutGateway");
                    assertThat(gatewayError.isRetryable()).isTrue();
                });
    }
}
