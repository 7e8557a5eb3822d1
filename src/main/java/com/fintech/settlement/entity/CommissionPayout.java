package com.fintech.settlement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Commission owed to one delegate or coordinator for the payments credited to them
 * in a settlement.
 * <p>
 * The conversation_id is the correlation token the payout gateway issues on submission;
 * the asynchronous result callback is matched back to the payout through it.
 */
@Entity
@Table(name = "commission_payouts",
        uniqueConstraints = @UniqueConstraint(name = "uk_payout_recipient",
                columnNames = {"settlement_id", "recipient_id", "recipient_type"}),
        indexes = {
                @Index(name = "idx_payout_conversation_id", columnList = "conversation_id"),
                @Index(name = "idx_payout_settlement_status", columnList = "settlement_id, status"),
                @Index(name = "idx_payout_recipient", columnList = "recipient_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommissionPayout {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "settlement_id", nullable = false, updatable = false)
    private UUID settlementId;

    @Column(name = "recipient_id", nullable = false, updatable = false)
    private UUID recipientId;

    @Enumerated(EnumType.STRING)
    @Column(name = "recipient_type", nullable = false, updatable = false, length = 20)
    private RecipientType recipientType;

    @Column(nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(name = "payment_count", nullable = false, updatable = false)
    private int paymentCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private PayoutStatus status = PayoutStatus.PENDING;

    @Column(name = "payment_method", length = 30)
    private String paymentMethod;

    @Column(name = "transaction_reference", length = 100)
    private String transactionReference;

    @Column(name = "conversation_id", length = 100)
    private String conversationId;

    @Column(name = "originator_conversation_id", length = 100)
    private String originatorConversationId;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "submission_attempts")
    @Builder.Default
    private Integer submissionAttempts = 0;

    @Column(name = "submission_round")
    @Builder.Default
    private Integer submissionRound = 0;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public void incrementSubmissionAttempts() {
        this.submissionAttempts = (this.submissionAttempts == null ? 0 : this.submissionAttempts) + 1;
    }

    /**
     * Idempotency reference sent to the gateway. Stable across retries of one submission;
     * each resubmission round after a failure gets a new one.
     */
    public String gatewayReference() {
        int round = submissionRound == null ? 0 : submissionRound;
        return round == 0 ? id.toString() : id + "-R" + round;
    }

    /**
     * Clears the gateway correlation so the payout can be submitted again.
     */
    public void resetForResubmission() {
        this.submissionRound = (this.submissionRound == null ? 0 : this.submissionRound) + 1;
        this.status = PayoutStatus.PENDING;
        this.failureReason = null;
        this.conversationId = null;
        this.originatorConversationId = null;
    }
}
