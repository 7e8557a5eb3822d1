package com.fintech.settlement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A member's contribution payment as recorded by the payments module.
 * <p>
 * The settlement engine only reads these rows. The commission override ids capture who
 * was credited when the payment was taken; when absent, the payer's current delegate or
 * coordinator is used.
 */
@Entity
@Table(name = "payments", indexes = {
        @Index(name = "idx_payment_status_settlement_date", columnList = "status, settlement_date"),
        @Index(name = "idx_payment_user", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "settlement_date")
    private LocalDate settlementDate;

    @Column(name = "sha_portion", precision = 14, scale = 2)
    private BigDecimal shaPortion;

    @Column(name = "delegate_commission", precision = 14, scale = 2)
    private BigDecimal delegateCommission;

    @Column(name = "coordinator_commission", precision = 14, scale = 2)
    private BigDecimal coordinatorCommission;

    @Column(name = "commission_delegate_id")
    private UUID commissionDelegateId;

    @Column(name = "commission_coordinator_id")
    private UUID commissionCoordinatorId;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;
}
