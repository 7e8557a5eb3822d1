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
 * One calendar day's aggregated summary of completed payments.
 * <p>
 * The monetary totals are a snapshot taken when the settlement is generated and are never
 * updated afterwards. They always reconcile exactly:
 * totalCollected = shaAmount + mwuAmount + totalDelegateCommissions + totalCoordinatorCommissions.
 */
@Entity
@Table(name = "daily_settlements", indexes = {
        @Index(name = "idx_settlement_date", columnList = "settlement_date", unique = true),
        @Index(name = "idx_settlement_status", columnList = "status"),
        @Index(name = "idx_settlement_processed_at", columnList = "processed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Settlement {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "settlement_date", nullable = false, unique = true, updatable = false)
    private LocalDate settlementDate;

    @Column(name = "total_collected", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal totalCollected;

    @Column(name = "sha_amount", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal shaAmount;

    @Column(name = "mwu_amount", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal mwuAmount;

    @Column(name = "total_delegate_commissions", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal totalDelegateCommissions;

    @Column(name = "total_coordinator_commissions", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal totalCoordinatorCommissions;

    @Column(name = "total_payments", nullable = false, updatable = false)
    private int totalPayments;

    @Column(name = "unique_members", nullable = false, updatable = false)
    private int uniqueMembers;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SettlementStatus status = SettlementStatus.PENDING;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    @Column(name = "processed_by", length = 100)
    private String processedBy;

    @Column(length = 1000)
    private String notes;

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

    public BigDecimal getTotalCommissions() {
        return totalDelegateCommissions.add(totalCoordinatorCommissions);
    }

    public boolean hasZeroPayments() {
        return totalPayments == 0;
    }
}
