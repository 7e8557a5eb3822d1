package com.fintech.settlement.repository;

import com.fintech.settlement.dto.RecipientPayoutView;
import com.fintech.settlement.entity.CommissionPayout;
import com.fintech.settlement.entity.PayoutStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CommissionPayoutRepository extends JpaRepository<CommissionPayout, UUID> {

    List<CommissionPayout> findBySettlementIdOrderByRecipientTypeAscRecipientIdAsc(UUID settlementId);

    List<CommissionPayout> findBySettlementIdAndStatus(UUID settlementId, PayoutStatus status);

    /**
     * Correlates an asynchronous gateway callback with its payout.
     */
    Optional<CommissionPayout> findByConversationId(String conversationId);

    long countBySettlementIdAndStatus(UUID settlementId, PayoutStatus status);

    @Query("SELECT new com.fintech.settlement.dto.RecipientPayoutView(p.id, p.settlementId, s.settlementDate, " +
            "p.recipientType, p.amount, p.paymentCount, p.status, p.processedAt, p.transactionReference, " +
            "p.paymentMethod) " +
            "FROM CommissionPayout p, Settlement s WHERE s.id = p.settlementId " +
            "AND p.recipientId = :recipientId ORDER BY s.settlementDate DESC")
    List<RecipientPayoutView> findRecipientPayouts(@Param("recipientId") UUID recipientId, Pageable pageable);

    @Query("SELECT p FROM CommissionPayout p, Settlement s WHERE s.id = p.settlementId " +
            "AND p.recipientId = :recipientId AND s.settlementDate BETWEEN :from AND :to")
    List<CommissionPayout> findRecipientPayoutsBetween(
            @Param("recipientId") UUID recipientId,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to
    );
}
