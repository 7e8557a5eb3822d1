package com.fintech.settlement.repository;

import com.fintech.settlement.entity.Settlement;
import com.fintech.settlement.entity.SettlementStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for daily settlements. The unique settlement_date column is the guard
 * against generating the same day twice.
 */
@Repository
public interface SettlementRepository extends JpaRepository<Settlement, UUID> {

    Optional<Settlement> findBySettlementDate(LocalDate settlementDate);

    boolean existsBySettlementDate(LocalDate settlementDate);

    List<Settlement> findByStatusOrderBySettlementDateAsc(SettlementStatus status);

    List<Settlement> findBySettlementDateBetweenOrderBySettlementDateDesc(LocalDate from, LocalDate to);

    List<Settlement> findBySettlementDateBetweenAndStatusIn(LocalDate from, LocalDate to,
                                                           Collection<SettlementStatus> statuses);

    /**
     * Conditional status transition. Returns 0 when the settlement is no longer in
     * the expected status, so only one of several concurrent callers wins.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Settlement s SET s.status = :newStatus, s.processedBy = :operator, " +
            "s.processedAt = :now, s.updatedAt = :now, s.version = s.version + 1 " +
            "WHERE s.id = :id AND s.status = :expectedStatus")
    int transitionStatus(
            @Param("id") UUID id,
            @Param("expectedStatus") SettlementStatus expectedStatus,
            @Param("newStatus") SettlementStatus newStatus,
            @Param("operator") String operator,
            @Param("now") LocalDateTime now
    );

    @Query("SELECT s.status, COUNT(s) FROM Settlement s GROUP BY s.status")
    List<Object[]> getStatusCounts();
}
