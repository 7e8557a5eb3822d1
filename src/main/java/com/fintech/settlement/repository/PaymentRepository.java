package com.fintech.settlement.repository;

import com.fintech.settlement.entity.Payment;
import com.fintech.settlement.entity.PaymentStatus;
import com.fintech.settlement.service.PaymentLedger;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, UUID>, PaymentLedger {

    List<Payment> findByStatusAndSettlementDate(PaymentStatus status, LocalDate settlementDate);

    long countByStatusAndSettlementDate(PaymentStatus status, LocalDate settlementDate);

    @Override
    default List<Payment> findCompletedPayments(LocalDate settlementDate) {
        return findByStatusAndSettlementDate(PaymentStatus.COMPLETED, settlementDate);
    }

    @Override
    default long countCompletedPayments(LocalDate settlementDate) {
        return countByStatusAndSettlementDate(PaymentStatus.COMPLETED, settlementDate);
    }
}
