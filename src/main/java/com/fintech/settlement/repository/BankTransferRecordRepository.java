package com.fintech.settlement.repository;

import com.fintech.settlement.entity.BankTransferRecord;
import com.fintech.settlement.entity.TransferPortion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BankTransferRecordRepository extends JpaRepository<BankTransferRecord, UUID> {

    Optional<BankTransferRecord> findBySettlementIdAndPortion(UUID settlementId, TransferPortion portion);

    List<BankTransferRecord> findBySettlementId(UUID settlementId);
}
