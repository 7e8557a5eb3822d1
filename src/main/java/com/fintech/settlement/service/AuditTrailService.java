package com.fintech.settlement.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.settlement.dto.PayoutBatchResult;
import com.fintech.settlement.dto.SettlementProcessingResult;
import com.fintech.settlement.dto.SettlementTransferResult;
import com.fintech.settlement.dto.TransferResult;
import com.fintech.settlement.entity.AuditLog;
import com.fintech.settlement.entity.AuditSeverity;
import com.fintech.settlement.entity.CommissionPayout;
import com.fintech.settlement.entity.RecipientType;
import com.fintech.settlement.entity.Settlement;
import com.fintech.settlement.entity.SettlementStatus;
import com.fintech.settlement.recovery.OperationType;
import com.fintech.settlement.recovery.RecoveryContext;
import com.fintech.settlement.repository.AuditLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persistent audit trail of settlement, payout and recovery events.
 * <p>
 * Each entry is written in its own transaction so it survives a rollback of the caller.
 * A failure to write is logged and never propagated.
 */
@Service
@Slf4j
public class AuditTrailService {

    public static final String SYSTEM_ACTOR = "system";

    static final String SETTLEMENT = "settlement";
    static final String COMMISSION_PAYOUT = "commission_payout";
    static final String RECOVERY = "recovery";

    private static final int MAX_DETAILS_LENGTH = 4000;

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate requiresNew;

    public AuditTrailService(AuditLogRepository auditLogRepository,
                             ObjectMapper objectMapper,
                             PlatformTransactionManager transactionManager) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void settlementGenerated(Settlement settlement, List<CommissionPayout> payouts) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("settlementDate", settlement.getSettlementDate().toString());
        details.put("totalCollected", settlement.getTotalCollected());
        details.put("shaAmount", settlement.getShaAmount());
        details.put("mwuAmount", settlement.getMwuAmount());
        details.put("totalDelegateCommissions", settlement.getTotalDelegateCommissions());
        details.put("totalCoordinatorCommissions", settlement.getTotalCoordinatorCommissions());
        details.put("totalPayments", settlement.getTotalPayments());
        details.put("uniqueMembers", settlement.getUniqueMembers());
        record(SYSTEM_ACTOR, "SETTLEMENT_GENERATED", SETTLEMENT, settlement.getId(), AuditSeverity.INFO, details);

        Map<String, Object> created = new LinkedHashMap<>();
        created.put("totalPayouts", payouts.size());
        created.put("delegatePayouts", payouts.stream()
                .filter(payout -> payout.getRecipientType() == RecipientType.DELEGATE).count());
        created.put("coordinatorPayouts", payouts.stream()
                .filter(payout -> payout.getRecipientType() == RecipientType.COORDINATOR).count());
        record(SYSTEM_ACTOR, "COMMISSION_PAYOUTS_CREATED", SETTLEMENT, settlement.getId(), AuditSeverity.INFO, created);
    }

    public void settlementProcessed(SettlementProcessingResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("oldStatus", SettlementStatus.PENDING);
        details.put("newStatus", result.getFinalStatus());
        PayoutBatchResult payouts = result.getPayouts();
        if (payouts != null) {
            details.put("payoutsSubmitted", payouts.getSuccessfulPayouts());
            details.put("payoutsFailed", payouts.getFailedPayouts());
        }
        SettlementTransferResult transfers = result.getTransfers();
        if (transfers != null) {
            details.put("shaTransfer", transfers.getShaTransfer().getStatus());
            details.put("mwuTransfer", transfers.getMwuTransfer().getStatus());
        }
        if (!result.getErrors().isEmpty()) {
            details.put("errors", result.getErrors());
        }
        AuditSeverity severity = result.getFinalStatus() == SettlementStatus.COMPLETED
                ? AuditSeverity.INFO
                : AuditSeverity.WARNING;
        record(result.getProcessedBy(), "SETTLEMENT_PROCESSED", SETTLEMENT, result.getSettlementId(), severity, details);
    }

    public void settlementFailed(Settlement settlement, String operator, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("oldStatus", SettlementStatus.PROCESSING);
        details.put("newStatus", SettlementStatus.FAILED);
        details.put("reason", reason);
        record(operator, "SETTLEMENT_FAILED", SETTLEMENT, settlement.getId(), AuditSeverity.ERROR, details);
    }

    /**
     * A processing phase of a settlement raised an error or left work undone.
     */
    public void settlementError(UUID settlementId, String phase, String error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("phase", phase);
        details.put("error", error);
        record(SYSTEM_ACTOR, "SETTLEMENT_ERROR", SETTLEMENT, settlementId, AuditSeverity.CRITICAL, details);
    }

    public void transferFailed(TransferResult transfer) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("portion", transfer.getPortion());
        details.put("amount", transfer.getAmount());
        details.put("error", transfer.getError());
        record(SYSTEM_ACTOR, "BANK_TRANSFER_FAILED", SETTLEMENT, transfer.getSettlementId(), AuditSeverity.ERROR,
                details);
    }

    public void payoutInitiated(CommissionPayout payout) {
        Map<String, Object> details = payoutDetails(payout);
        details.put("conversationId", payout.getConversationId());
        details.put("reference", payout.gatewayReference());
        record(SYSTEM_ACTOR, "COMMISSION_PAYOUT_INITIATED", COMMISSION_PAYOUT, payout.getId(), AuditSeverity.INFO,
                details);
    }

    public void payoutCompleted(CommissionPayout payout) {
        Map<String, Object> details = payoutDetails(payout);
        details.put("transactionReference", payout.getTransactionReference());
        record(SYSTEM_ACTOR, "COMMISSION_PAYOUT_COMPLETED", COMMISSION_PAYOUT, payout.getId(), AuditSeverity.INFO,
                details);
    }

    public void payoutFailed(CommissionPayout payout) {
        Map<String, Object> details = payoutDetails(payout);
        details.put("reason", payout.getFailureReason());
        record(SYSTEM_ACTOR, "COMMISSION_PAYOUT_FAILED", COMMISSION_PAYOUT, payout.getId(), AuditSeverity.ERROR,
                details);
    }

    public void manualInterventionRequired(OperationType operationType, RecoveryContext context, Throwable failure) {
        Map<String, Object> details = new LinkedHashMap<>();
        context.getAttributes().forEach((key, value) -> details.put(key, String.valueOf(value)));
        details.put("error", failure.getMessage());
        record(SYSTEM_ACTOR, "MANUAL_INTERVENTION_REQUIRED", RECOVERY, operationType.getKey(),
                AuditSeverity.CRITICAL, details);
    }

    public List<AuditLog> getSettlementTrail(UUID settlementId) {
        return auditLogRepository.findByResourceTypeAndResourceIdOrderByCreatedAtAsc(SETTLEMENT,
                settlementId.toString());
    }

    public List<AuditLog> getPayoutTrail(UUID payoutId) {
        return auditLogRepository.findByResourceTypeAndResourceIdOrderByCreatedAtAsc(COMMISSION_PAYOUT,
                payoutId.toString());
    }

    /**
     * Error and critical entries, newest first.
     */
    public List<AuditLog> getAlerts() {
        return auditLogRepository.findBySeverityInOrderByCreatedAtDesc(
                List.of(AuditSeverity.ERROR, AuditSeverity.CRITICAL));
    }

    private Map<String, Object> payoutDetails(CommissionPayout payout) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("settlementId", payout.getSettlementId());
        details.put("recipientId", payout.getRecipientId());
        details.put("recipientType", payout.getRecipientType());
        details.put("amount", payout.getAmount());
        details.put("status", payout.getStatus());
        return details;
    }

    private void record(String actor, String action, String resourceType, Object resourceId,
                        AuditSeverity severity, Map<String, Object> details) {
        AuditLog entry = AuditLog.builder()
                .actor(actor == null ? SYSTEM_ACTOR : actor)
                .action(action)
                .resourceType(resourceType)
                .resourceId(resourceId == null ? null : resourceId.toString())
                .severity(severity)
                .details(toJson(details))
                .build();
        try {
            requiresNew.executeWithoutResult(status -> auditLogRepository.save(entry));
            log.info("Audit {} {} {} by {}: {}", action, resourceType, entry.getResourceId(), entry.getActor(),
                    entry.getDetails());
        } catch (RuntimeException e) {
            log.error("Failed to write audit entry {} for {} {}: {}", action, resourceType, entry.getResourceId(),
                    e.getMessage());
        }
    }

    private String toJson(Map<String, Object> details) {
        String json;
        try {
            json = objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize audit details: {}", e.getMessage());
            json = String.valueOf(details);
        }
        return json.length() <= MAX_DETAILS_LENGTH ? json : json.substring(0, MAX_DETAILS_LENGTH);
    }
}
