package com.fintech.settlement.recovery;

import com.fintech.settlement.service.AuditTrailService;
import com.fintech.settlement.service.BankTransferClient;
import com.fintech.settlement.service.PayoutGatewayClient;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Recovery actions registered at startup for each operation type.
 * <p>
 * Retry actions grant one final attempt when the failing dependency looks healthy again.
 * Manual-intervention actions write a critical entry to the audit trail, which operations
 * staff monitor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DefaultRecoveryActions {

    private final RetryOrchestrator retryOrchestrator;
    private final PayoutGatewayClient payoutGatewayClient;
    private final BankTransferClient bankTransferClient;
    private final AuditTrailService auditTrail;

    @PostConstruct
    public void registerDefaults() {
        retryOrchestrator.registerRecoveryAction(OperationType.SETTLEMENT_GENERATION, RecoveryAction.builder()
                .id("retry_when_healthy")
                .type(RecoveryActionType.RETRY)
                .description("Retry settlement generation once the database and report directory are healthy")
                .priority(RecoveryPriority.HIGH)
                .handler((context, failure) -> retryOrchestrator.validateSystemHealth().isHealthy())
                .build());

        retryOrchestrator.registerRecoveryAction(OperationType.SETTLEMENT_GENERATION, RecoveryAction.builder()
                .id("manual_settlement_review")
                .type(RecoveryActionType.MANUAL_INTERVENTION)
                .description("Flag settlement generation for manual review")
                .priority(RecoveryPriority.HIGH)
                .handler((context, failure) -> flagForReview(OperationType.SETTLEMENT_GENERATION, context, failure))
                .build());

        retryOrchestrator.registerRecoveryAction(OperationType.SETTLEMENT_PROCESSING, RecoveryAction.builder()
                .id("manual_processing_review")
                .type(RecoveryActionType.MANUAL_INTERVENTION)
                .description("Flag settlement processing for manual review")
                .priority(RecoveryPriority.HIGH)
                .handler((context, failure) -> flagForReview(OperationType.SETTLEMENT_PROCESSING, context, failure))
                .build());

        retryOrchestrator.registerRecoveryAction(OperationType.GATEWAY_PAYOUT, RecoveryAction.builder()
                .id("retry_when_gateway_available")
                .type(RecoveryActionType.RETRY)
                .description("Retry the payout once the payout gateway reports itself available")
                .priority(RecoveryPriority.HIGH)
                .handler((context, failure) -> payoutGatewayClient.isAvailable())
                .build());

        retryOrchestrator.registerRecoveryAction(OperationType.GATEWAY_PAYOUT, RecoveryAction.builder()
                .id("manual_payout")
                .type(RecoveryActionType.MANUAL_INTERVENTION)
                .description("Mark the payout for manual disbursement")
                .priority(RecoveryPriority.MEDIUM)
                .handler((context, failure) -> flagForReview(OperationType.GATEWAY_PAYOUT, context, failure))
                .build());

        retryOrchestrator.registerRecoveryAction(OperationType.BANK_TRANSFER, RecoveryAction.builder()
                .id("retry_when_bank_available")
                .type(RecoveryActionType.RETRY)
                .description("Retry the transfer once the bank rail reports itself available")
                .priority(RecoveryPriority.HIGH)
                .handler((context, failure) -> bankTransferClient.isAvailable())
                .build());

        retryOrchestrator.registerRecoveryAction(OperationType.BANK_TRANSFER, RecoveryAction.builder()
                .id("manual_transfer_review")
                .type(RecoveryActionType.MANUAL_INTERVENTION)
                .description("Flag the bank transfer for manual review")
                .priority(RecoveryPriority.MEDIUM)
                .handler((context, failure) -> flagForReview(OperationType.BANK_TRANSFER, context, failure))
                .build());

        retryOrchestrator.registerRecoveryAction(OperationType.DATABASE_TRANSACTION, RecoveryAction.builder()
                .id("retry_when_database_healthy")
                .type(RecoveryActionType.RETRY)
                .description("Retry the database operation once the health check passes")
                .priority(RecoveryPriority.HIGH)
                .handler((context, failure) -> retryOrchestrator.validateSystemHealth().isHealthy())
                .build());

        retryOrchestrator.registerRecoveryAction(OperationType.DATABASE_TRANSACTION, RecoveryAction.builder()
                .id("rollback_transaction")
                .type(RecoveryActionType.ROLLBACK)
                .description("Roll back the caller's transaction")
                .priority(RecoveryPriority.MEDIUM)
                .handler((context, failure) -> true)
                .build());

        log.info("Registered default recovery actions");
    }

    private boolean flagForReview(OperationType operationType, RecoveryContext context, Throwable failure) {
        log.error("Manual intervention required for {} {}: {}", operationType.getKey(), context, failure.getMessage());
        auditTrail.manualInterventionRequired(operationType, context, failure);
        return true;
    }
}
