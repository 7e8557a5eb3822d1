package com.fintech.settlement.service;

import com.fintech.settlement.dto.GatewaySubmission;
import com.fintech.settlement.dto.PayoutBatchResult;
import com.fintech.settlement.dto.PayoutCallbackRequest;
import com.fintech.settlement.dto.PayoutResult;
import com.fintech.settlement.dto.PayoutStatistics;
import com.fintech.settlement.dto.RecipientCommission;
import com.fintech.settlement.dto.RecipientCommissionSummary;
import com.fintech.settlement.dto.RecipientPayoutView;
import com.fintech.settlement.dto.SettlementTotals;
import com.fintech.settlement.entity.CommissionPayout;
import com.fintech.settlement.entity.Member;
import com.fintech.settlement.entity.PayoutStatus;
import com.fintech.settlement.entity.RecipientType;
import com.fintech.settlement.entity.Settlement;
import com.fintech.settlement.exception.InvalidStateException;
import com.fintech.settlement.exception.ResourceNotFoundException;
import com.fintech.settlement.exception.ValidationException;
import com.fintech.settlement.recovery.OperationType;
import com.fintech.settlement.recovery.RecoveryContext;
import com.fintech.settlement.recovery.RetryOrchestrator;
import com.fintech.settlement.repository.CommissionPayoutRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Creates, submits and tracks one commission payout per recipient of a settlement.
 * <p>
 * Submission only gets the request accepted by the gateway (pending to processing). The
 * money movement is confirmed later by a callback correlated through the conversation id
 * the gateway issued. Every submission carries the payout's gateway reference, which stays
 * the same across retries, and is skipped when the payout is already with the gateway, so
 * retrying it is safe.
 * <p>
 * A payout that cannot be submitted is marked failed and never blocks the others.
 */
@Service
@Slf4j
public class CommissionPayoutEngine {

    static final String PAYMENT_METHOD = "mobile_money";

    private final CommissionPayoutRepository payoutRepository;
    private final RecipientDirectory recipientDirectory;
    private final PayoutGatewayClient gatewayClient;
    private final RetryOrchestrator retryOrchestrator;
    private final AuditTrailService auditTrail;
    private final MeterRegistry meterRegistry;

    private Counter submittedCounter;
    private Counter submissionFailureCounter;
    private Counter processedCounter;
    private Counter failedCounter;

    public CommissionPayoutEngine(CommissionPayoutRepository payoutRepository,
                                  RecipientDirectory recipientDirectory,
                                  PayoutGatewayClient gatewayClient,
                                  RetryOrchestrator retryOrchestrator,
                                  AuditTrailService auditTrail,
                                  MeterRegistry meterRegistry) {
        this.payoutRepository = payoutRepository;
        this.recipientDirectory = recipientDirectory;
        this.gatewayClient = gatewayClient;
        this.retryOrchestrator = retryOrchestrator;
        this.auditTrail = auditTrail;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        submittedCounter = Counter.builder("settlement.payouts.submitted")
                .description("Payouts accepted by the payout gateway")
                .register(meterRegistry);

        submissionFailureCounter = Counter.builder("settlement.payouts.submission.failures")
                .description("Payouts the gateway could not accept after all retries")
                .register(meterRegistry);

        processedCounter = Counter.builder("settlement.payouts.processed")
                .description("Payouts confirmed as paid")
                .register(meterRegistry);

        failedCounter = Counter.builder("settlement.payouts.failed")
                .description("Payouts marked as failed")
                .register(meterRegistry);
    }

    /**
     * Inserts one pending payout per recipient with a positive commission. Must run
     * inside the transaction that inserts the settlement.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<CommissionPayout> createPayouts(Settlement settlement, SettlementTotals totals) {
        List<CommissionPayout> payouts = new ArrayList<>();
        addPayouts(payouts, settlement, totals.getDelegateBreakdown(), RecipientType.DELEGATE);
        addPayouts(payouts, settlement, totals.getCoordinatorBreakdown(), RecipientType.COORDINATOR);

        List<CommissionPayout> saved = payoutRepository.saveAll(payouts);
        log.info("Created {} commission payouts for settlement {}", saved.size(), settlement.getId());
        return saved;
    }

    private void addPayouts(List<CommissionPayout> payouts, Settlement settlement,
                            List<RecipientCommission> breakdown, RecipientType recipientType) {
        for (RecipientCommission commission : breakdown) {
            if (commission.getTotalCommission() == null || commission.getTotalCommission().signum() <= 0) {
                continue;
            }
            payouts.add(CommissionPayout.builder()
                    .settlementId(settlement.getId())
                    .recipientId(commission.getRecipientId())
                    .recipientType(recipientType)
                    .amount(commission.getTotalCommission())
                    .paymentCount(commission.getPaymentCount())
                    .build());
        }
    }

    /**
     * Submits every pending payout of the settlement, one after another.
     */
    public PayoutBatchResult processSettlementPayouts(UUID settlementId) {
        List<CommissionPayout> pending = payoutRepository.findBySettlementIdAndStatus(settlementId, PayoutStatus.PENDING);
        PayoutBatchResult batch = PayoutBatchResult.empty(settlementId);

        if (pending.isEmpty()) {
            log.info("No pending payouts for settlement {}", settlementId);
            return batch;
        }

        log.info("Submitting {} payouts for settlement {}", pending.size(), settlementId);
        for (CommissionPayout payout : pending) {
            batch.addResult(submitWithRecovery(payout));
        }

        log.info("Settlement {} payouts submitted: {} accepted, {} failed",
                settlementId, batch.getSuccessfulPayouts(), batch.getFailedPayouts());
        return batch;
    }

    /**
     * Resets the settlement's failed payouts to pending and submits them again.
     */
    public PayoutBatchResult retryFailedPayouts(UUID settlementId) {
        List<CommissionPayout> failed = payoutRepository.findBySettlementIdAndStatus(settlementId, PayoutStatus.FAILED);
        PayoutBatchResult batch = PayoutBatchResult.empty(settlementId);

        if (failed.isEmpty()) {
            log.info("No failed payouts to retry for settlement {}", settlementId);
            return batch;
        }

        log.info("Retrying {} failed payouts for settlement {}", failed.size(), settlementId);
        for (CommissionPayout payout : failed) {
            payout.resetForResubmission();
            CommissionPayout reset = payoutRepository.save(payout);
            batch.addResult(submitWithRecovery(reset));
        }
        return batch;
    }

    /**
     * Operator-initiated submission of a single pending payout.
     */
    public PayoutResult processIndividualPayout(UUID payoutId) {
        CommissionPayout payout = findPayout(payoutId);
        if (payout.getStatus() != PayoutStatus.PENDING) {
            throw new InvalidStateException(String.format("Payout %s is already %s", payoutId, payout.getStatus()));
        }
        requireContact(payout);
        return submitWithRecovery(payout);
    }

    private PayoutResult submitWithRecovery(CommissionPayout payout) {
        RecoveryContext context = RecoveryContext.builder()
                .attribute("payoutId", payout.getId())
                .attribute("settlementId", payout.getSettlementId())
                .attribute("recipientId", payout.getRecipientId())
                .build();
        try {
            PayoutResult result = retryOrchestrator.executeWithRecovery(OperationType.GATEWAY_PAYOUT,
                    () -> submit(payout.getId()), context);
            submittedCounter.increment();
            return result;
        } catch (RuntimeException e) {
            log.error("Commission payout {} to {} {} could not be submitted: {}", payout.getId(),
                    payout.getRecipientType().getLabel(), payout.getRecipientId(), e.getMessage());
            submissionFailureCounter.increment();
            markAsFailed(payout.getId(), e.getMessage());
            return PayoutResult.builder()
                    .payoutId(payout.getId())
                    .recipientId(payout.getRecipientId())
                    .recipientType(payout.getRecipientType())
                    .amount(payout.getAmount())
                    .success(false)
                    .error(e.getMessage())
                    .build();
        }
    }

    /**
     * One submission attempt. Reloads the payout so a repeated attempt sees the outcome
     * of the previous one.
     */
    PayoutResult submit(UUID payoutId) {
        CommissionPayout payout = findPayout(payoutId);

        if (payout.getConversationId() != null
                && (payout.getStatus() == PayoutStatus.PROCESSING || payout.getStatus() == PayoutStatus.PROCESSED)) {
            log.info("Payout {} already submitted with conversation id {}", payoutId, payout.getConversationId());
            return toResult(payout, true, null);
        }
        if (payout.getStatus() != PayoutStatus.PENDING) {
            throw new InvalidStateException(String.format("Payout %s is %s and cannot be submitted",
                    payoutId, payout.getStatus()));
        }

        String contact = requireContact(payout);

        payout.incrementSubmissionAttempts();
        payout = payoutRepository.save(payout);

        GatewaySubmission submission = gatewayClient.submit(payout.getAmount(), contact, payout.gatewayReference());

        payout.setStatus(PayoutStatus.PROCESSING);
        payout.setConversationId(submission.getConversationId());
        payout.setOriginatorConversationId(submission.getOriginatorConversationId());
        payout.setPaymentMethod(PAYMENT_METHOD);
        payout = payoutRepository.save(payout);
        auditTrail.payoutInitiated(payout);

        log.info("Commission payout {} of {} to {} {} accepted by {}, conversation id {}", payout.getId(),
                payout.getAmount(), payout.getRecipientType().getLabel(), payout.getRecipientId(),
                gatewayClient.getGatewayName(), submission.getConversationId());

        return toResult(payout, true, null);
    }

    private String requireContact(CommissionPayout payout) {
        return recipientDirectory.findMember(payout.getRecipientId())
                .map(Member::getPhoneNumber)
                .filter(phone -> !phone.isBlank())
                .orElseThrow(() -> new ValidationException(
                        "Recipient phone number not found for " + payout.getRecipientId()));
    }

    /**
     * Records a confirmed payment. Repeating it is a no-op; it also overrides an earlier
     * failure since the money was paid.
     */
    @Transactional
    public CommissionPayout markAsProcessed(UUID payoutId, String transactionReference, String paymentMethod) {
        return applyProcessed(findPayout(payoutId), transactionReference, paymentMethod);
    }

    /**
     * Records a failed payment. Ignored for a payout already confirmed as paid.
     */
    @Transactional
    public CommissionPayout markAsFailed(UUID payoutId, String reason) {
        return applyFailed(findPayout(payoutId), reason);
    }

    @Transactional
    public CommissionPayout completeFromCallback(String conversationId, String transactionReference) {
        return applyProcessed(findByConversationId(conversationId), transactionReference, null);
    }

    @Transactional
    public CommissionPayout failFromCallback(String conversationId, String resultCode, String resultDescription) {
        return applyFailed(findByConversationId(conversationId),
                String.format("Gateway error %s: %s", resultCode, resultDescription));
    }

    /**
     * Applies the asynchronous gateway result to the payout it belongs to.
     */
    @Transactional
    public CommissionPayout handleCallback(PayoutCallbackRequest callback) {
        if (callback.isSuccess()) {
            return completeFromCallback(callback.getConversationId(), callback.getTransactionReference());
        }
        return failFromCallback(callback.getConversationId(), callback.getResultCode(),
                callback.getResultDescription());
    }

    private CommissionPayout applyProcessed(CommissionPayout payout, String transactionReference, String paymentMethod) {
        if (payout.getStatus() == PayoutStatus.PROCESSED) {
            log.debug("Payout {} already processed", payout.getId());
            return payout;
        }
        if (payout.getStatus() == PayoutStatus.FAILED) {
            log.warn("Payout {} was failed ({}) but is now confirmed as paid", payout.getId(), payout.getFailureReason());
        }

        payout.setStatus(PayoutStatus.PROCESSED);
        payout.setTransactionReference(transactionReference);
        payout.setProcessedAt(LocalDateTime.now());
        payout.setFailureReason(null);
        if (paymentMethod != null) {
            payout.setPaymentMethod(paymentMethod);
        } else if (payout.getPaymentMethod() == null) {
            payout.setPaymentMethod(PAYMENT_METHOD);
        }

        CommissionPayout saved = payoutRepository.save(payout);
        processedCounter.increment();
        auditTrail.payoutCompleted(saved);
        log.info("Commission payout {} processed, reference {}", payout.getId(), transactionReference);
        return saved;
    }

    private CommissionPayout applyFailed(CommissionPayout payout, String reason) {
        switch (payout.getStatus()) {
            case PROCESSED -> {
                log.warn("Ignoring failure of payout {} which was already paid: {}", payout.getId(), reason);
                return payout;
            }
            case FAILED -> {
                log.debug("Payout {} already failed", payout.getId());
                return payout;
            }
            default -> {
                payout.setStatus(PayoutStatus.FAILED);
                payout.setFailureReason(truncate(reason));
                CommissionPayout saved = payoutRepository.save(payout);
                failedCounter.increment();
                auditTrail.payoutFailed(saved);
                log.warn("Commission payout {} failed: {}", payout.getId(), reason);
                return saved;
            }
        }
    }

    public List<CommissionPayout> getPayouts(UUID settlementId) {
        return payoutRepository.findBySettlementIdOrderByRecipientTypeAscRecipientIdAsc(settlementId);
    }

    public PayoutStatistics getPayoutStatistics(UUID settlementId) {
        PayoutStatistics stats = PayoutStatistics.builder().settlementId(settlementId).build();

        for (CommissionPayout payout : getPayouts(settlementId)) {
            BigDecimal amount = payout.getAmount();
            stats.setTotalPayouts(stats.getTotalPayouts() + 1);
            stats.setTotalAmount(stats.getTotalAmount().add(amount));

            switch (payout.getStatus()) {
                case PENDING -> {
                    stats.setPendingPayouts(stats.getPendingPayouts() + 1);
                    stats.setPendingAmount(stats.getPendingAmount().add(amount));
                }
                case PROCESSING -> {
                    stats.setProcessingPayouts(stats.getProcessingPayouts() + 1);
                    stats.setProcessingAmount(stats.getProcessingAmount().add(amount));
                }
                case PROCESSED -> {
                    stats.setProcessedPayouts(stats.getProcessedPayouts() + 1);
                    stats.setProcessedAmount(stats.getProcessedAmount().add(amount));
                }
                case FAILED -> {
                    stats.setFailedPayouts(stats.getFailedPayouts() + 1);
                    stats.setFailedAmount(stats.getFailedAmount().add(amount));
                }
            }
        }
        return stats;
    }

    public List<RecipientPayoutView> getPayoutsByRecipient(UUID recipientId, int limit) {
        if (limit < 1) {
            throw new ValidationException("Limit must be positive");
        }
        return payoutRepository.findRecipientPayouts(recipientId, PageRequest.of(0, limit));
    }

    public RecipientCommissionSummary getCommissionSummary(UUID recipientId, LocalDate from, LocalDate to) {
        if (from == null || to == null || from.isAfter(to)) {
            throw new ValidationException("A valid date range is required");
        }

        RecipientCommissionSummary summary = RecipientCommissionSummary.builder()
                .recipientId(recipientId)
                .from(from)
                .to(to)
                .build();

        for (CommissionPayout payout : payoutRepository.findRecipientPayoutsBetween(recipientId, from, to)) {
            BigDecimal amount = payout.getAmount();
            summary.setTotalPayouts(summary.getTotalPayouts() + 1);
            summary.setTotalAmount(summary.getTotalAmount().add(amount));
            switch (payout.getStatus()) {
                case PROCESSED -> summary.setProcessedAmount(summary.getProcessedAmount().add(amount));
                case FAILED -> summary.setFailedAmount(summary.getFailedAmount().add(amount));
                case PENDING, PROCESSING -> summary.setPendingAmount(summary.getPendingAmount().add(amount));
            }
        }
        return summary;
    }

    private CommissionPayout findPayout(UUID payoutId) {
        return payoutRepository.findById(payoutId)
                .orElseThrow(() -> new ResourceNotFoundException("Commission payout", payoutId));
    }

    private CommissionPayout findByConversationId(String conversationId) {
        return payoutRepository.findByConversationId(conversationId)
                .orElseThrow(() -> new ResourceNotFoundException("Commission payout with conversation id",
                        conversationId));
    }

    private static PayoutResult toResult(CommissionPayout payout, boolean success, String error) {
        return PayoutResult.builder()
                .payoutId(payout.getId())
                .recipientId(payout.getRecipientId())
                .recipientType(payout.getRecipientType())
                .amount(payout.getAmount())
                .success(success)
                .conversationId(payout.getConversationId())
                .error(error)
                .build();
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= 500) {
            return reason;
        }
        return reason.substring(0, 500);
    }
}
