package com.fintech.settlement.service;

import com.fintech.settlement.config.SettlementProperties;
import com.fintech.settlement.dto.BankAccountDetails;
import com.fintech.settlement.dto.CommissionBreakdown;
import com.fintech.settlement.dto.OverallStats;
import com.fintech.settlement.dto.PayoutBatchResult;
import com.fintech.settlement.dto.PayoutStatistics;
import com.fintech.settlement.dto.RecipientCommission;
import com.fintech.settlement.dto.SettlementProcessingResult;
import com.fintech.settlement.dto.SettlementSummary;
import com.fintech.settlement.dto.SettlementTotals;
import com.fintech.settlement.dto.SettlementTransferResult;
import com.fintech.settlement.dto.TransferResult;
import com.fintech.settlement.entity.CommissionPayout;
import com.fintech.settlement.entity.Member;
import com.fintech.settlement.entity.RecipientType;
import com.fintech.settlement.entity.Settlement;
import com.fintech.settlement.entity.SettlementStatus;
import com.fintech.settlement.entity.TransferStatus;
import com.fintech.settlement.exception.InvalidStateException;
import com.fintech.settlement.exception.ResourceNotFoundException;
import com.fintech.settlement.exception.SettlementConflictException;
import com.fintech.settlement.exception.ValidationException;
import com.fintech.settlement.recovery.HealthReport;
import com.fintech.settlement.recovery.OperationType;
import com.fintech.settlement.recovery.RecoveryContext;
import com.fintech.settlement.recovery.RetryOrchestrator;
import com.fintech.settlement.repository.SettlementRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Lifecycle of daily settlements: generation, processing and operator actions.
 * <p>
 * Key rules:
 * 1. One settlement per date. The unique date column decides between concurrent generators.
 * 2. A settlement and its payouts are inserted in one transaction.
 * 3. Processing commits pending to processing before any money moves, under a
 *    per-settlement run lock.
 * 4. Payouts and bank transfers are both attempted; the settlement only completes when
 *    everything attempted succeeded.
 */
@Service
@Slf4j
public class SettlementService {

    private static final Set<SettlementStatus> REPORTED_STATUSES =
            EnumSet.of(SettlementStatus.PENDING, SettlementStatus.COMPLETED);

    private final SettlementRepository settlementRepository;
    private final PaymentLedger paymentLedger;
    private final RecipientDirectory recipientDirectory;
    private final SettlementCalculator calculator;
    private final CommissionPayoutEngine payoutEngine;
    private final BankTransferService bankTransferService;
    private final AuditTrailService auditTrail;
    private final RetryOrchestrator retryOrchestrator;
    private final SettlementRunLock runLock;
    private final SettlementProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;

    private Counter generatedCounter;
    private Counter completedCounter;
    private Counter incompleteCounter;
    private Timer generationTimer;
    private Timer processingTimer;

    public SettlementService(SettlementRepository settlementRepository,
                             PaymentLedger paymentLedger,
                             RecipientDirectory recipientDirectory,
                             SettlementCalculator calculator,
                             CommissionPayoutEngine payoutEngine,
                             BankTransferService bankTransferService,
                             AuditTrailService auditTrail,
                             RetryOrchestrator retryOrchestrator,
                             SettlementRunLock runLock,
                             SettlementProperties properties,
                             PlatformTransactionManager transactionManager,
                             MeterRegistry meterRegistry) {
        this.settlementRepository = settlementRepository;
        this.paymentLedger = paymentLedger;
        this.recipientDirectory = recipientDirectory;
        this.calculator = calculator;
        this.payoutEngine = payoutEngine;
        this.bankTransferService = bankTransferService;
        this.auditTrail = auditTrail;
        this.retryOrchestrator = retryOrchestrator;
        this.runLock = runLock;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        generatedCounter = Counter.builder("settlement.generated")
                .description("Settlements generated")
                .register(meterRegistry);

        completedCounter = Counter.builder("settlement.completed")
                .description("Settlements fully processed")
                .register(meterRegistry);

        incompleteCounter = Counter.builder("settlement.processing.incomplete")
                .description("Processing runs that left the settlement in processing")
                .register(meterRegistry);

        generationTimer = Timer.builder("settlement.generation.duration")
                .description("Time taken to generate a settlement")
                .register(meterRegistry);

        processingTimer = Timer.builder("settlement.processing.duration")
                .description("Time taken to process a settlement")
                .register(meterRegistry);
    }

    /**
     * Generates the settlement for a date together with its commission payouts.
     *
     * @throws ValidationException         for a missing or future date
     * @throws SettlementConflictException if the date is already settled
     */
    public Settlement generate(LocalDate settlementDate) {
        if (settlementDate == null) {
            throw new ValidationException("Settlement date is required");
        }
        if (settlementDate.isAfter(today())) {
            throw new ValidationException("Cannot generate a settlement for future date " + settlementDate);
        }
        if (settlementRepository.existsBySettlementDate(settlementDate)) {
            throw new SettlementConflictException(settlementDate);
        }

        return generationTimer.record(() -> {
            Settlement settlement;
            try {
                settlement = transactionTemplate.execute(status -> createSettlement(settlementDate));
            } catch (DataIntegrityViolationException e) {
                log.warn("Concurrent generation detected for {}", settlementDate);
                throw new SettlementConflictException(settlementDate, e);
            }

            generatedCounter.increment();
            auditTrail.settlementGenerated(settlement, payoutEngine.getPayouts(settlement.getId()));
            log.info("Daily settlement {} generated for {}: collected={}, payments={}, members={}",
                    settlement.getId(), settlementDate, settlement.getTotalCollected(),
                    settlement.getTotalPayments(), settlement.getUniqueMembers());
            return settlement;
        });
    }

    private Settlement createSettlement(LocalDate settlementDate) {
        SettlementTotals totals = calculator.calculate(settlementDate, paymentLedger, recipientDirectory);

        Settlement settlement = settlementRepository.saveAndFlush(Settlement.builder()
                .settlementDate(settlementDate)
                .totalCollected(totals.getTotalCollected())
                .shaAmount(totals.getShaAmount())
                .mwuAmount(totals.getMwuAmount())
                .totalDelegateCommissions(totals.getTotalDelegateCommissions())
                .totalCoordinatorCommissions(totals.getTotalCoordinatorCommissions())
                .totalPayments(totals.getTotalPayments())
                .uniqueMembers(totals.getUniqueMembers())
                .status(SettlementStatus.PENDING)
                .build());

        payoutEngine.createPayouts(settlement, totals);
        return settlement;
    }

    /**
     * Generates missing settlements for each of the previous {@code daysBack} days that
     * has completed payments.
     */
    public List<Settlement> autoGenerateSettlements(int daysBack) {
        if (daysBack < 1) {
            throw new ValidationException("daysBack must be at least 1");
        }

        List<Settlement> generated = new ArrayList<>();
        LocalDate today = today();

        for (int i = 1; i <= daysBack; i++) {
            LocalDate date = today.minusDays(i);
            if (settlementRepository.existsBySettlementDate(date) || paymentLedger.countCompletedPayments(date) == 0) {
                continue;
            }
            try {
                generated.add(generate(date));
                log.info("Auto-generated settlement for {}", date);
            } catch (SettlementConflictException e) {
                log.info("Settlement for {} was generated concurrently, skipping", date);
            }
        }
        return generated;
    }

    /**
     * Processes a pending settlement with the configured confirmation secret and bank accounts.
     */
    public SettlementProcessingResult process(UUID settlementId, String operator,
                                              boolean initiatePayouts, boolean initiateBankTransfers) {
        return process(settlementId, operator, initiatePayouts, initiateBankTransfers,
                properties.getBankTransfer().getConfirmationSecret(), null, null);
    }

    public SettlementProcessingResult process(UUID settlementId, String operator,
                                              boolean initiatePayouts, boolean initiateBankTransfers,
                                              String confirmationSecret,
                                              BankAccountDetails shaBankDetails,
                                              BankAccountDetails mwuBankDetails) {
        Settlement settlement = findSettlement(settlementId);
        if (settlement.getStatus() != SettlementStatus.PENDING) {
            throw new InvalidStateException(String.format("Settlement %s is already %s",
                    settlementId, settlement.getStatus()));
        }
        if (!runLock.tryAcquire(settlementId)) {
            throw new InvalidStateException("Settlement " + settlementId + " is already being processed");
        }

        try {
            return processingTimer.record(() -> runProcessing(settlement, operator, initiatePayouts,
                    initiateBankTransfers, confirmationSecret, shaBankDetails, mwuBankDetails));
        } finally {
            runLock.release(settlementId);
        }
    }

    private SettlementProcessingResult runProcessing(Settlement settlement, String operator,
                                                     boolean initiatePayouts, boolean initiateBankTransfers,
                                                     String confirmationSecret,
                                                     BankAccountDetails shaBankDetails,
                                                     BankAccountDetails mwuBankDetails) {
        UUID settlementId = settlement.getId();
        SettlementProcessingResult result = SettlementProcessingResult.builder()
                .settlementId(settlementId)
                .settlementDate(settlement.getSettlementDate())
                .processedBy(operator)
                .startedAt(LocalDateTime.now())
                .build();

        HealthReport health = retryOrchestrator.validateSystemHealth();
        if (!health.isHealthy()) {
            log.warn("System health issues detected before processing settlement {}: {}",
                    settlementId, health.getIssues());
        }

        transition(settlementId, SettlementStatus.PENDING, SettlementStatus.PROCESSING, operator);
        log.info("Settlement {} for {} marked as processing by {}", settlementId,
                settlement.getSettlementDate(), operator);

        boolean payoutPhaseFailed = false;
        if (initiatePayouts) {
            try {
                PayoutBatchResult payouts = payoutEngine.processSettlementPayouts(settlementId);
                result.setPayouts(payouts);
                payoutPhaseFailed = payouts.getFailedPayouts() > 0;
            } catch (RuntimeException e) {
                log.error("Commission payout processing failed for settlement {}", settlementId, e);
                result.addError("Commission payouts: " + e.getMessage());
                auditTrail.settlementError(settlementId, "commission_payouts", e.getMessage());
                payoutPhaseFailed = true;
            }
        }
        boolean payoutPhaseErrored = !result.getErrors().isEmpty();

        boolean transfersFailed = false;
        if (initiateBankTransfers) {
            try {
                SettlementTransferResult transfers = bankTransferService.processSettlementTransfers(settlementId,
                        settlement.getShaAmount(), settlement.getMwuAmount(), confirmationSecret,
                        shaBankDetails, mwuBankDetails);
                result.setTransfers(transfers);
                transfersFailed = !transfers.isAllSucceeded();
                auditFailedTransfer(transfers.getShaTransfer());
                auditFailedTransfer(transfers.getMwuTransfer());
            } catch (RuntimeException e) {
                log.error("Bank transfer processing failed for settlement {}: {}", settlementId, e.getMessage());
                result.addError("Bank transfers: " + e.getMessage());
                auditTrail.settlementError(settlementId, "bank_transfers", e.getMessage());
                transfersFailed = true;
            }
        }

        boolean complete = (!payoutPhaseFailed && !transfersFailed)
                || (settlement.hasZeroPayments() && !payoutPhaseErrored);

        if (complete) {
            transition(settlementId, SettlementStatus.PROCESSING, SettlementStatus.COMPLETED, operator);
            result.setFinalStatus(SettlementStatus.COMPLETED);
            completedCounter.increment();
            log.info("Settlement {} completed", settlementId);
        } else {
            result.setFinalStatus(SettlementStatus.PROCESSING);
            incompleteCounter.increment();
            log.warn("Settlement {} processed with failures: payouts failed={}, transfers failed={}",
                    settlementId, payoutPhaseFailed, transfersFailed);
        }

        result.setCompletedAt(LocalDateTime.now());
        auditTrail.settlementProcessed(result);
        return result;
    }

    private void auditFailedTransfer(TransferResult transfer) {
        if (transfer != null && transfer.getStatus() == TransferStatus.FAILED) {
            auditTrail.transferFailed(transfer);
        }
    }

    /**
     * Re-submits the settlement's failed payouts. The settlement status is not changed.
     */
    public PayoutBatchResult retryFailedPayouts(UUID settlementId, String operator) {
        findSettlement(settlementId);
        if (!runLock.tryAcquire(settlementId)) {
            throw new InvalidStateException("Settlement " + settlementId + " is already being processed");
        }
        try {
            log.info("Retrying failed payouts of settlement {} requested by {}", settlementId, operator);
            PayoutBatchResult result = payoutEngine.retryFailedPayouts(settlementId);
            log.info("Retried {} payouts of settlement {}: {} accepted, {} failed", result.getTotalPayouts(),
                    settlementId, result.getSuccessfulPayouts(), result.getFailedPayouts());
            return result;
        } finally {
            runLock.release(settlementId);
        }
    }

    /**
     * Operator action moving a processing settlement to failed.
     */
    public SettlementSummary failSettlement(UUID settlementId, String operator, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A reason is required to fail a settlement");
        }
        Settlement settlement = findSettlement(settlementId);
        if (settlement.getStatus() != SettlementStatus.PROCESSING) {
            throw new InvalidStateException(String.format("Only processing settlements can be failed; %s is %s",
                    settlementId, settlement.getStatus()));
        }
        if (!runLock.tryAcquire(settlementId)) {
            throw new InvalidStateException("Settlement " + settlementId + " is being processed");
        }
        try {
            Settlement failed = transactionTemplate.execute(status -> {
                Settlement current = findSettlement(settlementId);
                current.setStatus(SettlementStatus.FAILED);
                current.setProcessedBy(operator);
                current.setProcessedAt(LocalDateTime.now());
                current.setNotes(reason.length() > 1000 ? reason.substring(0, 1000) : reason);
                return settlementRepository.save(current);
            });
            log.warn("Settlement {} failed by {}: {}", settlementId, operator, reason);
            auditTrail.settlementFailed(failed, operator, reason);
            return SettlementSummary.from(failed);
        } finally {
            runLock.release(settlementId);
        }
    }

    private void transition(UUID settlementId, SettlementStatus from, SettlementStatus to, String operator) {
        Integer updated = retryOrchestrator.executeWithRecovery(OperationType.DATABASE_TRANSACTION,
                () -> transactionTemplate.execute(status ->
                        settlementRepository.transitionStatus(settlementId, from, to, operator, LocalDateTime.now())),
                RecoveryContext.builder()
                        .attribute("settlementId", settlementId)
                        .attribute("transition", from + "->" + to)
                        .build());

        if (updated == null || updated == 0) {
            throw new InvalidStateException(String.format("Settlement %s is no longer %s", settlementId, from));
        }
    }

    public SettlementSummary getSettlement(UUID settlementId) {
        return SettlementSummary.from(findSettlement(settlementId));
    }

    public List<SettlementSummary> getSettlementSummary(LocalDate from, LocalDate to) {
        if (from == null || to == null || from.isAfter(to)) {
            throw new ValidationException("A valid date range is required");
        }
        return settlementRepository.findBySettlementDateBetweenOrderBySettlementDateDesc(from, to).stream()
                .map(SettlementSummary::from)
                .collect(Collectors.toList());
    }

    public List<SettlementSummary> getPendingSettlements() {
        return settlementRepository.findByStatusOrderBySettlementDateAsc(SettlementStatus.PENDING).stream()
                .map(SettlementSummary::from)
                .collect(Collectors.toList());
    }

    /**
     * Totals over the pending and completed settlements of the last {@code days} days.
     */
    public OverallStats getOverallStats(int days) {
        if (days < 1) {
            throw new ValidationException("days must be at least 1");
        }
        LocalDate today = today();
        List<Settlement> settlements = settlementRepository.findBySettlementDateBetweenAndStatusIn(
                today.minusDays(days), today, REPORTED_STATUSES);

        BigDecimal collected = BigDecimal.ZERO;
        BigDecimal sha = BigDecimal.ZERO;
        BigDecimal mwu = BigDecimal.ZERO;
        BigDecimal commissions = BigDecimal.ZERO;
        long payments = 0;

        for (Settlement settlement : settlements) {
            collected = collected.add(settlement.getTotalCollected());
            sha = sha.add(settlement.getShaAmount());
            mwu = mwu.add(settlement.getMwuAmount());
            commissions = commissions.add(settlement.getTotalCommissions());
            payments += settlement.getTotalPayments();
        }

        BigDecimal averagePerDay = settlements.isEmpty()
                ? BigDecimal.ZERO
                : collected.divide(BigDecimal.valueOf(settlements.size()), 2, RoundingMode.HALF_UP);

        return OverallStats.builder()
                .days(days)
                .settlementCount(settlements.size())
                .totalCollected(collected)
                .totalShaAmount(sha)
                .totalMwuAmount(mwu)
                .totalCommissions(commissions)
                .totalPayments(payments)
                .averagePerDay(averagePerDay)
                .settlementsByStatus(countByStatus())
                .build();
    }

    private Map<SettlementStatus, Long> countByStatus() {
        Map<SettlementStatus, Long> counts = new EnumMap<>(SettlementStatus.class);
        for (SettlementStatus status : SettlementStatus.values()) {
            counts.put(status, 0L);
        }
        for (Object[] row : settlementRepository.getStatusCounts()) {
            counts.put((SettlementStatus) row[0], (Long) row[1]);
        }
        return counts;
    }

    public CommissionBreakdown getCommissionBreakdown(UUID settlementId) {
        Settlement settlement = findSettlement(settlementId);
        List<CommissionPayout> payouts = payoutEngine.getPayouts(settlementId);

        Map<UUID, Member> recipients = recipientDirectory.findMembers(payouts.stream()
                .map(CommissionPayout::getRecipientId)
                .collect(Collectors.toSet()));

        List<RecipientCommission> delegates = new ArrayList<>();
        List<RecipientCommission> coordinators = new ArrayList<>();
        for (CommissionPayout payout : payouts) {
            Member recipient = recipients.get(payout.getRecipientId());
            RecipientCommission commission = RecipientCommission.builder()
                    .recipientId(payout.getRecipientId())
                    .name(recipient == null ? SettlementCalculator.UNKNOWN_RECIPIENT : recipient.getFullName())
                    .phoneNumber(recipient == null ? null : recipient.getPhoneNumber())
                    .email(recipient == null ? null : recipient.getEmail())
                    .totalCommission(payout.getAmount())
                    .paymentCount(payout.getPaymentCount())
                    .build();
            if (payout.getRecipientType() == RecipientType.DELEGATE) {
                delegates.add(commission);
            } else {
                coordinators.add(commission);
            }
        }

        return CommissionBreakdown.builder()
                .settlementId(settlementId)
                .settlementDate(settlement.getSettlementDate())
                .delegateBreakdown(delegates)
                .coordinatorBreakdown(coordinators)
                .build();
    }

    public PayoutStatistics getPayoutStatistics(UUID settlementId) {
        findSettlement(settlementId);
        return payoutEngine.getPayoutStatistics(settlementId);
    }

    private Settlement findSettlement(UUID settlementId) {
        if (settlementId == null) {
            throw new ValidationException("Settlement id is required");
        }
        return settlementRepository.findById(settlementId)
                .orElseThrow(() -> new ResourceNotFoundException("Settlement", settlementId));
    }

    LocalDate today() {
        return LocalDate.now(ZoneId.of(properties.getScheduler().getZone()));
    }
}
