package com.fintech.settlement.integration;

import com.fintech.settlement.dto.OverallStats;
import com.fintech.settlement.dto.PayoutBatchResult;
import com.fintech.settlement.dto.PayoutCallbackRequest;
import com.fintech.settlement.dto.PayoutStatistics;
import com.fintech.settlement.dto.RecipientCommissionSummary;
import com.fintech.settlement.dto.RecipientPayoutView;
import com.fintech.settlement.dto.SettlementProcessingResult;
import com.fintech.settlement.dto.SettlementSummary;
import com.fintech.settlement.entity.AuditLog;
import com.fintech.settlement.entity.AuditSeverity;
import com.fintech.settlement.entity.BankTransferRecord;
import com.fintech.settlement.entity.CommissionPayout;
import com.fintech.settlement.entity.Member;
import com.fintech.settlement.entity.Payment;
import com.fintech.settlement.entity.PaymentStatus;
import com.fintech.settlement.entity.PayoutStatus;
import com.fintech.settlement.entity.RecipientType;
import com.fintech.settlement.entity.Settlement;
import com.fintech.settlement.entity.SettlementStatus;
import com.fintech.settlement.entity.TransferStatus;
import com.fintech.settlement.exception.SettlementConflictException;
import com.fintech.settlement.repository.AuditLogRepository;
import com.fintech.settlement.repository.BankTransferRecordRepository;
import com.fintech.settlement.repository.CommissionPayoutRepository;
import com.fintech.settlement.repository.MemberRepository;
import com.fintech.settlement.repository.PaymentRepository;
import com.fintech.settlement.repository.SettlementRepository;
import com.fintech.settlement.service.AuditTrailService;
import com.fintech.settlement.service.CommissionPayoutEngine;
import com.fintech.settlement.service.DailySummaryWriter;
import com.fintech.settlement.service.MockBankTransferClient;
import com.fintech.settlement.service.MockPayoutGatewayClient;
import com.fintech.settlement.service.SettlementService;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the settlement cycle.
 * <p>
 * These tests run generation, processing and callbacks against a real database
 * (H2 in-memory), the retry orchestrator and the mock payout gateway and bank rail.
 */
@SpringBootTest
@ActiveProfiles("test")
class SettlementIntegrationTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 1);

    @Autowired
    private SettlementService settlementService;

    @Autowired
    private CommissionPayoutEngine payoutEngine;

    @Autowired
    private DailySummaryWriter summaryWriter;

    @Autowired
    private SettlementRepository settlementRepository;

    @Autowired
    private CommissionPayoutRepository payoutRepository;

    @Autowired
    private BankTransferRecordRepository transferRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private MemberRepository memberRepository;

    @Autowired
    private MockPayoutGatewayClient payoutGateway;

    @Autowired
    private MockBankTransferClient bankRail;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Autowired
    private AuditTrailService auditTrail;

    private Member delegate;
    private Member coordinator;

    @BeforeEach
    void setUp() {
        // Clear existing data
        auditLogRepository.deleteAll();
        transferRepository.deleteAll();
        payoutRepository.deleteAll();
        settlementRepository.deleteAll();
        paymentRepository.deleteAll();
        memberRepository.deleteAll();

        payoutGateway.reset();
        bankRail.reset();
        circuitBreakerRegistry.getAllCircuitBreakers().forEach(CircuitBreaker::reset);

        delegate = memberRepository.save(member("Jane", "Delegate", "+254700000001", null, null));
        coordinator = memberRepository.save(member("John", "Coordinator", "+254700000002", null, null));
    }

    @Test
    @DisplayName("Should generate the day's settlement with one payout per recipient")
    void shouldGenerateWorkedExample() {
        // Given: 1000 collected from two payers of the same delegate and coordinator
        givenWorkedExamplePayments();

        // When
        Settlement settlement = settlementService.generate(DATE);

        // Then
        assertThat(settlement.getStatus()).isEqualTo(SettlementStatus.PENDING);
        assertThat(settlement.getTotalCollected()).isEqualByComparingTo("1000");
        assertThat(settlement.getShaAmount()).isEqualByComparingTo("120");
        assertThat(settlement.getMwuAmount()).isEqualByComparingTo("820");
        assertThat(settlement.getTotalDelegateCommissions()).isEqualByComparingTo("40");
        assertThat(settlement.getTotalCoordinatorCommissions()).isEqualByComparingTo("20");
        assertThat(settlement.getUniqueMembers()).isEqualTo(2);

        List<CommissionPayout> payouts = payoutRepository.findBySettlementIdOrderByRecipientTypeAscRecipientIdAsc(
                settlement.getId());
        assertThat(payouts).hasSize(2);
        assertThat(payouts).allMatch(payout -> payout.getStatus() == PayoutStatus.PENDING);
        assertThat(payouts).filteredOn(payout -> payout.getRecipientType() == RecipientType.DELEGATE)
                .singleElement()
                .satisfies(payout -> {
                    assertThat(payout.getRecipientId()).isEqualTo(delegate.getId());
                    assertThat(payout.getAmount()).isEqualByComparingTo("40");
                });
        assertThat(payouts).filteredOn(payout -> payout.getRecipientType() == RecipientType.COORDINATOR)
                .singleElement()
                .satisfies(payout -> assertThat(payout.getAmount()).isEqualByComparingTo("20"));
    }

    @Test
    @DisplayName("Should refuse a second settlement for the same date")
    void shouldRejectDuplicateGeneration() {
        givenWorkedExamplePayments();
        settlementService.generate(DATE);

        assertThatThrownBy(() -> settlementService.generate(DATE))
                .isInstanceOf(SettlementConflictException.class);

        assertThat(settlementRepository.findAll()).hasSize(1);
        assertThat(payoutRepository.findAll()).hasSize(2);
    }

    @Test
    @DisplayName("Full processing flow - submits payouts, transfers shares and completes")
    void fullProcessingFlow() {
        givenWorkedExamplePayments();
        Settlement settlement = settlementService.generate(DATE);

        // When
        SettlementProcessingResult result = settlementService.process(settlement.getId(), "ops-user",
                true, true, "test-secret", null, null);

        // Then
        assertThat(result.getFinalStatus()).isEqualTo(SettlementStatus.COMPLETED);
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getPayouts().getSuccessfulPayouts()).isEqualTo(2);
        assertThat(result.getTransfers().isAllSucceeded()).isTrue();

        Settlement stored = settlementRepository.findById(settlement.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(SettlementStatus.COMPLETED);
        assertThat(stored.getProcessedBy()).isEqualTo("ops-user");
        assertThat(stored.getProcessedAt()).isNotNull();

        List<BankTransferRecord> transfers = transferRepository.findBySettlementId(settlement.getId());
        assertThat(transfers).hasSize(2);
        assertThat(transfers).allMatch(transfer -> transfer.getStatus() == TransferStatus.COMPLETED);

        PayoutStatistics stats = settlementService.getPayoutStatistics(settlement.getId());
        assertThat(stats.getProcessingPayouts()).isEqualTo(2);
        assertThat(stats.getProcessingAmount()).isEqualByComparingTo("60");
    }

    @Test
    @DisplayName("Gateway callback should settle the payout it belongs to")
    void callbackShouldCompletePayout() {
        givenWorkedExamplePayments();
        Settlement settlement = settlementService.generate(DATE);
        settlementService.process(settlement.getId(), "ops-user", true, false, null, null, null);

        CommissionPayout submitted = payoutRepository.findBySettlementIdAndStatus(settlement.getId(),
                PayoutStatus.PROCESSING).get(0);
        assertThat(payoutGateway.findSubmission(submitted.getId().toString())).isPresent();

        // When: the gateway posts the result twice
        PayoutCallbackRequest callback = PayoutCallbackRequest.builder()
                .conversationId(submitted.getConversationId())
                .resultCode(PayoutCallbackRequest.SUCCESS_CODE)
                .resultDescription("The service request is processed successfully.")
                .transactionReference("QKJ4H7XYZ1")
                .build();
        payoutEngine.handleCallback(callback);
        payoutEngine.handleCallback(callback);

        // Then
        CommissionPayout processed = payoutRepository.findById(submitted.getId()).orElseThrow();
        assertThat(processed.getStatus()).isEqualTo(PayoutStatus.PROCESSED);
        assertThat(processed.getTransactionReference()).isEqualTo("QKJ4H7XYZ1");
        assertThat(processed.getProcessedAt()).isNotNull();
    }

    @Test
    @DisplayName("Should record generation, processing, submission and payment in the audit trail")
    void shouldRecordAuditTrail() {
        givenWorkedExamplePayments();
        Settlement settlement = settlementService.generate(DATE);
        settlementService.process(settlement.getId(), "ops-user", true, true, "test-secret", null, null);

        List<AuditLog> settlementTrail = auditTrail.getSettlementTrail(settlement.getId());
        assertThat(settlementTrail).extracting(AuditLog::getAction)
                .containsExactlyInAnyOrder("SETTLEMENT_GENERATED", "COMMISSION_PAYOUTS_CREATED", "SETTLEMENT_PROCESSED");
        assertThat(settlementTrail).filteredOn(entry -> entry.getAction().equals("SETTLEMENT_PROCESSED"))
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getActor()).isEqualTo("ops-user");
                    assertThat(entry.getSeverity()).isEqualTo(AuditSeverity.INFO);
                });
        assertThat(settlementTrail).filteredOn(entry -> entry.getAction().equals("SETTLEMENT_GENERATED"))
                .singleElement()
                .satisfies(entry -> assertThat(entry.getDetails()).contains("\"totalCollected\""));

        CommissionPayout submitted = payoutRepository.findBySettlementIdAndStatus(settlement.getId(),
                PayoutStatus.PROCESSING).get(0);
        payoutEngine.handleCallback(PayoutCallbackRequest.builder()
                .conversationId(submitted.getConversationId())
                .resultCode(PayoutCallbackRequest.SUCCESS_CODE)
                .transactionReference("QKJ4H7AUD1")
                .build());

        assertThat(auditTrail.getPayoutTrail(submitted.getId())).extracting(AuditLog::getAction)
                .containsExactlyInAnyOrder("COMMISSION_PAYOUT_INITIATED", "COMMISSION_PAYOUT_COMPLETED");
        assertThat(auditTrail.getAlerts()).isEmpty();
    }

    @Test
    @DisplayName("Should complete a day without payments and leave the bank untouched")
    void shouldCompleteZeroPaymentSettlement() {
        LocalDate quietDay = DATE.plusDays(1);
        Settlement settlement = settlementService.generate(quietDay);

        assertThat(settlement.getTotalCollected()).isEqualByComparingTo("0");
        assertThat(payoutRepository.findBySettlementIdOrderByRecipientTypeAscRecipientIdAsc(settlement.getId())).isEmpty();

        SettlementProcessingResult result = settlementService.process(settlement.getId(), "ops-user",
                true, true, "test-secret", null, null);

        assertThat(result.getFinalStatus()).isEqualTo(SettlementStatus.COMPLETED);
        assertThat(bankRail.getCallCount()).isZero();
    }

    @Test
    @DisplayName("Should stay processing when one of three payouts is rejected, then recover on retry")
    void shouldStayProcessingOnPartialFailure() {
        // Given: three payers with three different delegates
        Member second = memberRepository.save(member("Mary", "Delegate", "+254700000011", null, null));
        Member third = memberRepository.save(member("Paul", "Delegate", "+254700000012", null, null));
        savePayment(memberRepository.save(member("Payer", "A", null, delegate.getId(), coordinator.getId())),
                "100", "12", "4", "2");
        savePayment(memberRepository.save(member("Payer", "B", null, second.getId(), coordinator.getId())),
                "100", "12", "4", "2");
        savePayment(memberRepository.save(member("Payer", "C", null, third.getId(), coordinator.getId())),
                "100", "12", "4", "2");
        Settlement settlement = settlementService.generate(DATE);
        payoutGateway.rejectContact("+254700000012");

        // When
        SettlementProcessingResult result = settlementService.process(settlement.getId(), "ops-user",
                true, true, "test-secret", null, null);

        // Then
        assertThat(result.getFinalStatus()).isEqualTo(SettlementStatus.PROCESSING);
        assertThat(result.getPayouts().getTotalPayouts()).isEqualTo(4);
        assertThat(result.getPayouts().getFailedPayouts()).isEqualTo(1);
        assertThat(settlementRepository.findById(settlement.getId()).orElseThrow().getStatus())
                .isEqualTo(SettlementStatus.PROCESSING);

        CommissionPayout rejected = payoutRepository.findBySettlementIdAndStatus(settlement.getId(),
                PayoutStatus.FAILED).get(0);
        assertThat(rejected.getRecipientId()).isEqualTo(third.getId());
        assertThat(rejected.getFailureReason()).contains("not registered");
        assertThat(auditTrail.getPayoutTrail(rejected.getId())).extracting(AuditLog::getAction)
                .containsExactly("COMMISSION_PAYOUT_FAILED");
        assertThat(auditTrail.getSettlementTrail(settlement.getId())).filteredOn(
                        entry -> entry.getAction().equals("SETTLEMENT_PROCESSED"))
                .singleElement()
                .satisfies(entry -> assertThat(entry.getSeverity()).isEqualTo(AuditSeverity.WARNING));

        // When: the number is registered and the failed payouts are retried
        payoutGateway.reset();
        PayoutBatchResult retry = settlementService.retryFailedPayouts(settlement.getId(), "ops-user");

        assertThat(retry.getSuccessfulPayouts()).isEqualTo(1);
        assertThat(payoutRepository.countBySettlementIdAndStatus(settlement.getId(), PayoutStatus.FAILED)).isZero();
        assertThat(settlementRepository.findById(settlement.getId()).orElseThrow().getStatus())
                .isEqualTo(SettlementStatus.PROCESSING);
    }

    @Test
    @DisplayName("Should retry a payout through transient gateway failures")
    void shouldRetryTransientGatewayFailures() {
        givenWorkedExamplePayments();
        Settlement settlement = settlementService.generate(DATE);
        payoutGateway.failNextSubmissions("+254700000001", 2);

        SettlementProcessingResult result = settlementService.process(settlement.getId(), "ops-user",
                true, false, null, null, null);

        assertThat(result.getPayouts().getFailedPayouts()).isZero();
        assertThat(payoutRepository.countBySettlementIdAndStatus(settlement.getId(), PayoutStatus.PROCESSING))
                .isEqualTo(2);
    }

    @Test
    @DisplayName("Should submit payouts and keep the settlement processing during a bank outage")
    void shouldSurviveBankOutage() {
        givenWorkedExamplePayments();
        Settlement settlement = settlementService.generate(DATE);
        bankRail.setSimulateOutage(true);

        SettlementProcessingResult result = settlementService.process(settlement.getId(), "ops-user",
                true, true, "test-secret", null, null);

        assertThat(result.getFinalStatus()).isEqualTo(SettlementStatus.PROCESSING);
        assertThat(result.getPayouts().getSuccessfulPayouts()).isEqualTo(2);
        assertThat(payoutGateway.getSubmissionCount()).isEqualTo(2);
        assertThat(result.getTransfers().getShaTransfer().getStatus()).isEqualTo(TransferStatus.FAILED);
        assertThat(result.getTransfers().getMwuTransfer().getStatus()).isEqualTo(TransferStatus.FAILED);
        // three attempts per portion, the availability retry declines
        assertThat(bankRail.getCallCount()).isEqualTo(6);
        assertThat(transferRepository.findBySettlementId(settlement.getId()))
                .allMatch(transfer -> transfer.getStatus() == TransferStatus.FAILED);

        assertThat(auditTrail.getSettlementTrail(settlement.getId())).extracting(AuditLog::getAction)
                .containsOnlyOnce("SETTLEMENT_PROCESSED")
                .filteredOn(action -> action.equals("BANK_TRANSFER_FAILED"))
                .hasSize(2);
        assertThat(auditTrail.getAlerts()).extracting(AuditLog::getAction)
                .contains("BANK_TRANSFER_FAILED", "MANUAL_INTERVENTION_REQUIRED");
    }

    @Test
    @DisplayName("Should leave the settlement processing when the confirmation secret is wrong")
    void shouldNotCompleteWithWrongSecret() {
        givenWorkedExamplePayments();
        Settlement settlement = settlementService.generate(DATE);

        SettlementProcessingResult result = settlementService.process(settlement.getId(), "ops-user",
                true, true, "not-the-secret", null, null);

        assertThat(result.getFinalStatus()).isEqualTo(SettlementStatus.PROCESSING);
        assertThat(result.getErrors()).hasSize(1);
        assertThat(transferRepository.findBySettlementId(settlement.getId())).isEmpty();
        assertThat(bankRail.getCallCount()).isZero();
    }

    @Test
    @DisplayName("Should write the daily summary report as JSON")
    void shouldWriteDailySummary() throws Exception {
        givenWorkedExamplePayments();
        settlementService.generate(DATE);

        Path report = summaryWriter.writeSummary(DATE);

        assertThat(report.getFileName().toString()).isEqualTo("settlement-summary-2024-03-01.json");
        String json = Files.readString(report);
        assertThat(json).contains("\"totalCollected\"").contains("1000");
    }

    @Test
    @DisplayName("Should delete summaries only once they pass the retention window")
    void shouldCleanupExpiredSummaries() {
        givenWorkedExamplePayments();
        settlementService.generate(DATE);
        Path report = summaryWriter.writeSummary(DATE);

        summaryWriter.cleanupOldReports(DATE.plusDays(30));
        assertThat(report).exists();

        int deleted = summaryWriter.cleanupOldReports(DATE.plusDays(91));
        assertThat(deleted).isGreaterThanOrEqualTo(1);
        assertThat(report).doesNotExist();
    }

    @Test
    @DisplayName("Should report settlements and recipient payouts on the read side")
    void shouldServeReadSide() {
        givenWorkedExamplePayments();
        Settlement settlement = settlementService.generate(DATE);
        settlementService.process(settlement.getId(), "ops-user", true, false, null, null, null);

        List<SettlementSummary> range = settlementService.getSettlementSummary(DATE, DATE);
        assertThat(range).hasSize(1);
        assertThat(range.get(0).getTotalCollected()).isEqualByComparingTo("1000");
        assertThat(settlementService.getPendingSettlements()).isEmpty();

        OverallStats stats = settlementService.getOverallStats(30);
        assertThat(stats.getSettlementsByStatus())
                .containsEntry(SettlementStatus.COMPLETED, 1L)
                .containsEntry(SettlementStatus.PENDING, 0L);

        List<RecipientPayoutView> delegatePayouts = payoutEngine.getPayoutsByRecipient(delegate.getId(), 10);
        assertThat(delegatePayouts).hasSize(1);
        assertThat(delegatePayouts.get(0).getAmount()).isEqualByComparingTo("40");
        assertThat(delegatePayouts.get(0).getStatus()).isEqualTo(PayoutStatus.PROCESSING);

        RecipientCommissionSummary summary = payoutEngine.getCommissionSummary(coordinator.getId(), DATE, DATE);
        assertThat(summary.getTotalPayouts()).isEqualTo(1);
        assertThat(summary.getPendingAmount()).isEqualByComparingTo("20");
        assertThat(summary.getProcessedAmount()).isEqualByComparingTo("0");
    }

    private void givenWorkedExamplePayments() {
        Member payerA = memberRepository.save(member("Payer", "A", "+254711000001", delegate.getId(), coordinator.getId()));
        Member payerB = memberRepository.save(member("Payer", "B", "+254711000002", delegate.getId(), coordinator.getId()));
        savePayment(payerA, "600", "72", "24", "12");
        savePayment(payerB, "400", "48", "16", "8");
    }

    private void savePayment(Member payer, String amount, String sha, String delegateCommission,
                             String coordinatorCommission) {
        paymentRepository.save(Payment.builder()
                .userId(payer.getId())
                .amount(new BigDecimal(amount))
                .shaPortion(new BigDecimal(sha))
                .delegateCommission(new BigDecimal(delegateCommission))
                .coordinatorCommission(new BigDecimal(coordinatorCommission))
                .status(PaymentStatus.COMPLETED)
                .settlementDate(DATE)
                .build());
    }

    private static Member member(String first, String last, String phone,
                                 java.util.UUID delegateId, java.util.UUID coordinatorId) {
        return Member.builder()
                .firstName(first)
                .lastName(last)
                .phoneNumber(phone)
                .delegateId(delegateId)
                .coordinatorId(coordinatorId)
                .build();
    }
}
