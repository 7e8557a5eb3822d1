package com.fintech.settlement.controller;

import com.fintech.settlement.dto.CommissionBreakdown;
import com.fintech.settlement.dto.FailSettlementRequest;
import com.fintech.settlement.dto.GenerateSettlementRequest;
import com.fintech.settlement.dto.OverallStats;
import com.fintech.settlement.dto.PayoutBatchResult;
import com.fintech.settlement.dto.PayoutCallbackRequest;
import com.fintech.settlement.dto.PayoutResult;
import com.fintech.settlement.dto.PayoutStatistics;
import com.fintech.settlement.dto.PayoutStatusUpdateRequest;
import com.fintech.settlement.dto.ProcessSettlementRequest;
import com.fintech.settlement.dto.RecipientCommissionSummary;
import com.fintech.settlement.dto.RecipientPayoutView;
import com.fintech.settlement.dto.SettlementProcessingResult;
import com.fintech.settlement.dto.SettlementSummary;
import com.fintech.settlement.entity.AuditLog;
import com.fintech.settlement.entity.BankTransferRecord;
import com.fintech.settlement.entity.CommissionPayout;
import com.fintech.settlement.entity.Settlement;
import com.fintech.settlement.exception.ValidationException;
import com.fintech.settlement.recovery.HealthReport;
import com.fintech.settlement.recovery.RetryOrchestrator;
import com.fintech.settlement.service.AuditTrailService;
import com.fintech.settlement.service.BankTransferService;
import com.fintech.settlement.service.CommissionPayoutEngine;
import com.fintech.settlement.service.SettlementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for settlement operations.
 * <p>
 * Provides endpoints for:
 * - Generating and processing daily settlements
 * - Retrying failed payouts and failing a stuck settlement
 * - Receiving payout results from the gateway
 * - Settlement, payout and recipient reporting
 */
@RestController
@RequestMapping("/api/v1/settlements")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Settlements", description = "Daily settlement and commission payout API")
public class SettlementController {

    private final SettlementService settlementService;
    private final CommissionPayoutEngine payoutEngine;
    private final BankTransferService bankTransferService;
    private final RetryOrchestrator retryOrchestrator;
    private final AuditTrailService auditTrail;

    @Operation(
            summary = "Generate a daily settlement",
            description = "Aggregates the completed payments of a date into a settlement and creates one pending payout per commission recipient."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Settlement generated",
                    content = @Content(schema = @Schema(implementation = SettlementSummary.class))),
            @ApiResponse(responseCode = "400", description = "Missing or future date"),
            @ApiResponse(responseCode = "409", description = "Settlement already exists for the date")
    })
    @PostMapping("/generate")
    public ResponseEntity<SettlementSummary> generate(@Valid @RequestBody GenerateSettlementRequest request) {
        log.info("Settlement generation for {} requested via API", request.getSettlementDate());
        Settlement settlement = settlementService.generate(request.getSettlementDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(SettlementSummary.from(settlement));
    }

    @Operation(
            summary = "Generate missing settlements",
            description = "Generates settlements for each of the previous days that has completed payments and no settlement yet."
    )
    @ApiResponse(responseCode = "200", description = "Settlements generated")
    @PostMapping("/auto-generate")
    public ResponseEntity<List<SettlementSummary>> autoGenerate(
            @Parameter(description = "Number of previous days to check") @RequestParam(defaultValue = "7") int daysBack) {
        List<SettlementSummary> generated = settlementService.autoGenerateSettlements(daysBack).stream()
                .map(SettlementSummary::from)
                .toList();
        return ResponseEntity.ok(generated);
    }

    @Operation(
            summary = "Process a settlement",
            description = "Moves a pending settlement to processing, submits its commission payouts and executes the SHA and MWU bank transfers."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Processing run finished",
                    content = @Content(schema = @Schema(implementation = SettlementProcessingResult.class))),
            @ApiResponse(responseCode = "401", description = "Invalid confirmation secret"),
            @ApiResponse(responseCode = "404", description = "Settlement not found"),
            @ApiResponse(responseCode = "409", description = "Settlement is not pending or already being processed")
    })
    @PostMapping("/{id}/process")
    public ResponseEntity<SettlementProcessingResult> process(
            @Parameter(description = "Settlement ID") @PathVariable UUID id,
            @Valid @RequestBody ProcessSettlementRequest request) {
        if (request.isInitiateBankTransfers()
                && (request.getConfirmationSecret() == null || request.getConfirmationSecret().isBlank())) {
            throw new ValidationException("A confirmation secret is required to initiate bank transfers");
        }
        log.info("Processing of settlement {} requested by {}", id, request.getOperator());
        SettlementProcessingResult result = settlementService.process(id, request.getOperator(),
                request.isInitiatePayouts(), request.isInitiateBankTransfers(), request.getConfirmationSecret(),
                request.getShaBankDetails(), request.getMwuBankDetails());
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Retry failed payouts", description = "Re-submits the settlement's failed payouts. The settlement status is not changed.")
    @ApiResponse(responseCode = "200", description = "Retry finished")
    @PostMapping("/{id}/retry-payouts")
    public ResponseEntity<PayoutBatchResult> retryFailedPayouts(
            @Parameter(description = "Settlement ID") @PathVariable UUID id,
            @Parameter(description = "Operator name") @RequestParam String operator) {
        return ResponseEntity.ok(settlementService.retryFailedPayouts(id, operator));
    }

    @Operation(summary = "Fail a settlement", description = "Operator action moving a processing settlement to failed.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Settlement failed"),
            @ApiResponse(responseCode = "409", description = "Settlement is not processing")
    })
    @PostMapping("/{id}/fail")
    public ResponseEntity<SettlementSummary> failSettlement(
            @Parameter(description = "Settlement ID") @PathVariable UUID id,
            @Valid @RequestBody FailSettlementRequest request) {
        return ResponseEntity.ok(settlementService.failSettlement(id, request.getOperator(), request.getReason()));
    }

    @Operation(summary = "Get settlement by ID")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Settlement found"),
            @ApiResponse(responseCode = "404", description = "Settlement not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<SettlementSummary> getSettlement(@Parameter(description = "Settlement ID") @PathVariable UUID id) {
        return ResponseEntity.ok(settlementService.getSettlement(id));
    }

    @Operation(summary = "Get settlements in a date range", description = "Returns settlements between two dates, newest first.")
    @GetMapping
    public ResponseEntity<List<SettlementSummary>> getSettlementSummary(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(settlementService.getSettlementSummary(from, to));
    }

    @Operation(summary = "Get pending settlements")
    @GetMapping("/pending")
    public ResponseEntity<List<SettlementSummary>> getPendingSettlements() {
        return ResponseEntity.ok(settlementService.getPendingSettlements());
    }

    @Operation(summary = "Get overall statistics", description = "Totals over the pending and completed settlements of the last N days.")
    @GetMapping("/stats")
    public ResponseEntity<OverallStats> getOverallStats(
            @Parameter(description = "Number of days") @RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(settlementService.getOverallStats(days));
    }

    @Operation(summary = "Get commission breakdown", description = "Delegate and coordinator commissions of a settlement.")
    @GetMapping("/{id}/commissions")
    public ResponseEntity<CommissionBreakdown> getCommissionBreakdown(@PathVariable UUID id) {
        return ResponseEntity.ok(settlementService.getCommissionBreakdown(id));
    }

    @Operation(summary = "Get payout statistics", description = "Payout counts and amounts of a settlement by status.")
    @GetMapping("/{id}/payouts/stats")
    public ResponseEntity<PayoutStatistics> getPayoutStatistics(@PathVariable UUID id) {
        return ResponseEntity.ok(settlementService.getPayoutStatistics(id));
    }

    @Operation(summary = "Get bank transfers", description = "SHA and MWU transfer records of a settlement.")
    @GetMapping("/{id}/transfers")
    public ResponseEntity<List<BankTransferRecord>> getTransfers(@PathVariable UUID id) {
        settlementService.getSettlement(id);
        return ResponseEntity.ok(bankTransferService.getTransfers(id));
    }

    @Operation(summary = "Get settlement audit trail",
            description = "Generation, processing, error and operator entries of a settlement, oldest first.")
    @GetMapping("/{id}/audit")
    public ResponseEntity<List<AuditLog>> getSettlementAudit(@PathVariable UUID id) {
        settlementService.getSettlement(id);
        return ResponseEntity.ok(auditTrail.getSettlementTrail(id));
    }

    @Operation(summary = "Get payout audit trail", description = "Submission and result entries of a payout.")
    @GetMapping("/payouts/{payoutId}/audit")
    public ResponseEntity<List<AuditLog>> getPayoutAudit(@PathVariable UUID payoutId) {
        return ResponseEntity.ok(auditTrail.getPayoutTrail(payoutId));
    }

    @Operation(summary = "Get audit alerts", description = "Error and critical audit entries, newest first.")
    @GetMapping("/audit/alerts")
    public ResponseEntity<List<AuditLog>> getAuditAlerts() {
        return ResponseEntity.ok(auditTrail.getAlerts());
    }

    @Operation(summary = "Submit a single payout", description = "Submits one pending payout to the payout gateway.")
    @PostMapping("/payouts/{payoutId}/submit")
    public ResponseEntity<PayoutResult> submitPayout(@PathVariable UUID payoutId) {
        return ResponseEntity.ok(payoutEngine.processIndividualPayout(payoutId));
    }

    @Operation(summary = "Resolve a payout manually",
            description = "Marks a payout as processed when a transaction reference is given, as failed otherwise.")
    @PostMapping("/payouts/{payoutId}/status")
    public ResponseEntity<CommissionPayout> updatePayoutStatus(@PathVariable UUID payoutId,
                                                               @RequestBody PayoutStatusUpdateRequest request) {
        if (request.getTransactionReference() != null && !request.getTransactionReference().isBlank()) {
            return ResponseEntity.ok(payoutEngine.markAsProcessed(payoutId, request.getTransactionReference(),
                    request.getPaymentMethod()));
        }
        if (request.getFailureReason() == null || request.getFailureReason().isBlank()) {
            throw new ValidationException("Either a transaction reference or a failure reason is required");
        }
        return ResponseEntity.ok(payoutEngine.markAsFailed(payoutId, request.getFailureReason()));
    }

    @Operation(summary = "Payout gateway callback",
            description = "Asynchronous payout result, matched to the payout through its conversation id.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Result applied"),
            @ApiResponse(responseCode = "404", description = "No payout with the conversation id")
    })
    @PostMapping("/payouts/callback")
    public ResponseEntity<CommissionPayout> payoutCallback(@Valid @RequestBody PayoutCallbackRequest request) {
        log.info("Payout callback received for conversation {} with result {}",
                request.getConversationId(), request.getResultCode());
        return ResponseEntity.ok(payoutEngine.handleCallback(request));
    }

    @Operation(summary = "Get a recipient's payouts")
    @GetMapping("/recipients/{recipientId}/payouts")
    public ResponseEntity<List<RecipientPayoutView>> getRecipientPayouts(
            @PathVariable UUID recipientId,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(payoutEngine.getPayoutsByRecipient(recipientId, limit));
    }

    @Operation(summary = "Get a recipient's commission summary")
    @GetMapping("/recipients/{recipientId}/summary")
    public ResponseEntity<RecipientCommissionSummary> getRecipientSummary(
            @PathVariable UUID recipientId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(payoutEngine.getCommissionSummary(recipientId, from, to));
    }

    @Operation(
            summary = "Health check",
            description = "Runs the pre-flight checks used before batch runs: database connectivity and report directory."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Service is healthy"),
            @ApiResponse(responseCode = "503", description = "One or more checks failed")
    })
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        HealthReport report = retryOrchestrator.validateSystemHealth();
        Map<String, Object> health = Map.of(
                "status", report.isHealthy() ? "UP" : "DOWN",
                "issues", report.getIssues()
        );
        return ResponseEntity.status(report.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }
}
