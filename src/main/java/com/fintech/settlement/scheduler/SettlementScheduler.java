package com.fintech.settlement.scheduler;

import com.fintech.settlement.config.SettlementProperties;
import com.fintech.settlement.dto.SettlementProcessingResult;
import com.fintech.settlement.entity.Settlement;
import com.fintech.settlement.exception.SettlementConflictException;
import com.fintech.settlement.exception.SettlementException;
import com.fintech.settlement.recovery.OperationType;
import com.fintech.settlement.recovery.RecoveryContext;
import com.fintech.settlement.recovery.RetryOrchestrator;
import com.fintech.settlement.service.DailySummaryWriter;
import com.fintech.settlement.service.SettlementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Time-of-day triggers for the settlement cycle.
 * <p>
 * - 23:55 daily: generate today's settlement (and process it when auto-process is on)
 * - 00:30 daily: write yesterday's JSON summary
 * - 02:00 Sundays: delete summaries past the retention window
 * <p>
 * Every run goes through the retry orchestrator. Failures are logged, never rethrown,
 * so one bad night does not stop later triggers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementScheduler {

    private final SettlementService settlementService;
    private final DailySummaryWriter summaryWriter;
    private final RetryOrchestrator retryOrchestrator;
    private final SettlementProperties properties;

    @Scheduled(cron = "${settlement.scheduler.generation-cron:0 55 23 * * *}",
            zone = "${settlement.scheduler.zone:Africa/Nairobi}")
    public void runDailySettlement() {
        if (!properties.getScheduler().isEnabled()) {
            log.debug("Scheduler is disabled, skipping settlement generation");
            return;
        }

        LocalDate today = today();
        log.info("Starting scheduled settlement generation for {}", today);

        Settlement settlement;
        try {
            settlement = retryOrchestrator.executeWithRecovery(OperationType.SETTLEMENT_GENERATION,
                    () -> settlementService.generate(today),
                    RecoveryContext.of("settlementDate", today));
        } catch (SettlementConflictException e) {
            log.info("Settlement for {} already exists, skipping generation", today);
            return;
        } catch (SettlementException e) {
            log.error("Scheduled settlement generation for {} failed: {}", today, e.getMessage());
            return;
        } catch (Exception e) {
            log.error("Scheduled settlement generation for {} failed with unexpected error", today, e);
            return;
        }

        if (properties.getScheduler().isAutoProcess()) {
            processGenerated(settlement);
        }
    }

    private void processGenerated(Settlement settlement) {
        String operator = properties.getScheduler().getOperator();
        try {
            SettlementProcessingResult result = retryOrchestrator.executeWithRecovery(
                    OperationType.SETTLEMENT_PROCESSING,
                    () -> settlementService.process(settlement.getId(), operator, true, true),
                    RecoveryContext.builder()
                            .attribute("settlementId", settlement.getId())
                            .attribute("processedBy", operator)
                            .build());

            log.info("Scheduled processing of settlement {} finished in {}ms with status {}",
                    settlement.getId(), result.getDurationMs(), result.getFinalStatus());
        } catch (Exception e) {
            log.error("Scheduled processing of settlement {} failed: {}", settlement.getId(), e.getMessage());
        }
    }

    @Scheduled(cron = "${settlement.scheduler.report-cron:0 30 0 * * *}",
            zone = "${settlement.scheduler.zone:Africa/Nairobi}")
    public void runDailyReport() {
        if (!properties.getScheduler().isEnabled()) {
            log.debug("Scheduler is disabled, skipping daily report");
            return;
        }

        LocalDate yesterday = today().minusDays(1);
        try {
            Path file = retryOrchestrator.executeWithRecovery(OperationType.REPORT_GENERATION,
                    () -> summaryWriter.writeSummary(yesterday),
                    RecoveryContext.of("settlementDate", yesterday));
            log.info("Daily summary report for {} written to {}", yesterday, file);
        } catch (SettlementException e) {
            log.warn("Daily summary report for {} skipped: {}", yesterday, e.getMessage());
        } catch (Exception e) {
            log.error("Daily summary report for {} failed with unexpected error", yesterday, e);
        }
    }

    @Scheduled(cron = "${settlement.scheduler.cleanup-cron:0 0 2 * * SUN}",
            zone = "${settlement.scheduler.zone:Africa/Nairobi}")
    public void runReportCleanup() {
        if (!properties.getScheduler().isEnabled()) {
            log.debug("Scheduler is disabled, skipping report cleanup");
            return;
        }

        LocalDate today = today();
        try {
            Integer deleted = retryOrchestrator.executeWithRecovery(OperationType.REPORT_CLEANUP,
                    () -> summaryWriter.cleanupOldReports(today),
                    RecoveryContext.of("retentionDays", properties.getReports().getRetentionDays()));
            log.info("Report cleanup removed {} files", deleted);
        } catch (Exception e) {
            log.error("Report cleanup failed: {}", e.getMessage());
        }
    }

    private LocalDate today() {
        return LocalDate.now(ZoneId.of(properties.getScheduler().getZone()));
    }
}
