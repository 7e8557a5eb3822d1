package com.fintech.settlement.service;

import com.fintech.settlement.config.SettlementProperties;
import com.fintech.settlement.dto.BankAccountDetails;
import com.fintech.settlement.dto.SettlementTransferResult;
import com.fintech.settlement.dto.TransferResult;
import com.fintech.settlement.entity.BankTransferRecord;
import com.fintech.settlement.entity.TransferPortion;
import com.fintech.settlement.entity.TransferStatus;
import com.fintech.settlement.exception.SystemException;
import com.fintech.settlement.exception.TransferAuthorizationException;
import com.fintech.settlement.exception.ValidationException;
import com.fintech.settlement.recovery.OperationType;
import com.fintech.settlement.recovery.RecoveryContext;
import com.fintech.settlement.recovery.RetryOrchestrator;
import com.fintech.settlement.repository.BankTransferRecordRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Moves a settlement's SHA and MWU shares to their bank accounts.
 * <p>
 * Transfers require the operator's confirmation secret. Each (settlement, portion) has
 * one {@link BankTransferRecord}; once it is completed, repeating the transfer returns
 * the recorded outcome without calling the bank again.
 */
@Service
@Slf4j
public class BankTransferService {

    private final BankTransferRecordRepository transferRepository;
    private final BankTransferClient bankClient;
    private final RetryOrchestrator retryOrchestrator;
    private final SettlementProperties properties;
    private final MeterRegistry meterRegistry;

    private Timer transferTimer;

    public BankTransferService(BankTransferRecordRepository transferRepository,
                               BankTransferClient bankClient,
                               RetryOrchestrator retryOrchestrator,
                               SettlementProperties properties,
                               MeterRegistry meterRegistry) {
        this.transferRepository = transferRepository;
        this.bankClient = bankClient;
        this.retryOrchestrator = retryOrchestrator;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        transferTimer = Timer.builder("settlement.bank.transfer.duration")
                .description("Time taken by a bank transfer including retries")
                .register(meterRegistry);
    }

    public TransferResult processShaTransfer(UUID settlementId, BigDecimal amount, String confirmationSecret,
                                             BankAccountDetails bankDetails) {
        validateConfirmationSecret(confirmationSecret);
        return transfer(settlementId, TransferPortion.SHA, amount, bankDetails);
    }

    public TransferResult processMwuTransfer(UUID settlementId, BigDecimal amount, String confirmationSecret,
                                             BankAccountDetails bankDetails) {
        validateConfirmationSecret(confirmationSecret);
        return transfer(settlementId, TransferPortion.MWU, amount, bankDetails);
    }

    /**
     * Runs both transfers concurrently. A failure of one never affects the other; both
     * outcomes are reported.
     */
    public SettlementTransferResult processSettlementTransfers(UUID settlementId,
                                                               BigDecimal shaAmount,
                                                               BigDecimal mwuAmount,
                                                               String confirmationSecret,
                                                               BankAccountDetails shaBankDetails,
                                                               BankAccountDetails mwuBankDetails) {
        validateConfirmationSecret(confirmationSecret);

        log.info("Starting bank transfers for settlement {}: SHA={}, MWU={}", settlementId, shaAmount, mwuAmount);

        CompletableFuture<TransferResult> sha = transferAsync(settlementId, TransferPortion.SHA, shaAmount, shaBankDetails);
        CompletableFuture<TransferResult> mwu = transferAsync(settlementId, TransferPortion.MWU, mwuAmount, mwuBankDetails);

        SettlementTransferResult result = SettlementTransferResult.builder()
                .settlementId(settlementId)
                .shaTransfer(sha.join())
                .mwuTransfer(mwu.join())
                .build();

        log.info("Bank transfers for settlement {} finished: SHA {}, MWU {}", settlementId,
                result.getShaTransfer().getStatus(), result.getMwuTransfer().getStatus());
        return result;
    }

    public List<BankTransferRecord> getTransfers(UUID settlementId) {
        return transferRepository.findBySettlementId(settlementId);
    }

    private TransferResult transfer(UUID settlementId, TransferPortion portion, BigDecimal amount,
                                    BankAccountDetails bankDetails) {
        return transferAsync(settlementId, portion, amount, bankDetails).join();
    }

    /**
     * The returned future never fails: errors are recorded and reported as a failed result.
     */
    private CompletableFuture<TransferResult> transferAsync(UUID settlementId, TransferPortion portion,
                                                            BigDecimal amount, BankAccountDetails bankDetails) {
        if (amount == null || amount.signum() < 0) {
            return CompletableFuture.completedFuture(recordFailure(settlementId, portion, amount,
                    new ValidationException("Transfer amount must not be negative")));
        }

        BankAccountDetails account = resolveAccount(portion, bankDetails);
        RecoveryContext context = RecoveryContext.builder()
                .attribute("settlementId", settlementId)
                .attribute("portion", portion)
                .attribute("amount", amount)
                .build();
        Timer.Sample sample = Timer.start(meterRegistry);

        return retryOrchestrator.executeWithRecoveryAsync(OperationType.BANK_TRANSFER,
                        () -> executeTransfer(settlementId, portion, amount, account), context)
                .exceptionally(error -> recordFailure(settlementId, portion, amount,
                        error instanceof CompletionException && error.getCause() != null ? error.getCause() : error))
                .whenComplete((result, error) -> sample.stop(transferTimer));
    }

    /**
     * One transfer attempt.
     */
    TransferResult executeTransfer(UUID settlementId, TransferPortion portion, BigDecimal amount,
                                   BankAccountDetails account) {
        BankTransferRecord record = transferRepository.findBySettlementIdAndPortion(settlementId, portion)
                .orElse(null);

        if (record != null && record.getStatus() == TransferStatus.COMPLETED) {
            log.info("{} transfer for settlement {} already completed as {}", portion, settlementId,
                    record.getTransactionId());
            return toResult(record);
        }

        if (record == null) {
            record = createRecord(settlementId, portion, amount, account);
        } else {
            applyAccount(record, account);
            record.setAmount(amount);
            record.setStatus(TransferStatus.PENDING);
        }

        if (amount.signum() == 0) {
            log.info("{} transfer for settlement {} is zero, nothing to send", portion, settlementId);
            record.setStatus(TransferStatus.COMPLETED);
            record.setCompletedAt(LocalDateTime.now());
            record.setFailureReason(null);
            return toResult(transferRepository.save(record));
        }

        String transactionId;
        try {
            transactionId = bankClient.submit(amount, account, reference(settlementId, portion));
        } catch (RuntimeException e) {
            record.setFailureReason(truncate(e.getMessage()));
            transferRepository.save(record);
            throw e;
        }

        record.setStatus(TransferStatus.COMPLETED);
        record.setTransactionId(transactionId);
        record.setCompletedAt(LocalDateTime.now());
        record.setFailureReason(null);
        BankTransferRecord saved = transferRepository.save(record);

        log.info("{} transfer of {} for settlement {} completed via {}, transaction {}", portion, amount,
                settlementId, bankClient.getGatewayName(), transactionId);
        return toResult(saved);
    }

    private BankTransferRecord createRecord(UUID settlementId, TransferPortion portion, BigDecimal amount,
                                            BankAccountDetails account) {
        BankTransferRecord record = BankTransferRecord.builder()
                .settlementId(settlementId)
                .portion(portion)
                .amount(amount)
                .build();
        applyAccount(record, account);
        try {
            return transferRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            // another attempt inserted it first
            return transferRepository.findBySettlementIdAndPortion(settlementId, portion)
                    .orElseThrow(() -> e);
        }
    }

    private TransferResult recordFailure(UUID settlementId, TransferPortion portion, BigDecimal amount,
                                         Throwable error) {
        String reason = error.getMessage();
        log.error("{} transfer for settlement {} failed: {}", portion, settlementId, reason);
        try {
            transferRepository.findBySettlementIdAndPortion(settlementId, portion)
                    .filter(record -> record.getStatus() != TransferStatus.COMPLETED)
                    .ifPresent(record -> {
                        record.setStatus(TransferStatus.FAILED);
                        record.setFailureReason(truncate(reason));
                        transferRepository.save(record);
                    });
        } catch (RuntimeException saveError) {
            log.error("Failed to save failure state of {} transfer for settlement {}", portion, settlementId,
                    saveError);
        }
        return TransferResult.failed(settlementId, portion, amount, reason);
    }

    /**
     * Compares the presented secret with the configured one in constant time.
     */
    void validateConfirmationSecret(String confirmationSecret) {
        String expected = properties.getBankTransfer().getConfirmationSecret();
        if (expected == null || expected.isBlank()) {
            throw new SystemException("Bank transfer confirmation secret is not configured");
        }
        if (confirmationSecret == null
                || !MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                confirmationSecret.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Bank transfer rejected: invalid confirmation secret");
            throw new TransferAuthorizationException("Invalid bank transfer confirmation secret");
        }
    }

    BankAccountDetails resolveAccount(TransferPortion portion, BankAccountDetails override) {
        SettlementProperties.Account configured = portion == TransferPortion.SHA
                ? properties.getBankTransfer().getSha()
                : properties.getBankTransfer().getMwu();

        BankAccountDetails base = BankAccountDetails.builder()
                .bankName(configured.getBankName())
                .accountNumber(configured.getAccountNumber())
                .accountName(configured.getAccountName())
                .branchCode(configured.getBranchCode())
                .swiftCode(configured.getSwiftCode())
                .build();
        return base.mergedWith(override);
    }

    private static void applyAccount(BankTransferRecord record, BankAccountDetails account) {
        record.setBankName(account.getBankName());
        record.setAccountNumber(account.getAccountNumber());
        record.setAccountName(account.getAccountName());
        record.setBranchCode(account.getBranchCode());
        record.setSwiftCode(account.getSwiftCode());
    }

    private static String reference(UUID settlementId, TransferPortion portion) {
        return settlementId + "-" + portion.name();
    }

    private static TransferResult toResult(BankTransferRecord record) {
        return TransferResult.builder()
                .settlementId(record.getSettlementId())
                .portion(record.getPortion())
                .amount(record.getAmount())
                .status(record.getStatus())
                .transactionId(record.getTransactionId())
                .error(record.getFailureReason())
                .completedAt(record.getCompletedAt())
                .build();
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= 500) {
            return reason;
        }
        return reason.substring(0, 500);
    }
}
