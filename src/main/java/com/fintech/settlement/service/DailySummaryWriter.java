package com.fintech.settlement.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fintech.settlement.config.SettlementProperties;
import com.fintech.settlement.dto.CommissionBreakdown;
import com.fintech.settlement.dto.PayoutStatistics;
import com.fintech.settlement.dto.SettlementSummary;
import com.fintech.settlement.exception.ResourceNotFoundException;
import com.fintech.settlement.exception.SystemException;
import com.fintech.settlement.repository.SettlementRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the JSON daily summary of a settlement into the report directory and prunes
 * summaries past the retention window.
 */
@Service
@Slf4j
public class DailySummaryWriter {

    static final String FILE_PREFIX = "settlement-summary-";
    static final String FILE_SUFFIX = ".json";

    private final SettlementRepository settlementRepository;
    private final SettlementService settlementService;
    private final SettlementProperties properties;
    private final ObjectMapper objectMapper;

    public DailySummaryWriter(SettlementRepository settlementRepository,
                              SettlementService settlementService,
                              SettlementProperties properties,
                              ObjectMapper objectMapper) {
        this.settlementRepository = settlementRepository;
        this.settlementService = settlementService;
        this.properties = properties;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return the written file
     * @throws ResourceNotFoundException if no settlement exists for the date
     * @throws SystemException           if the file cannot be written
     */
    public Path writeSummary(LocalDate settlementDate) {
        SettlementSummary settlement = settlementRepository.findBySettlementDate(settlementDate)
                .map(SettlementSummary::from)
                .orElseThrow(() -> new ResourceNotFoundException("Settlement for date", settlementDate));

        CommissionBreakdown breakdown = settlementService.getCommissionBreakdown(settlement.getId());
        PayoutStatistics payouts = settlementService.getPayoutStatistics(settlement.getId());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("generatedAt", LocalDateTime.now());
        report.put("settlement", settlement);
        report.put("payouts", payouts);
        report.put("commissions", breakdown);

        Path directory = properties.getReports().directoryPath();
        Path file = directory.resolve(FILE_PREFIX + settlementDate.format(DateTimeFormatter.ISO_LOCAL_DATE) + FILE_SUFFIX);
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(file.toFile(), report);
        } catch (IOException e) {
            throw new SystemException("Failed to write daily summary " + file, e);
        }

        log.info("Daily summary for {} written to {}", settlementDate, file.toAbsolutePath());
        return file;
    }

    /**
     * Deletes summaries whose settlement date is older than the retention window.
     *
     * @return number of files deleted
     */
    public int cleanupOldReports(LocalDate today) {
        Path directory = properties.getReports().directoryPath();
        if (!Files.isDirectory(directory)) {
            return 0;
        }

        LocalDate cutoff = today.minusDays(properties.getReports().getRetentionDays());
        int deleted = 0;

        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String datePart = name.substring(FILE_PREFIX.length(), name.length() - FILE_SUFFIX.length());
                try {
                    if (LocalDate.parse(datePart).isBefore(cutoff)) {
                        Files.delete(file);
                        deleted++;
                    }
                } catch (DateTimeParseException e) {
                    log.debug("Skipping unrecognised report file {}", name);
                }
            }
        } catch (IOException e) {
            throw new SystemException("Failed to clean up reports in " + directory, e);
        }

        log.info("Deleted {} reports older than {}", deleted, cutoff);
        return deleted;
    }
}
