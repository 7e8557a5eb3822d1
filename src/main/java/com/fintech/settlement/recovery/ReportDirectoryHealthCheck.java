package com.fintech.settlement.recovery;

import com.fintech.settlement.config.SettlementProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Verifies the report directory exists and is writable by writing and deleting a marker file.
 */
@Component
@RequiredArgsConstructor
public class ReportDirectoryHealthCheck implements HealthCheck {

    private static final String MARKER_FILE = ".health_check";

    private final SettlementProperties properties;

    @Override
    public String getName() {
        return "report-directory";
    }

    @Override
    public Optional<String> check() {
        Path directory = properties.getReports().directoryPath();
        try {
            Files.createDirectories(directory);
            Path marker = directory.resolve(MARKER_FILE);
            Files.writeString(marker, "ok");
            Files.delete(marker);
            return Optional.empty();
        } catch (IOException e) {
            return Optional.of("Report directory " + directory.toAbsolutePath() + " is not writable: " + e.getMessage());
        }
    }
}
