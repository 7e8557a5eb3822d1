package com.fintech.settlement.recovery;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class DatabaseHealthCheck implements HealthCheck {

    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final DataSource dataSource;

    @Override
    public String getName() {
        return "database";
    }

    @Override
    public Optional<String> check() {
        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                return Optional.of("Database connection is not valid");
            }
            return Optional.empty();
        } catch (SQLException e) {
            return Optional.of("Database connectivity issue: " + e.getMessage());
        }
    }
}
