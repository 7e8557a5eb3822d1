package com.fintech.settlement.recovery;

import java.util.Optional;

/**
 * One pre-flight check run by {@link RetryOrchestrator#validateSystemHealth()}.
 */
public interface HealthCheck {

    String getName();

    /**
     * @return a description of the problem, or empty if healthy
     */
    Optional<String> check();
}
