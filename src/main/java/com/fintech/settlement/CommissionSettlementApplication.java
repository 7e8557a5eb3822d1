package com.fintech.settlement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Commission Settlement Service
 * <p>
 * Turns each day's completed payments into a settlement, pays the delegate and
 * coordinator commissions it owes, and moves the SHA and MWU shares to their bank accounts.
 * <p>
 * Key Features:
 * - Scheduled end-of-day settlement generation and summary reports
 * - Retry with exponential backoff and prioritised recovery actions
 * - Idempotent payout and bank transfer submission
 * - Metrics and audit logging
 */
@SpringBootApplication
@EnableScheduling
public class CommissionSettlementApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommissionSettlementApplication.class, args);
    }
}
