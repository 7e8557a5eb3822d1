package com.fintech.settlement.service;

import com.fintech.settlement.dto.BankAccountDetails;
import com.fintech.settlement.exception.GatewayException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulated bank rail. A reference that already went through returns its original
 * transaction id instead of moving the money again.
 */
@Service
@Slf4j
public class MockBankTransferClient implements BankTransferClient {

    private static final String GATEWAY_NAME = "MockBankRail";

    private final Map<String, String> executed = new ConcurrentHashMap<>();
    private final AtomicInteger callCount = new AtomicInteger();
    private final Random random = new Random();

    @Value("${gateway.bank.mock.failure-rate:0.05}")
    private double failureRate;

    @Value("${gateway.bank.mock.latency-ms:100}")
    private int latencyMs;

    private volatile boolean simulateOutage = false;

    @Override
    @CircuitBreaker(name = "bankTransfer", fallbackMethod = "submitFallback")
    public String submit(BigDecimal amount, BankAccountDetails account, String reference) {
        callCount.incrementAndGet();
        log.debug("Submitting bank transfer {} of {} to account {}", reference, amount,
                account == null ? null : account.getAccountNumber());

        simulateLatency();

        if (simulateOutage) {
            throw new GatewayException("Bank rail is currently unavailable", GATEWAY_NAME, reference);
        }
        if (account == null || account.getAccountNumber() == null) {
            throw new GatewayException("Destination account number is missing", GATEWAY_NAME, reference, false);
        }

        String existing = executed.get(reference);
        if (existing != null) {
            log.info("Bank transfer {} already executed as {}", reference, existing);
            return existing;
        }

        if (random.nextDouble() < failureRate) {
            throw new GatewayException("Simulated timeout while contacting bank", GATEWAY_NAME, reference);
        }

        String transactionId = "BT" + System.currentTimeMillis() + String.format("%04d", random.nextInt(10000));
        executed.put(reference, transactionId);
        return transactionId;
    }

    public String submitFallback(BigDecimal amount, BankAccountDetails account, String reference, Throwable throwable) {
        if (throwable instanceof GatewayException) {
            throw (GatewayException) throwable;
        }
        log.warn("Circuit breaker triggered for bank transfer {}. Error: {}", reference, throwable.getMessage());
        throw new GatewayException("Bank rail circuit breaker is open. Service temporarily unavailable.",
                GATEWAY_NAME, reference, throwable);
    }

    private void simulateLatency() {
        if (latencyMs > 0) {
            try {
                Thread.sleep(random.nextInt(latencyMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public String getGatewayName() {
        return GATEWAY_NAME;
    }

    @Override
    public boolean isAvailable() {
        return !simulateOutage;
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Bank rail outage simulation set to: {}", outage);
    }

    public int getCallCount() {
        return callCount.get();
    }

    public void reset() {
        executed.clear();
        callCount.set(0);
        simulateOutage = false;
    }
}
