package com.fintech.settlement.service;

import com.fintech.settlement.dto.GatewaySubmission;
import com.fintech.settlement.exception.GatewayException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Simulated mobile-money gateway.
 * <p>
 * Accepts requests with a fresh conversation id and fails a configurable share of them the
 * way a flaky network would. A repeated reference gets its original acceptance back. It can
 * be told to reject specific phone numbers or to be down altogether. Results are never
 * called back; tests and operators post them.
 */
@Service
@Slf4j
public class MockPayoutGatewayClient implements PayoutGatewayClient {

    private static final String GATEWAY_NAME = "MockPayoutGateway";

    private final Map<String, GatewaySubmission> accepted = new ConcurrentHashMap<>();
    private final Set<String> rejectedContacts = ConcurrentHashMap.newKeySet();
    private final Map<String, Integer> transientFailures = new ConcurrentHashMap<>();

    private final Random random = new Random();

    @Value("${gateway.payout.mock.failure-rate:0.1}")
    private double failureRate;

    @Value("${gateway.payout.mock.latency-ms:50}")
    private int latencyMs;

    private volatile boolean simulateOutage = false;

    @Override
    @CircuitBreaker(name = "payoutGateway", fallbackMethod = "submitFallback")
    public GatewaySubmission submit(BigDecimal amount, String contact, String reference) {
        log.debug("Submitting payout {} of {} to {}", reference, amount, contact);

        simulateLatency();

        if (simulateOutage) {
            throw new GatewayException("Payout gateway is currently unavailable", GATEWAY_NAME, reference);
        }

        if (contact != null && rejectedContacts.contains(contact)) {
            throw new GatewayException("Recipient " + contact + " is not registered for mobile money",
                    GATEWAY_NAME, reference, false);
        }

        GatewaySubmission existing = accepted.get(reference);
        if (existing != null) {
            log.info("Payout {} already accepted with conversation id {}", reference, existing.getConversationId());
            return existing;
        }

        if (consumeTransientFailure(contact) || random.nextDouble() < failureRate) {
            throw new GatewayException("Simulated network failure while contacting payout gateway",
                    GATEWAY_NAME, reference);
        }

        GatewaySubmission submission = GatewaySubmission.builder()
                .conversationId("AG_" + UUID.randomUUID().toString().replace("-", ""))
                .originatorConversationId(reference)
                .responseCode("0")
                .responseDescription("Accept the service request successfully.")
                .build();
        accepted.put(reference, submission);

        log.debug("Payout {} accepted with conversation id {}", reference, submission.getConversationId());
        return submission;
    }

    /**
     * Fallback when the call failed or the circuit is open. Gateway errors keep their
     * retryable flag; anything else becomes a retryable gateway error.
     */
    public GatewaySubmission submitFallback(BigDecimal amount, String contact, String reference, Throwable throwable) {
        if (throwable instanceof GatewayException) {
            throw (GatewayException) throwable;
        }
        log.warn("Circuit breaker triggered for payout {}. Error: {}", reference, throwable.getMessage());
        throw new GatewayException("Payout gateway circuit breaker is open. Service temporarily unavailable.",
                GATEWAY_NAME, reference, throwable);
    }

    private boolean consumeTransientFailure(String contact) {
        if (contact == null) {
            return false;
        }
        AtomicBoolean failNow = new AtomicBoolean();
        transientFailures.computeIfPresent(contact, (key, count) -> {
            failNow.set(true);
            return count > 1 ? count - 1 : null;
        });
        return failNow.get();
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

    // Simulation control

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Payout gateway outage simulation set to: {}", outage);
    }

    /**
     * Rejects every submission to the given phone number with a permanent error.
     */
    public void rejectContact(String contact) {
        rejectedContacts.add(contact);
    }

    /**
     * Fails the next {@code times} submissions to the given phone number with a transient error.
     */
    public void failNextSubmissions(String contact, int times) {
        transientFailures.put(contact, times);
    }

    public Optional<GatewaySubmission> findSubmission(String reference) {
        return Optional.ofNullable(accepted.get(reference));
    }

    public int getSubmissionCount() {
        return accepted.size();
    }

    public void reset() {
        accepted.clear();
        rejectedContacts.clear();
        transientFailures.clear();
        simulateOutage = false;
    }
}
