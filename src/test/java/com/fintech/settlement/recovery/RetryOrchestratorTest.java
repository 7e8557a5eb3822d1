package com.fintech.settlement.recovery;

import com.fintech.settlement.exception.GatewayException;
import com.fintech.settlement.exception.RecoveryExhaustedException;
import com.fintech.settlement.exception.SystemException;
import com.fintech.settlement.exception.ValidationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.TransactionStatus;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for RetryOrchestrator.
 * <p>
 * Tests cover:
 * - Backoff between attempts
 * - Non-retryable failures
 * - Recovery action ordering and outcomes
 * - Timeouts and health checks
 */
class RetryOrchestratorTest {

    private ScheduledExecutorService scheduler;
    private SimpleMeterRegistry meterRegistry;
    private RetryOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(4);
        meterRegistry = new SimpleMeterRegistry();
        orchestrator = new RetryOrchestrator(scheduler, meterRegistry, List.of());
        orchestrator.registerPolicy(OperationType.GATEWAY_PAYOUT, policy(3, 20, 2.0, 1000));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Nested
    @DisplayName("Retry Tests")
    class RetryTests {

        @Test
        @DisplayName("Should return result of a first-attempt success without retrying")
        void shouldReturnFirstAttemptResult() {
            AtomicInteger calls = new AtomicInteger();

            String result = orchestrator.executeWithRecovery(OperationType.GATEWAY_PAYOUT,
                    () -> "ok-" + calls.incrementAndGet(), RecoveryContext.empty());

            assertThat(result).isEqualTo("ok-1");
            assertThat(meterRegistry.counter("recovery.operations", "operation", "gateway_payout",
                    "outcome", "success").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should succeed on a later attempt without running recovery actions")
        void shouldSucceedAfterTransientFailures() {
            AtomicInteger calls = new AtomicInteger();
            AtomicInteger recoveries = new AtomicInteger();
            orchestrator.registerRecoveryAction(OperationType.GATEWAY_PAYOUT, action("manual",
                    RecoveryActionType.MANUAL_INTERVENTION, RecoveryPriority.HIGH, (context, failure) -> {
                        recoveries.incrementAndGet();
                        return true;
                    }));

            String result = orchestrator.executeWithRecovery(OperationType.GATEWAY_PAYOUT, () -> {
                if (calls.incrementAndGet() < 3) {
                    throw new GatewayException("timeout", "test");
                }
                return "paid";
            }, RecoveryContext.empty());

            assertThat(result).isEqualTo("paid");
            assertThat(calls.get()).isEqualTo(3);
            assertThat(recoveries.get()).isZero();
            assertThat(meterRegistry.counter("recovery.retries", "operation", "gateway_payout").count())
                    .isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should wait an increasing delay between attempts")
        void shouldBackOffBetweenAttempts() {
            List<Long> startTimes = Collections.synchronizedList(new ArrayList<>());

            assertThatThrownBy(() -> orchestrator.executeWithRecovery(OperationType.GATEWAY_PAYOUT, () -> {
                startTimes.add(System.nanoTime());
                throw new GatewayException("down", "test");
            }, RecoveryContext.empty()))
                    .isInstanceOf(RecoveryExhaustedException.class);

            assertThat(startTimes).hasSize(3);
            long firstGap = TimeUnit.NANOSECONDS.toMillis(startTimes.get(1) - startTimes.get(0));
            long secondGap = TimeUnit.NANOSECONDS.toMillis(startTimes.get(2) - startTimes.get(1));
            assertThat(firstGap).isGreaterThanOrEqualTo(20);
            assertThat(secondGap).isGreaterThanOrEqualTo(40);
        }

        @Test
        @DisplayName("Should cap the delay at the policy maximum")
        void shouldCapDelay() {
            RetryPolicy policy = policy(6, 100, 3.0, 500);

            assertThat(policy.intervalFunction().apply(1)).isEqualTo(100L);
            assertThat(policy.intervalFunction().apply(2)).isEqualTo(300L);
            assertThat(policy.intervalFunction().apply(3)).isEqualTo(500L);
            assertThat(policy.intervalFunction().apply(5)).isEqualTo(500L);
        }

        @Test
        @DisplayName("Should fail immediately on a non-retryable error and skip recovery")
        void shouldNotRetryNonRetryableErrors() {
            AtomicInteger calls = new AtomicInteger();
            AtomicInteger recoveries = new AtomicInteger();
            orchestrator.registerRecoveryAction(OperationType.GATEWAY_PAYOUT, action("retry",
                    RecoveryActionType.RETRY, RecoveryPriority.HIGH, (context, failure) -> {
                        recoveries.incrementAndGet();
                        return true;
                    }));

            assertThatThrownBy(() -> orchestrator.executeWithRecovery(OperationType.GATEWAY_PAYOUT, () -> {
                calls.incrementAndGet();
                throw new ValidationException("Recipient has no phone number");
            }, RecoveryContext.empty()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Recipient has no phone number");

            assertThat(calls.get()).isEqualTo(1);
            assertThat(recoveries.get()).isZero();
        }

        @Test
        @DisplayName("Should fall back to the default policy for an unregistered operation")
        void shouldUseDefaultPolicy() {
            assertThat(orchestrator.policyFor(OperationType.REPORT_CLEANUP)).isEqualTo(RetryPolicy.DEFAULT);
            assertThat(RetryPolicy.DEFAULT.getMaxAttempts()).isEqualTo(3);
            assertThat(RetryPolicy.DEFAULT.getInitialDelay()).isEqualTo(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("Should reject invalid policies")
        void shouldRejectInvalidPolicy() {
            assertThatThrownBy(() -> policy(0, 10, 2.0, 100)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> policy(3, 10, 0.5, 100)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Recovery Tests")
    class RecoveryTests {

        @Test
        @DisplayName("Should run recovery actions in priority order once attempts are exhausted")
        void shouldRunActionsInPriorityOrder() {
            List<String> order = Collections.synchronizedList(new ArrayList<>());
            orchestrator.registerRecoveryAction(OperationType.GATEWAY_PAYOUT, action("low",
                    RecoveryActionType.MANUAL_INTERVENTION, RecoveryPriority.LOW, record(order, "low")));
            orchestrator.registerRecoveryAction(OperationType.GATEWAY_PAYOUT, action("high",
                    RecoveryActionType.MANUAL_INTERVENTION, RecoveryPriority.HIGH, record(order, "high")));
            orchestrator.registerRecoveryAction(OperationType.GATEWAY_PAYOUT, action("medium",
                    RecoveryActionType.SKIP, RecoveryPriority.MEDIUM, record(order, "medium")));

            RecoveryExhaustedException exhausted = catchExhausted(() -> {
                throw new GatewayException("down", "test");
            });

            assertThat(order).containsExactly("high", "medium", "low");
            assertThat(exhausted.getAttempts()).isEqualTo(3);
            assertThat(exhausted.getOperationType()).isEqualTo(OperationType.GATEWAY_PAYOUT);
            assertThat(exhausted.getCause()).isInstanceOf(GatewayException.class);
        }

        @Test
        @DisplayName("Should grant one final invocation when a retry action succeeds")
        void shouldRecoverThroughRetryAction() {
            AtomicInteger calls = new AtomicInteger();
            orchestrator.registerRecoveryAction(OperationType.GATEWAY_PAYOUT, action("retry_when_available",
                    RecoveryActionType.RETRY, RecoveryPriority.HIGH, (context, failure) -> true));

            String result = orchestrator.executeWithRecovery(OperationType.GATEWAY_PAYOUT, () -> {
                if (calls.incrementAndGet() <= 3) {
                    throw new GatewayException("down", "test");
                }
                return "recovered";
            }, RecoveryContext.empty());

            assertThat(result).isEqualTo("recovered");
            assertThat(calls.get()).isEqualTo(4);
            assertThat(meterRegistry.counter("recovery.operations", "operation", "gateway_payout",
                    "outcome", "recovered").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should move on to the next action when a retry action declines")
        void shouldSkipDecliningRetryAction() {
            AtomicInteger calls = new AtomicInteger();
            List<String> order = Collections.synchronizedList(new ArrayList<>());
            orchestrator.registerRecoveryAction(OperationType.GATEWAY_PAYOUT, action("retry",
                    RecoveryActionType.RETRY, RecoveryPriority.HIGH, (context, failure) -> {
                        order.add("retry");
                        return false;
                    }));
            orchestrator.registerRecoveryAction(OperationType.GATEWAY_PAYOUT, action("manual",
                    RecoveryActionType.MANUAL_INTERVENTION, RecoveryPriority.MEDIUM, record(order, "manual")));

            catchExhausted(() -> {
                calls.incrementAndGet();
                throw new GatewayException("down", "test");
            });

            assertThat(calls.get()).isEqualTo(3);
            assertThat(order).containsExactly("retry", "manual");
        }

        @Test
        @DisplayName("Should continue with later actions when an action throws")
        void shouldContinueAfterFailingAction() {
            List<String> order = Collections.synchronizedList(new ArrayList<>());
            orchestrator.registerRecoveryAction(OperationType.GATEWAY_PAYOUT, action("broken",
                    RecoveryActionType.MANUAL_INTERVENTION, RecoveryPriority.HIGH, (context, failure) -> {
                        throw new IllegalStateException("notification channel down");
                    }));
            orchestrator.registerRecoveryAction(OperationType.GATEWAY_PAYOUT, action("manual",
                    RecoveryActionType.MANUAL_INTERVENTION, RecoveryPriority.LOW, record(order, "manual")));

            catchExhausted(() -> {
                throw new GatewayException("down", "test");
            });

            assertThat(order).containsExactly("manual");
        }

        @Test
        @DisplayName("Should mark the context transaction rollback-only on a rollback action")
        void shouldMarkTransactionRollbackOnly() {
            orchestrator.registerPolicy(OperationType.DATABASE_TRANSACTION, policy(2, 10, 1.0, 10));
            orchestrator.registerRecoveryAction(OperationType.DATABASE_TRANSACTION, action("rollback",
                    RecoveryActionType.ROLLBACK, RecoveryPriority.MEDIUM, (context, failure) -> true));
            TransactionStatus transaction = mock(TransactionStatus.class);
            RecoveryContext context = RecoveryContext.builder()
                    .attribute("settlementId", "s-1")
                    .transaction(transaction)
                    .build();

            assertThatThrownBy(() -> orchestrator.executeWithRecovery(OperationType.DATABASE_TRANSACTION, () -> {
                throw new SystemException("connection reset");
            }, context)).isInstanceOf(RecoveryExhaustedException.class);

            verify(transaction).setRollbackOnly();
        }
    }

    @Nested
    @DisplayName("Async And Health Tests")
    class AsyncAndHealthTests {

        @Test
        @DisplayName("Should time out a sequence that exceeds the policy timeout")
        void shouldTimeOut() {
            orchestrator.registerPolicy(OperationType.BANK_TRANSFER, RetryPolicy.builder()
                    .maxAttempts(10)
                    .initialDelay(Duration.ofMillis(50))
                    .backoffMultiplier(1.0)
                    .maxDelay(Duration.ofMillis(50))
                    .timeout(Duration.ofMillis(120))
                    .build());
            AtomicInteger calls = new AtomicInteger();

            assertThatThrownBy(() -> orchestrator.executeWithRecovery(OperationType.BANK_TRANSFER, () -> {
                calls.incrementAndGet();
                throw new GatewayException("slow bank", "test");
            }, RecoveryContext.empty()))
                    .isInstanceOf(SystemException.class)
                    .hasMessageContaining("timed out");

            assertThat(calls.get()).isLessThan(10);
        }

        @Test
        @DisplayName("Should cancel the pending timeout once the call completes")
        void shouldCancelTimeoutOnCompletion() throws Exception {
            ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(2);
            executor.setRemoveOnCancelPolicy(true);
            try {
                RetryOrchestrator withTimeout = new RetryOrchestrator(executor, meterRegistry, List.of());
                withTimeout.registerPolicy(OperationType.REPORT_GENERATION, RetryPolicy.builder()
                        .maxAttempts(1)
                        .initialDelay(Duration.ofMillis(10))
                        .backoffMultiplier(1.0)
                        .maxDelay(Duration.ofMillis(10))
                        .timeout(Duration.ofMinutes(5))
                        .build());

                String result = withTimeout.executeWithRecovery(OperationType.REPORT_GENERATION,
                        () -> "written", RecoveryContext.empty());

                assertThat(result).isEqualTo("written");
                long deadline = System.currentTimeMillis() + 1000;
                while (!executor.getQueue().isEmpty() && System.currentTimeMillis() < deadline) {
                    Thread.sleep(10);
                }
                assertThat(executor.getQueue()).isEmpty();
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should complete the future exceptionally instead of throwing")
        void shouldCompleteAsyncFutureExceptionally() throws Exception {
            CompletableFuture<String> future = orchestrator.executeWithRecoveryAsync(OperationType.GATEWAY_PAYOUT,
                    () -> {
                        throw new ValidationException("bad amount");
                    }, null);

            assertThatThrownBy(future::get)
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Should collect the issues of failing health checks without throwing")
        void shouldReportHealthIssues() {
            HealthCheck healthy = healthCheck("database", Optional.empty());
            HealthCheck unhealthy = healthCheck("reports", Optional.of("Report directory is not writable"));
            HealthCheck throwing = new HealthCheck() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public Optional<String> check() {
                    throw new IllegalStateException("boom");
                }
            };
            RetryOrchestrator withChecks = new RetryOrchestrator(scheduler, meterRegistry,
                    List.of(healthy, unhealthy, throwing));

            HealthReport report = withChecks.validateSystemHealth();

            assertThat(report.isHealthy()).isFalse();
            assertThat(report.getIssues()).hasSize(2);
            assertThat(report.getIssues().get(0)).isEqualTo("Report directory is not writable");
            assertThat(report.getIssues().get(1)).contains("broken").contains("boom");
        }

        @Test
        @DisplayName("Should report healthy when every check passes")
        void shouldReportHealthy() {
            RetryOrchestrator withChecks = new RetryOrchestrator(scheduler, meterRegistry,
                    List.of(healthCheck("database", Optional.empty())));

            assertThat(withChecks.validateSystemHealth().isHealthy()).isTrue();
        }
    }

    private RecoveryExhaustedException catchExhausted(Callable<String> operation) {
        try {
            orchestrator.executeWithRecovery(OperationType.GATEWAY_PAYOUT, operation, RecoveryContext.empty());
        } catch (RecoveryExhaustedException e) {
            return e;
        }
        throw new AssertionError("Expected RecoveryExhaustedException");
    }

    private static RecoveryHandler record(List<String> order, String id) {
        return (context, failure) -> {
            order.add(id);
            return true;
        };
    }

    private static RecoveryAction action(String id, RecoveryActionType type, RecoveryPriority priority,
                                         RecoveryHandler handler) {
        return RecoveryAction.builder()
                .id(id)
                .type(type)
                .priority(priority)
                .description(id)
                .handler(handler)
                .build();
    }

    private static RetryPolicy policy(int attempts, long initialMillis, double multiplier, long maxMillis) {
        return RetryPolicy.builder()
                .maxAttempts(attempts)
                .initialDelay(Duration.ofMillis(initialMillis))
                .backoffMultiplier(multiplier)
                .maxDelay(Duration.ofMillis(maxMillis))
                .build();
    }

    private static HealthCheck healthCheck(String name, Optional<String> issue) {
        return new HealthCheck() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Optional<String> check() {
                return issue;
            }
        };
    }
}
