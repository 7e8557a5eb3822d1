package com.fintech.settlement.recovery;

import com.fintech.settlement.exception.RecoveryExhaustedException;
import com.fintech.settlement.exception.SettlementException;
import com.fintech.settlement.exception.SystemException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.NonTransientDataAccessException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs operations with exponential-backoff retry and, once the attempts are exhausted,
 * the recovery actions registered for the operation type.
 * <p>
 * Attempts run on the supplied scheduler. Waits between attempts are scheduled rather
 * than slept, so no thread is held during a backoff window. Operations must be safe to
 * invoke more than once: a failed attempt may have partially succeeded externally.
 * <p>
 * Only retryable failures are retried. A {@link SettlementException} that reports
 * {@code isRetryable() == false} (validation, conflict, not found, authorization,
 * invalid state) completes the call on the first attempt and runs no recovery.
 */
@Slf4j
public class RetryOrchestrator {

    private static final Comparator<RecoveryAction> BY_PRIORITY =
            Comparator.comparingInt((RecoveryAction action) -> action.getPriority().getWeight()).reversed();

    private final ScheduledExecutorService scheduler;
    private final MeterRegistry meterRegistry;
    private final List<HealthCheck> healthChecks;
    private final Map<OperationType, RetryPolicy> policies = new ConcurrentHashMap<>();
    private final Map<OperationType, List<RecoveryAction>> recoveryActions = new EnumMap<>(OperationType.class);

    public RetryOrchestrator(ScheduledExecutorService scheduler,
                             MeterRegistry meterRegistry,
                             List<HealthCheck> healthChecks) {
        this.scheduler = scheduler;
        this.meterRegistry = meterRegistry;
        this.healthChecks = healthChecks == null ? List.of() : List.copyOf(healthChecks);
    }

    public void registerPolicy(OperationType operationType, RetryPolicy policy) {
        policies.put(operationType, policy);
        log.debug("Registered retry policy for {}: {}", operationType.getKey(), policy);
    }

    public RetryPolicy policyFor(OperationType operationType) {
        return policies.getOrDefault(operationType, RetryPolicy.DEFAULT);
    }

    public synchronized void registerRecoveryAction(OperationType operationType, RecoveryAction action) {
        recoveryActions.computeIfAbsent(operationType, key -> new CopyOnWriteArrayList<>()).add(action);
    }

    public synchronized List<RecoveryAction> getRecoveryActions(OperationType operationType) {
        return List.copyOf(recoveryActions.getOrDefault(operationType, Collections.emptyList()));
    }

    /**
     * Blocking variant of {@link #executeWithRecoveryAsync}. Failures surface unwrapped:
     * non-retryable errors as thrown by the operation, exhaustion as
     * {@link RecoveryExhaustedException}.
     */
    public <T> T executeWithRecovery(OperationType operationType, Callable<T> operation, RecoveryContext context) {
        CompletableFuture<T> future = executeWithRecoveryAsync(operationType, operation, context);
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SystemException(operationType.getKey() + " interrupted", e);
        } catch (ExecutionException e) {
            throw asRuntime(e.getCause());
        }
    }

    public <T> CompletableFuture<T> executeWithRecoveryAsync(OperationType operationType,
                                                             Callable<T> operation,
                                                             RecoveryContext context) {
        RecoveryContext effectiveContext = context == null ? RecoveryContext.empty() : context;
        RetryContext retry = new RetryContext(operationType, policyFor(operationType));
        CompletableFuture<T> promise = new CompletableFuture<>();

        if (retry.getPolicy().getTimeout() != null) {
            ScheduledFuture<?> timeout = scheduler.schedule(() -> {
                if (promise.completeExceptionally(new SystemException(String.format("%s timed out after %s",
                        operationType.getKey(), retry.getPolicy().getTimeout())))) {
                    log.error("{} timed out after {} attempts", operationType.getKey(), retry.getAttempt());
                }
            }, retry.getPolicy().getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            promise.whenComplete((result, error) -> timeout.cancel(false));
        }

        scheduler.execute(() -> attempt(operation, effectiveContext, retry, promise));
        return promise;
    }

    private <T> void attempt(Callable<T> operation, RecoveryContext context, RetryContext retry,
                             CompletableFuture<T> promise) {
        String operationKey = retry.getOperationType().getKey();
        if (promise.isDone()) {
            log.info("{} abandoned before attempt {}: cancelled or timed out", operationKey, retry.getAttempt() + 1);
            return;
        }

        retry.startAttempt();
        log.info("Executing {}, attempt {}/{} {}", operationKey, retry.getAttempt(),
                retry.getPolicy().getMaxAttempts(), context);

        try {
            T result = operation.call();
            if (retry.getAttempt() > 1) {
                log.info("{} succeeded after {} attempts {}", operationKey, retry.getAttempt(), context);
            }
            meterRegistry.counter("recovery.operations", "operation", operationKey, "outcome", "success").increment();
            promise.complete(result);
        } catch (Exception e) {
            Throwable failure = unwrap(e);

            if (!isRetryable(failure)) {
                log.warn("{} failed with non-retryable error: {} {}", operationKey, failure.getMessage(), context);
                meterRegistry.counter("recovery.operations", "operation", operationKey, "outcome", "rejected").increment();
                promise.completeExceptionally(failure);
                return;
            }

            log.warn("{} failed, attempt {}/{}: {} {}", operationKey, retry.getAttempt(),
                    retry.getPolicy().getMaxAttempts(), failure.getMessage(), context);
            meterRegistry.counter("recovery.retries", "operation", operationKey).increment();

            if (retry.hasAttemptsLeft()) {
                long delay = retry.nextDelayMillis();
                log.debug("Next {} attempt in {}ms", operationKey, delay);
                scheduler.schedule(() -> attempt(operation, context, retry, promise), delay, TimeUnit.MILLISECONDS);
            } else {
                recover(operation, context, retry, failure, promise);
            }
        }
    }

    private <T> void recover(Callable<T> operation, RecoveryContext context, RetryContext retry,
                             Throwable failure, CompletableFuture<T> promise) {
        OperationType operationType = retry.getOperationType();
        String operationKey = operationType.getKey();

        log.error("{} failed after all {} attempts: {} {}", operationKey, retry.getAttempt(),
                failure.getMessage(), context);

        List<RecoveryAction> actions = new ArrayList<>(getRecoveryActions(operationType));
        actions.sort(BY_PRIORITY);

        log.info("Triggering {} recovery actions for {} {}", actions.size(), operationKey, context);

        for (RecoveryAction action : actions) {
            if (promise.isDone()) {
                return;
            }
            try {
                log.info("Executing recovery action {} ({}, {}): {}", action.getId(), action.getType(),
                        action.getPriority(), action.getDescription());

                boolean succeeded = action.getHandler().handle(context, failure);

                switch (action.getType()) {
                    case RETRY -> {
                        if (succeeded) {
                            T result = operation.call();
                            log.info("Recovery action {} recovered {}", action.getId(), operationKey);
                            meterRegistry.counter("recovery.operations", "operation", operationKey,
                                    "outcome", "recovered").increment();
                            promise.complete(result);
                            return;
                        }
                    }
                    case ROLLBACK -> {
                        if (context.getTransaction() != null && !context.getTransaction().isCompleted()) {
                            context.getTransaction().setRollbackOnly();
                            log.info("Transaction marked for rollback by {}", action.getId());
                        }
                    }
                    case MANUAL_INTERVENTION ->
                            log.warn("{} flagged for manual intervention by {}", operationKey, action.getId());
                    case SKIP -> log.info("Recovery action {} skipped", action.getId());
                }
            } catch (Exception recoveryError) {
                log.error("Recovery action {} failed: {} (original error: {})", action.getId(),
                        unwrap(recoveryError).getMessage(), failure.getMessage());
            }
        }

        meterRegistry.counter("recovery.operations", "operation", operationKey, "outcome", "exhausted").increment();
        promise.completeExceptionally(new RecoveryExhaustedException(operationType, retry.getAttempt(), failure));
    }

    /**
     * Pre-flight check used before batch runs. Never throws.
     */
    public HealthReport validateSystemHealth() {
        List<String> issues = new ArrayList<>();
        for (HealthCheck check : healthChecks) {
            try {
                Optional<String> issue = check.check();
                issue.ifPresent(problem -> {
                    issues.add(problem);
                    log.error("{} health check failed: {}", check.getName(), problem);
                });
            } catch (Exception e) {
                issues.add(check.getName() + " check failed: " + e.getMessage());
                log.error("{} health check threw", check.getName(), e);
            }
        }
        return HealthReport.of(issues);
    }

    static boolean isRetryable(Throwable failure) {
        if (failure instanceof SettlementException) {
            return ((SettlementException) failure).isRetryable();
        }
        if (failure instanceof NonTransientDataAccessException) {
            return false;
        }
        return failure instanceof Exception;
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static RuntimeException asRuntime(Throwable throwable) {
        Throwable failure = unwrap(throwable);
        if (failure instanceof RuntimeException) {
            return (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        return new SystemException(failure.getMessage(), failure);
    }
}
