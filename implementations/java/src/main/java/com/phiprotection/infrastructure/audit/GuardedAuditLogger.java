package com.phiprotection.infrastructure.audit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every audit call on a bounded pool with a deadline and applies the
 * configured {@link AuditFailurePolicy} when the sink fails, times out or is saturated.
 *
 * <p>A write that has already started cannot be interrupted once the deadline passes. Under
 * {@link AuditFailurePolicy#FAIL_CLOSED} the caller's operation is rejected, so if the late write
 * still lands, a compensating failure entry for the same action is appended after it.
 */
@Slf4j
public class GuardedAuditLogger implements AuditLogger {

    public static final String FAILURE_METER = "phi.audit.sink.failures";
    static final String LATE_WRITE_REASON = "Operation rejected after audit timeout";

    private final AuditLogger delegate;
    private final Executor executor;
    private final Duration timeout;
    private final AuditFailurePolicy policy;
    private final Counter failures;

    public GuardedAuditLogger(
            AuditLogger delegate,
            Executor executor,
            Duration timeout,
            AuditFailurePolicy policy,
            MeterRegistry meterRegistry) {
        this.delegate = delegate;
        this.executor = executor;
        this.timeout = timeout;
        this.policy = policy;
        this.failures = Counter.builder(FAILURE_METER)
            .description("Audit entries that could not be written")
            .tag("policy", policy.name())
            .register(meterRegistry);
    }

    @Override
    public void logPatientAccess(
            String actorId,
            String subjectId,
            AuditAction action,
            String sourceIp,
            boolean success,
            Map<String, Object> metadata) {
        dispatch(action,
            () -> delegate.logPatientAccess(actorId, subjectId, action, sourceIp, success, metadata),
            compensation(actorId, subjectId, action, sourceIp));
    }

    @Override
    public void logPHIEncryption(String actorId, String subjectId, String sourceIp) {
        dispatch(AuditAction.ENCRYPT_DATA,
            () -> delegate.logPHIEncryption(actorId, subjectId, sourceIp),
            compensation(actorId, subjectId, AuditAction.ENCRYPT_DATA, sourceIp));
    }

    @Override
    public void logPHIDecryption(String actorId, String subjectId, String sourceIp) {
        dispatch(AuditAction.DECRYPT_DATA,
            () -> delegate.logPHIDecryption(actorId, subjectId, sourceIp),
            compensation(actorId, subjectId, AuditAction.DECRYPT_DATA, sourceIp));
    }

    @Override
    public void logAudit(
            String actorId,
            String subjectLabel,
            AuditAction action,
            String sourceIp,
            boolean success,
            Map<String, Object> metadata) {
        dispatch(action,
            () -> delegate.logAudit(actorId, subjectLabel, action, sourceIp, success, metadata),
            compensation(actorId, subjectLabel, action, sourceIp));
    }

    public AuditFailurePolicy getPolicy() {
        return policy;
    }

    private Runnable compensation(String actorId, String subject, AuditAction action, String sourceIp) {
        return () -> delegate.logAudit(actorId, subject, action, sourceIp, false,
            Map.of("reason", LATE_WRITE_REASON));
    }

    private void dispatch(AuditAction action, Runnable call, Runnable compensation) {
        CompletableFuture<Void> pending;
        try {
            pending = CompletableFuture.runAsync(call, executor);
        } catch (RejectedExecutionException e) {
            handleFailure(action, e);
            return;
        }

        try {
            pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handleFailure(action, e);
        } catch (ExecutionException e) {
            handleFailure(action, e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException e) {
            if (policy == AuditFailurePolicy.FAIL_CLOSED) {
                compensateLateWrite(action, pending, compensation);
            }
            handleFailure(action, e);
        }
    }

    private void compensateLateWrite(AuditAction action, CompletableFuture<Void> pending, Runnable compensation) {
        pending
            .thenRunAsync(compensation, executor)
            .whenComplete((ignored, error) -> {
                if (error == null) {
                    log.warn("AUDIT LATE WRITE compensated: action={}", action);
                } else if (pending.isCompletedExceptionally()) {
                    // the late write failed too, so nothing needs compensating
                    log.debug("AUDIT LATE WRITE never landed: action={}", action);
                } else {
                    log.error("AUDIT LATE WRITE not compensated: action={}, cause={}",
                        action, error.getClass().getSimpleName());
                }
            });
    }

    private void handleFailure(AuditAction action, Throwable cause) {
        failures.increment();
        log.error("AUDIT SINK FAILURE: action={}, policy={}, cause={}",
            action, policy, cause.getClass().getSimpleName());

        if (policy == AuditFailurePolicy.FAIL_CLOSED) {
            throw new AuditSinkFailureException("Audit trail unavailable", cause);
        }
    }
}
